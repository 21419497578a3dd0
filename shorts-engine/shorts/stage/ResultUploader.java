package shorts.stage;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.generator.ArtifactPublisher;
import shorts.graph.CompletionHook;
import shorts.graph.StateUpdate;
import shorts.model.EditorOutput;
import shorts.model.PipelineState;

/**
 * Publishes a finished run's artifact and swaps the local paths for the
 * returned urls. The run completes either way; on failure the local files stay
 * referenced.
 */
public class ResultUploader implements CompletionHook {

    private static final Logger log = LoggerFactory.getLogger(ResultUploader.class);

    private final ArtifactPublisher publisher;

    /**
     * @param publisher may be {@code null} when no artifact store is configured
     */
    public ResultUploader(ArtifactPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public StateUpdate onCompleted(PipelineState state) {
        if (publisher == null) {
            log.info("Run {} upload skipped: no artifact store configured", state.getRunId());
            return StateUpdate.none();
        }
        EditorOutput output = state.getEditorOutput();
        if (output == null || !output.hasVideo()) {
            log.warn("Run {} upload skipped: no rendered video", state.getRunId());
            return StateUpdate.none();
        }

        Map<String, String> urls;
        try {
            urls = publisher.publish(state.getRunId(), state.getOwnerId(), output);
        } catch (RuntimeException e) {
            log.warn("Run {} upload failed; keeping local artifact paths", state.getRunId(), e);
            return StateUpdate.none();
        }
        log.info("Run {} artifact published: {}", state.getRunId(), urls.keySet());

        String video = urls.get(ArtifactPublisher.FINAL_VIDEO_URL);
        String captions = urls.get(ArtifactPublisher.CAPTION_SRT_URL);
        String thumbnail = urls.get(ArtifactPublisher.THUMBNAIL_URL);
        return StateUpdate.of(s -> {
            EditorOutput published = s.getEditorOutput();
            if (video != null) {
                published.setFinalVideoPath(video);
            }
            if (captions != null) {
                published.setCaptionSrtPath(captions);
            }
            if (thumbnail != null) {
                published.setThumbnailPath(thumbnail);
            }
        });
    }
}
