package shorts.generator;

import java.util.Map;

import shorts.model.EditorOutput;

/**
 * Blob and metadata store for finished shorts.
 */
public interface ArtifactPublisher {

    String FINAL_VIDEO_URL = "final_video_url";
    String CAPTION_SRT_URL = "caption_srt_url";
    String THUMBNAIL_URL = "thumbnail_url";

    /**
     * Uploads the artifact files and records the result row.
     *
     * @return public urls keyed by {@link #FINAL_VIDEO_URL}, {@link #CAPTION_SRT_URL}
     *         and {@link #THUMBNAIL_URL}; missing keys mean that file was not uploaded
     */
    Map<String, String> publish(String runId, String ownerId, EditorOutput output);
}
