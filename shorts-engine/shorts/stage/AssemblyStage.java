package shorts.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.config.PipelineSettings;
import shorts.gate.HookPromptGate;
import shorts.generator.GeneratorException;
import shorts.generator.MediaToolkit;
import shorts.generator.SpeechSynthesizer;
import shorts.generator.Transcriber;
import shorts.generator.VideoSynthesizer;
import shorts.graph.Stage;
import shorts.graph.StateUpdate;
import shorts.model.AudioSegment;
import shorts.model.AudioSource;
import shorts.model.EditorOutput;
import shorts.model.MediaAssets;
import shorts.model.PipelineState;
import shorts.model.Scene;
import shorts.model.ScriptData;
import shorts.model.TrendData;
import shorts.model.VideoMetadata;
import shorts.timeline.Caption;
import shorts.timeline.CaptionBucket;
import shorts.timeline.RenderPlan;
import shorts.timeline.RenderPlanBuilder;
import shorts.timeline.SceneTimelineComposer;
import shorts.timeline.SrtWriter;

/**
 * Turns the produced media into the final vertical video: transcribe the
 * narration, bucket captions per scene, add the channel intro and the hook
 * video, render, then derive thumbnail, metadata and duration.
 */
public class AssemblyStage extends QualityStage {

    private static final Logger log = LoggerFactory.getLogger(AssemblyStage.class);

    private static final int BANNER_MAX_CHARS = 55;

    private final SpeechSynthesizer speech;
    private final VideoSynthesizer video;
    private final Transcriber transcriber;
    private final MediaToolkit media;
    private final SceneTimelineComposer composer;
    private final PipelineSettings settings;

    public AssemblyStage(SpeechSynthesizer speech,
                         VideoSynthesizer video,
                         Transcriber transcriber,
                         MediaToolkit media,
                         PipelineSettings settings) {
        super(Stage.ASSEMBLE, "Auto-editing");
        this.speech = speech;
        this.video = video;
        this.transcriber = transcriber;
        this.media = media;
        this.settings = settings;
        this.composer = new SceneTimelineComposer(settings.getCaptionToleranceSec());
    }

    @Override
    protected Outcome produce(PipelineState state, int attempt) throws IOException {
        String runId = state.getRunId();
        MediaAssets assets = state.getMediaAssets();
        if (assets == null || assets.getAudioSegments().isEmpty()
                || assets.getAudioPath() == null || assets.getAudioPath().isEmpty()) {
            throw new GeneratorException("No audio assets available from media production");
        }
        List<AudioSegment> segments = assets.getAudioSegments();

        Path outputDir = settings.getOutputDir().resolve(runId).resolve("output");
        Files.createDirectories(outputDir);
        Path finalVideo = outputDir.resolve(runId + "_final.mp4");
        Path srt = outputDir.resolve(runId + "_captions.srt");
        Path thumbnail = outputDir.resolve(runId + "_thumbnail.png");

        List<Caption> captions = transcriber.transcribe(Path.of(assets.getAudioPath()));
        List<CaptionBucket> buckets = composer.compose(segments, captions);
        SrtWriter.write(buckets, srt);
        log.info("Run {} captions: {} transcribed into {} scenes", runId, captions.size(), buckets.size());

        int[] geometry = resolution(state.getVideoResolution());
        RenderPlanBuilder plan = new RenderPlanBuilder(geometry[0], geometry[1], settings.getVideoFps())
                .segments(segments, buckets)
                .assets(assets)
                .banner(bannerText(state))
                .backgroundMusic(stringPreference(state, "bgm_path"));

        narrateIntro(state, assets, outputDir).ifPresent(intro -> plan.intro(
                intro.toString(),
                settings.getAssetsDir().resolve("channel_ad.png").toString(),
                media.probeDuration(intro)));
        generateHookVideo(state, segments).ifPresent(hook -> plan.hookVideo(hook.toString()));

        RenderPlan renderPlan = plan.build();
        if (renderPlan.getClips().isEmpty()) {
            throw new GeneratorException("No scene clips could be assembled");
        }
        media.render(renderPlan, finalVideo);

        if (!assets.getImages().isEmpty()) {
            Files.copy(Path.of(assets.getImages().get(0).getImagePath()), thumbnail, StandardCopyOption.REPLACE_EXISTING);
        }
        double duration = media.probeDuration(finalVideo);

        EditorOutput output = new EditorOutput();
        output.setFinalVideoPath(finalVideo.toString());
        output.setCaptionSrtPath(srt.toString());
        output.setThumbnailPath(thumbnail.toString());
        output.setMetadata(metadataOf(state));
        output.setDurationSec(duration);

        List<String> problems = new ArrayList<>();
        int passed = 0;
        if (nonEmpty(finalVideo)) {
            passed++;
        } else {
            problems.add("Final video file missing or empty.");
        }
        if (nonEmpty(srt)) {
            passed++;
        } else {
            problems.add("Caption file missing or empty.");
        }
        if (nonEmpty(thumbnail)) {
            passed++;
        } else {
            problems.add("Thumbnail missing.");
        }
        if (duration >= settings.getMinDurationSec() && duration <= settings.getMaxDurationSec()) {
            passed++;
        } else {
            problems.add(String.format("Duration %.1fs outside %.0f-%.0fs range.",
                    duration, settings.getMinDurationSec(), settings.getMaxDurationSec()));
        }
        double score = passed / 4.0;
        String feedback = (score >= settings.getQualityThreshold() ? "Video rendered successfully: " : "Video rendering incomplete: ")
                + passed + "/4 checks passed." + (problems.isEmpty() ? "" : " " + String.join(" ", problems));

        log.info("Run {} rendered {} ({}s)", runId, finalVideo, duration);
        return new Outcome(StateUpdate.of(s -> s.setEditorOutput(output)),
                assess(score, settings.getQualityThreshold(), feedback, attempt));
    }

    @Override
    protected StateUpdate onFailure(PipelineState state) {
        return StateUpdate.of(s -> s.setEditorOutput(EditorOutput.empty()));
    }

    // Synthesized runs only; recorded narration has no matching intro voice.
    private Optional<Path> narrateIntro(PipelineState state, MediaAssets assets, Path outputDir) {
        if (state.getAudioSource() == AudioSource.MANUAL) {
            return Optional.empty();
        }
        String hostVoice = assets.getVoiceIds().get(Scene.HOST);
        if (hostVoice == null || hostVoice.isBlank()) {
            return Optional.empty();
        }
        Path intro = speech.synthesize(settings.getChannelIntroText(), hostVoice, "friendly",
                outputDir.resolve("channel_intro.mp3"));
        log.info("Run {} channel intro narrated", state.getRunId());
        return Optional.of(intro);
    }

    // A failed hook video is not fatal; the hook scene keeps its still image.
    private Optional<Path> generateHookVideo(PipelineState state, List<AudioSegment> segments) throws IOException {
        String prompt = state.getHookVideoPrompt();
        String mode = state.getHookMode() == null ? HookPromptGate.MODE_VIDEO : state.getHookMode();
        if (prompt == null || prompt.isBlank() || !HookPromptGate.MODE_VIDEO.equals(mode)) {
            return Optional.empty();
        }
        double hookDuration = segments.stream()
                .filter(s -> "hook".equals(s.getSceneId()))
                .mapToDouble(AudioSegment::getDuration)
                .findFirst()
                .orElse(5.0);
        Path videoDir = settings.getOutputDir().resolve(state.getRunId()).resolve("video");
        Files.createDirectories(videoDir);
        try {
            Path hook = video.synthesize(prompt, hookDuration > 7.0 ? 9.0 : 5.0, videoDir.resolve("hook.mp4"));
            log.info("Run {} hook video generated at {}", state.getRunId(), hook);
            return Optional.of(hook);
        } catch (RuntimeException e) {
            log.warn("Run {} hook video generation failed; using the still image", state.getRunId(), e);
            return Optional.empty();
        }
    }

    private int[] resolution(String requested) {
        if (requested != null) {
            String[] parts = requested.toLowerCase().split("x");
            if (parts.length == 2) {
                try {
                    return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
                } catch (NumberFormatException e) {
                    log.warn("Ignoring malformed video resolution '{}'", requested);
                }
            }
        }
        return new int[]{settings.getVideoWidth(), settings.getVideoHeight()};
    }

    static String bannerText(PipelineState state) {
        ScriptData script = state.getScriptData();
        if (script != null && script.getTrendBannerText() != null && !script.getTrendBannerText().isBlank()) {
            return script.getTrendBannerText();
        }
        String topic = topicOf(state);
        return topic.length() > BANNER_MAX_CHARS ? topic.substring(0, BANNER_MAX_CHARS) + "…" : topic;
    }

    static VideoMetadata metadataOf(PipelineState state) {
        TrendData trends = state.getTrendData() == null ? TrendData.empty() : state.getTrendData();
        ScriptData script = state.getScriptData();
        String topic = topicOf(state);
        String title = script != null && script.getTitle() != null && !script.getTitle().isBlank()
                ? script.getTitle()
                : topic + " podcast short";
        return new VideoMetadata(
                title,
                "A podcast short about " + topic + ".",
                new ArrayList<>(trends.getKeywords()),
                trends.getCategory());
    }

    private static String topicOf(PipelineState state) {
        if (state.getTrendData() != null && state.getTrendData().getSelectedTopic() != null
                && !state.getTrendData().getSelectedTopic().isBlank()) {
            return state.getTrendData().getSelectedTopic();
        }
        return state.getTopicSelected() == null ? "" : state.getTopicSelected();
    }

    private static String stringPreference(PipelineState state, String key) {
        Object value = state.getUserPreferences().get(key);
        return value instanceof String ? (String) value : null;
    }

    private static boolean nonEmpty(Path file) throws IOException {
        return Files.isRegularFile(file) && Files.size(file) > 0;
    }
}
