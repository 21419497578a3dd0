package shorts.stage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.config.PipelineSettings;
import shorts.generator.GeneratorException;
import shorts.generator.ImageSynthesizer;
import shorts.generator.MediaToolkit;
import shorts.generator.SpeechSynthesizer;
import shorts.generator.TextGenerator;
import shorts.graph.Stage;
import shorts.graph.StateUpdate;
import shorts.model.AudioSegment;
import shorts.model.AudioSource;
import shorts.model.ImageAsset;
import shorts.model.MediaAssets;
import shorts.model.PipelineState;
import shorts.model.Scene;
import shorts.model.ScriptData;
import shorts.model.SelectedSpeakers;
import shorts.model.VideoClip;

/**
 * Produces narration and a still image for every scene, joins the narration
 * into one track and drafts the hook video prompt for the next gate.
 *
 * <p>Scenes are generated in parallel on a fixed pool. Speech and image calls
 * each go through their own permit pool, shared by all runs in the process. A
 * scene that fails is dropped and logged; the score then reflects what is
 * missing.
 */
public class MediaProductionStage extends QualityStage {

    private static final Logger log = LoggerFactory.getLogger(MediaProductionStage.class);

    static final String HOOK_PROMPT_SYSTEM = """
            You are a video prompt engineer. Given a podcast script, write one concise \
            English prompt for a text-to-video model that creates a short hook clip \
            showing the core topic and mood of the script. Output only the prompt.""";

    private final SpeechSynthesizer speech;
    private final ImageSynthesizer images;
    private final MediaToolkit media;
    private final TextGenerator text;
    private final PipelineSettings settings;
    private final Semaphore speechPermits;
    private final Semaphore imagePermits;

    public MediaProductionStage(SpeechSynthesizer speech,
                                ImageSynthesizer images,
                                MediaToolkit media,
                                TextGenerator text,
                                PipelineSettings settings) {
        super(Stage.MEDIA, "Media production");
        this.speech = speech;
        this.images = images;
        this.media = media;
        this.text = text;
        this.settings = settings;
        this.speechPermits = new Semaphore(settings.getSpeechConcurrency());
        this.imagePermits = new Semaphore(settings.getImageConcurrency());
    }

    private static final class SceneMedia {

        private final AudioSegment audio;
        private final ImageAsset image;
        private final VideoClip clip;

        private SceneMedia(AudioSegment audio, ImageAsset image, VideoClip clip) {
            this.audio = audio;
            this.image = image;
            this.clip = clip;
        }
    }

    @Override
    protected Outcome produce(PipelineState state, int attempt) throws IOException {
        ScriptData script = state.getScriptData();
        List<Scene> scenes = script == null ? List.of() : script.getScenes();
        if (scenes.isEmpty()) {
            throw new GeneratorException("No scenes found in script data");
        }

        Path runDir = settings.getOutputDir().resolve(state.getRunId());
        for (String sub : List.of("audio", "images", "video")) {
            Files.createDirectories(runDir.resolve(sub));
        }

        Map<String, String> voices = voicesOf(state);
        List<SceneMedia> produced = generateScenes(state, scenes, runDir, voices);
        if (produced.isEmpty()) {
            throw new GeneratorException("All scene audio generations failed");
        }

        List<Path> audioPaths = new ArrayList<>();
        for (SceneMedia scene : produced) {
            audioPaths.add(Path.of(scene.audio.getAudioPath()));
        }
        Path narration = media.concatenate(audioPaths, runDir.resolve("audio").resolve("full_audio.mp3"));

        MediaAssets assets = new MediaAssets();
        assets.setAudioPath(narration.toString());
        for (SceneMedia scene : produced) {
            assets.getAudioSegments().add(scene.audio);
            assets.getImages().add(scene.image);
            assets.getVideoClips().add(scene.clip);
        }
        assets.setVoiceIds(voices);

        String hookPrompt = text.complete(HOOK_PROMPT_SYSTEM, hookPromptRequest(script));
        log.info("Run {} hook video prompt drafted ({} chars)", state.getRunId(), hookPrompt.length());

        int expected = scenes.size();
        int total = 2 * expected + (int) assets.getVideoClips().stream().filter(VideoClip::hasVideo).count() + 2;
        int passed = countPassedChecks(assets, expected);
        double score = (double) passed / total;

        StateUpdate update = StateUpdate.of(s -> {
            s.setMediaAssets(assets);
            s.setHookVideoPrompt(hookPrompt);
        });
        return new Outcome(update, assess(score, settings.getQualityThreshold(),
                feedback(score, passed, total, expected, produced.size()), attempt));
    }

    @Override
    protected StateUpdate onFailure(PipelineState state) {
        return StateUpdate.of(s -> {
            s.setMediaAssets(MediaAssets.empty());
            s.setHookVideoPrompt(null);
        });
    }

    private List<SceneMedia> generateScenes(PipelineState state, List<Scene> scenes, Path runDir,
                                            Map<String, String> voices) {
        AudioSource source = state.getAudioSource() == null ? AudioSource.TTS : state.getAudioSource();
        Map<String, String> manualFiles = state.getAudioFiles() == null ? Map.of() : state.getAudioFiles();
        SelectedSpeakers speakers = state.getSelectedSpeakers();

        ExecutorService executor = Executors.newFixedThreadPool(settings.getSceneWorkers());
        try {
            List<CompletableFuture<SceneMedia>> futures = new ArrayList<>();
            for (Scene scene : scenes) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> generateScene(scene, runDir, voices, source, manualFiles, speakers), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .handle((ignored, error) -> null)
                    .join();

            List<SceneMedia> produced = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    produced.add(futures.get(i).join());
                } catch (CompletionException e) {
                    log.error("Run {} scene {} failed", state.getRunId(), scenes.get(i).getSceneId(), e.getCause());
                }
            }
            return produced;
        } finally {
            executor.shutdown();
        }
    }

    private SceneMedia generateScene(Scene scene,
                                     Path runDir,
                                     Map<String, String> voices,
                                     AudioSource source,
                                     Map<String, String> manualFiles,
                                     SelectedSpeakers speakers) {
        String sceneId = scene.getSceneId();
        Path audioOut = runDir.resolve("audio").resolve(sceneId + ".mp3");
        Path imageOut = runDir.resolve("images").resolve(sceneId + ".png");
        try {
            Path audio = source == AudioSource.MANUAL
                    ? copyRecording(sceneId, manualFiles, audioOut)
                    : narrate(scene, voices, audioOut);
            Path image = illustrate(scene, speakers, imageOut);
            double duration = media.probeDuration(audio);

            log.debug("Scene {} ready ({}s)", sceneId, duration);
            return new SceneMedia(
                    new AudioSegment(sceneId, audio.toString(), duration),
                    new ImageAsset(sceneId, image.toString(), scene.getImagePrompt()),
                    new VideoClip(sceneId, "", duration));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write media for scene " + sceneId, e);
        }
    }

    private Path narrate(Scene scene, Map<String, String> voices, Path output) {
        String fallback = voices.getOrDefault(Scene.HOST, settings.getRoster().getFallbackVoiceId());
        String voiceId = voices.getOrDefault(scene.getSpeaker(), fallback);
        acquire(speechPermits);
        try {
            return speech.synthesize(scene.getText(), voiceId, scene.getEmotion(), output);
        } finally {
            speechPermits.release();
        }
    }

    private static Path copyRecording(String sceneId, Map<String, String> manualFiles, Path output) throws IOException {
        String recording = manualFiles.get(sceneId);
        if (recording == null || !Files.isRegularFile(Path.of(recording))) {
            throw new GeneratorException("Manual audio file not found for scene " + sceneId + ": " + recording);
        }
        return Files.copy(Path.of(recording), output, StandardCopyOption.REPLACE_EXISTING);
    }

    // Static card for calls to action, then the participant's own picture, then a generated image
    private Path illustrate(Scene scene, SelectedSpeakers speakers, Path output) throws IOException {
        Optional<Path> prepared = staticImageFor(scene.getSceneId()).or(() -> speakerPictureFor(scene.getSpeaker(), speakers));
        if (prepared.isPresent()) {
            return Files.copy(prepared.get(), output, StandardCopyOption.REPLACE_EXISTING);
        }
        acquire(imagePermits);
        try {
            return images.synthesize(scene.getImagePrompt(), sceneType(scene.getSceneId()), output);
        } finally {
            imagePermits.release();
        }
    }

    private Optional<Path> staticImageFor(String sceneId) {
        String card;
        if ("cta_2".equals(sceneId)) {
            card = "channel_cta.png";
        } else if (sceneId.startsWith("cta")) {
            card = "channel_ad.png";
        } else {
            return Optional.empty();
        }
        Path path = settings.getAssetsDir().resolve(card);
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    private Optional<Path> speakerPictureFor(String speaker, SelectedSpeakers speakers) {
        if (speaker == null || speakers == null || !speaker.startsWith("participant_")) {
            return Optional.empty();
        }
        int index;
        try {
            index = Integer.parseInt(speaker.substring("participant_".length())) - 1;
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        List<String> participants = speakers.getParticipants();
        if (index < 0 || index >= participants.size()) {
            return Optional.empty();
        }
        Path picture = settings.getAssetsDir().resolve("ai_pic").resolve(participants.get(index) + ".png");
        return Files.isRegularFile(picture) ? Optional.of(picture) : Optional.empty();
    }

    static String sceneType(String sceneId) {
        if (sceneId.startsWith("body_")) {
            return "body";
        }
        if ("hook".equals(sceneId)) {
            return "hook";
        }
        if (sceneId.startsWith("cta")) {
            return "cta";
        }
        return "default";
    }

    private Map<String, String> voicesOf(PipelineState state) {
        if (state.getVoiceIds() != null && !state.getVoiceIds().isEmpty()) {
            return new LinkedHashMap<>(state.getVoiceIds());
        }
        if (state.getSelectedSpeakers() != null && state.getSelectedSpeakers().getHost() != null) {
            return settings.getRoster().resolveVoices(state.getSelectedSpeakers());
        }
        Map<String, String> voices = new LinkedHashMap<>();
        voices.put(Scene.HOST, settings.getRoster().getFallbackVoiceId());
        return voices;
    }

    private static int countPassedChecks(MediaAssets assets, int expected) {
        int passed = 0;
        for (AudioSegment segment : assets.getAudioSegments()) {
            passed += nonEmpty(segment.getAudioPath()) ? 1 : 0;
        }
        for (ImageAsset image : assets.getImages()) {
            passed += nonEmpty(image.getImagePath()) ? 1 : 0;
        }
        for (VideoClip clip : assets.getVideoClips()) {
            passed += clip.hasVideo() && nonEmpty(clip.getVideoPath()) ? 1 : 0;
        }
        passed += nonEmpty(assets.getAudioPath()) ? 1 : 0;
        if (assets.getAudioSegments().size() == expected
                && assets.getImages().size() == expected
                && assets.getVideoClips().size() == expected) {
            passed++;
        }
        return passed;
    }

    private static boolean nonEmpty(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        try {
            Path file = Path.of(path);
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private String feedback(double score, int passed, int total, int expected, int produced) {
        if (score >= settings.getQualityThreshold()) {
            return "Media generation succeeded: " + passed + "/" + total + " checks passed.";
        }
        String feedback = "Media generation incomplete: " + passed + "/" + total + " checks passed.";
        if (produced < expected) {
            feedback += " Missing " + (expected - produced) + " scenes.";
        }
        return feedback;
    }

    private static String hookPromptRequest(ScriptData script) {
        String full = script.getFullScript() == null ? "" : script.getFullScript();
        return "Script title: " + script.getTitle() + "\n"
                + "Hook text: " + script.getHook() + "\n"
                + "Script summary: " + full.substring(0, Math.min(500, full.length())) + "\n\n"
                + "Write a visually compelling prompt for a vertical (9:16) video that captures "
                + "the essence of this topic and its key visual elements.";
    }

    private static void acquire(Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneratorException("Interrupted while waiting for a generator slot", e);
        }
    }
}
