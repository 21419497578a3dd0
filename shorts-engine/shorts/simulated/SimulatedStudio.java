package shorts.simulated;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.generator.ArtifactPublisher;
import shorts.generator.BodyPart;
import shorts.generator.GeneratorException;
import shorts.generator.ImageSynthesizer;
import shorts.generator.KeywordAnalysis;
import shorts.generator.MediaToolkit;
import shorts.generator.QualityEvaluation;
import shorts.generator.ScriptDraft;
import shorts.generator.SpeechSynthesizer;
import shorts.generator.Studio;
import shorts.generator.TextGenerator;
import shorts.generator.Transcriber;
import shorts.generator.TrendAnalysis;
import shorts.generator.TrendItem;
import shorts.generator.TrendSource;
import shorts.generator.VideoSynthesizer;
import shorts.model.EditorOutput;
import shorts.model.Scene;
import shorts.timeline.Caption;
import shorts.timeline.RenderPlan;
import shorts.timeline.SceneClipPlan;

/**
 * Offline stand-in for every external service. Writes small placeholder files,
 * remembers the durations it made up, and fails on purpose at a configurable
 * rate so retries can be watched from the demo.
 */
public class SimulatedStudio implements Studio, TextGenerator, SpeechSynthesizer, ImageSynthesizer,
        VideoSynthesizer, Transcriber, MediaToolkit, ArtifactPublisher {

    private static final Logger log = LoggerFactory.getLogger(SimulatedStudio.class);

    private static final double SECONDS_PER_WORD = 0.45;

    private final double failureRate;
    private final Random random;

    private final Map<Path, Double> durations = new ConcurrentHashMap<>();
    private final Map<Path, String> spokenText = new ConcurrentHashMap<>();
    private final Map<Path, List<Path>> joinedFrom = new ConcurrentHashMap<>();

    public SimulatedStudio() {
        this(0.0, 42L);
    }

    public SimulatedStudio(double failureRate, long seed) {
        this.failureRate = failureRate;
        this.random = new Random(seed);
    }

    // ---------------- Studio ----------------

    @Override
    public TextGenerator text() {
        return this;
    }

    @Override
    public List<TrendSource> trendSources() {
        return List.of(
                source("news", List.of(
                        new TrendItem("Four-day work week pilot", "https://news.example/4day", "Companies report the results of a six-month pilot.", "news"),
                        new TrendItem("Heatwave records", "https://news.example/heat", "Cities break temperature records for a third week.", "news"))),
                source("search_trends", List.of(
                        new TrendItem("AI homework helpers", "", "", "search_trends"),
                        new TrendItem("Space tourism prices", "", "", "search_trends"))));
    }

    @Override
    public SpeechSynthesizer speech() {
        return this;
    }

    @Override
    public ImageSynthesizer images() {
        return this;
    }

    @Override
    public VideoSynthesizer video() {
        return this;
    }

    @Override
    public Transcriber transcriber() {
        return this;
    }

    @Override
    public MediaToolkit media() {
        return this;
    }

    @Override
    public ArtifactPublisher publisher() {
        return this;
    }

    // ---------------- text ----------------

    @Override
    public <T> T generate(String systemPrompt, String userPrompt, Class<T> resultType) {
        maybeFail("text generation");
        if (resultType == TrendAnalysis.class) {
            return resultType.cast(trendAnalysis());
        }
        if (resultType == ScriptDraft.class) {
            return resultType.cast(scriptDraft(userPrompt));
        }
        if (resultType == QualityEvaluation.class) {
            return resultType.cast(new QualityEvaluation(0.85, "Clear structure and enough context."));
        }
        throw new GeneratorException("No simulated output for " + resultType.getSimpleName());
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        maybeFail("text completion");
        return "Vertical 9:16 cinematic shot of a family gathered around a kitchen table, "
                + "warm morning light, newspapers and a glowing tablet, slow push-in";
    }

    private static TrendAnalysis trendAnalysis() {
        TrendAnalysis analysis = new TrendAnalysis();
        List<KeywordAnalysis> analyses = new ArrayList<>();
        analyses.add(new KeywordAnalysis("Four-day work week", "Pilot results were published this week.",
                "economy", 0.9, "Most companies in the pilot kept the shorter week.", "news"));
        analyses.add(new KeywordAnalysis("AI homework helpers", "Schools are debating new usage rules.",
                "education", 0.8, "Parents and schools disagree on limits.", "search_trends"));
        analyses.add(new KeywordAnalysis("Space tourism prices", "A new operator announced cheaper seats.",
                "science", 0.6, "Tickets are still out of reach for most people.", "search_trends"));
        analysis.setAnalyses(analyses);
        analysis.setRecommendedTopic("Four-day work week");
        analysis.setRecommendedCategory("economy");
        analysis.setReasoning("Broad interest and plenty of everyday angles for a family conversation.");
        return analysis;
    }

    private static ScriptDraft scriptDraft(String userPrompt) {
        String topic = "this week's big story";
        for (String line : userPrompt.split("\n")) {
            if (line.startsWith("- Selected topic: ")) {
                topic = line.substring("- Selected topic: ".length()).trim();
            }
        }
        String visual = "portrait composition, " + topic + ", friendly illustrated style";

        List<Scene> scenes = new ArrayList<>();
        scenes.add(new Scene("hook", "Did you hear that some families now get a three-day weekend every week? Let's talk about " + topic + ".", 8, "excited", "Family calendar with three weekend days, " + visual, Scene.HOST));
        scenes.add(new Scene("body_1_1", "So here is why everyone is talking about " + topic + " right now: the first results just came out and they surprised a lot of people.", 9, "informative", "Newspaper headline, " + visual, Scene.HOST));
        scenes.add(new Scene("body_1_2", "Wait, so people work less and still get everything done? How is that even possible?", 6, "curious", "Kid looking puzzled at a clock, " + visual, "participant_1"));
        scenes.add(new Scene("body_2_1", "What happened to the companies that tried it? Did any of them give up and go back?", 6, "curious", "Office with empty desks on a Friday, " + visual, "participant_1"));
        scenes.add(new Scene("body_2_2", "Most of them kept it. They said people were less tired and took fewer sick days, so the work balanced out.", 9, "thoughtful", "Rested workers smiling, " + visual, Scene.HOST));
        scenes.add(new Scene("body_3_1", "But would it work for jobs like doctors or bus drivers who cannot just stop on Fridays?", 7, "curious", "Bus driver and nurse, " + visual, "participant_1"));
        scenes.add(new Scene("body_3_2", "Great question. Those jobs use rotating schedules, so the week is shorter per person but the service keeps running.", 9, "informative", "Rotating shift chart, " + visual, Scene.HOST));
        scenes.add(new Scene("cta", "If you want more stories like this, follow the channel and tell us what you would do with an extra day off.", 8, "friendly", "Channel card, " + visual, Scene.HOST));

        ScriptDraft draft = new ScriptDraft();
        draft.setTitle("Would a four-day week work for our family?");
        draft.setHookText(scenes.get(0).getText());
        draft.setBodyParts(List.of(
                new BodyPart(scenes.get(1).getText(), "Why it is news now", "informative"),
                new BodyPart(scenes.get(4).getText(), "What the pilot found", "thoughtful"),
                new BodyPart(scenes.get(6).getText(), "How it works for shift jobs", "informative")));
        draft.setCtaText(scenes.get(7).getText());
        draft.setScenes(scenes);
        draft.setTrendBannerText("Three-day weekends for everyone?");
        draft.setEstimatedDurationSec(scenes.stream().mapToDouble(Scene::getDuration).sum());
        return draft;
    }

    // ---------------- media ----------------

    @Override
    public Path synthesize(String text, String voiceId, String emotion, Path output) {
        maybeFail("speech synthesis");
        double duration = Math.max(2.0, text.split("\\s+").length * SECONDS_PER_WORD);
        write(output, "speech voice=" + voiceId + " emotion=" + emotion + "\n" + text);
        durations.put(output, duration);
        spokenText.put(output, text);
        return output;
    }

    @Override
    public Path synthesize(String prompt, String sceneType, Path output) {
        maybeFail("image synthesis");
        write(output, "image type=" + sceneType + "\n" + prompt);
        return output;
    }

    @Override
    public Path synthesize(String prompt, double durationSec, Path output) {
        maybeFail("video synthesis");
        write(output, "video " + durationSec + "s\n" + prompt);
        durations.put(output, durationSec);
        return output;
    }

    /**
     * Durations of files this studio wrote are remembered. Anything else (a manual
     * recording, say) is estimated from its word count.
     */
    @Override
    public double probeDuration(Path media) {
        Double known = durations.get(media);
        if (known != null) {
            return known;
        }
        if (!Files.isRegularFile(media)) {
            throw new GeneratorException("Cannot probe missing media " + media);
        }
        try {
            String content = Files.readString(media, StandardCharsets.UTF_8).trim();
            double estimate = Math.max(2.0, content.split("\\s+").length * SECONDS_PER_WORD);
            durations.put(media, estimate);
            return estimate;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + media, e);
        }
    }

    @Override
    public Path concatenate(List<Path> inputs, Path output) {
        double total = 0.0;
        StringBuilder manifest = new StringBuilder("concat\n");
        for (Path input : inputs) {
            total += probeDuration(input);
            manifest.append(input).append('\n');
        }
        write(output, manifest.toString());
        durations.put(output, total);
        joinedFrom.put(output, List.copyOf(inputs));
        return output;
    }

    @Override
    public Path render(RenderPlan plan, Path output) {
        maybeFail("render");
        StringBuilder manifest = new StringBuilder()
                .append("render ").append(plan.getWidth()).append('x').append(plan.getHeight())
                .append('@').append(plan.getFps()).append('\n');
        for (SceneClipPlan clip : plan.getClips()) {
            manifest.append(clip.getSceneId()).append(' ').append(clip.getDuration()).append("s ")
                    .append(clip.hasVideo() ? clip.getVideoPath() : clip.getImagePath()).append('\n');
        }
        write(output, manifest.toString());
        durations.put(output, plan.totalDurationSec());
        return output;
    }

    /**
     * One caption per narrated segment, slightly inset from the segment edges.
     */
    @Override
    public List<Caption> transcribe(Path audio) {
        List<Path> parts = joinedFrom.getOrDefault(audio, List.of(audio));
        List<Caption> captions = new ArrayList<>();
        double cursor = 0.0;
        for (Path part : parts) {
            double duration = probeDuration(part);
            String text = spokenText.getOrDefault(part, "");
            captions.add(new Caption(cursor + 0.1, cursor + Math.max(0.2, duration - 0.4), text));
            cursor += duration;
        }
        return captions;
    }

    // ---------------- publishing ----------------

    @Override
    public Map<String, String> publish(String runId, String ownerId, EditorOutput output) {
        Map<String, String> urls = new LinkedHashMap<>();
        putUri(urls, FINAL_VIDEO_URL, output.getFinalVideoPath());
        putUri(urls, CAPTION_SRT_URL, output.getCaptionSrtPath());
        putUri(urls, THUMBNAIL_URL, output.getThumbnailPath());
        log.info("Simulated publish of run {} for owner {}", runId, ownerId);
        return urls;
    }

    // ---------------- helpers ----------------

    private TrendSource source(String name, List<TrendItem> items) {
        return new TrendSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<TrendItem> fetchTrending() {
                maybeFail("trend source " + name);
                return items;
            }
        };
    }

    private static void putUri(Map<String, String> urls, String key, String path) {
        if (path != null && !path.isBlank()) {
            urls.put(key, Path.of(path).toAbsolutePath().toUri().toString());
        }
    }

    private void maybeFail(String operation) {
        boolean fail;
        synchronized (random) {
            fail = failureRate > 0 && random.nextDouble() < failureRate;
        }
        if (fail) {
            throw new GeneratorException("Simulated " + operation + " outage");
        }
    }

    private static void write(Path output, String content) {
        try {
            Path parent = output.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + output, e);
        }
    }
}
