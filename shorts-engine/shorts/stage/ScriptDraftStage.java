package shorts.stage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.config.SpeakerRoster;
import shorts.generator.BodyPart;
import shorts.generator.GeneratorException;
import shorts.generator.QualityEvaluation;
import shorts.generator.ScriptDraft;
import shorts.generator.TextGenerator;
import shorts.graph.Stage;
import shorts.graph.StateUpdate;
import shorts.model.PipelineState;
import shorts.model.Scene;
import shorts.model.ScriptData;
import shorts.model.SelectedSpeakers;
import shorts.model.TrendData;

/**
 * Writes the multi-speaker script for the chosen topic, or revises it when the
 * reviewer sent feedback. The script is also exported as plain text next to the
 * run's other outputs.
 *
 * <p>Review approval and feedback are consumed here and reset, so a stale
 * decision never leaks into the next review.
 */
public class ScriptDraftStage extends QualityStage {

    private static final Logger log = LoggerFactory.getLogger(ScriptDraftStage.class);

    static final String SYSTEM_PROMPT_TEMPLATE = """
            You write family podcast shorts: %d-person conversations of one to three minutes \
            about a trending topic.

            ## Cast
            %s

            ## Rules
            1. Start a new scene every time the speaker changes; one scene, one speaker.
            2. Flow: the host explains, participants ask and react, the host answers.
            3. Set the speaker of every scene to one of %s.
            4. Structure: hook (host, 5-10 s), body part 1 (why it matters now), \
            body part 2 (sharp questions and in-depth answers), body part 3 (provocative \
            follow-ups and insight), call to action (1-2 scenes).
            5. Scene ids: hook, body_1_1, body_1_2, ..., body_3_n, cta or cta_1 and cta_2.
            6. Every scene gets its own English, portrait-oriented image prompt that \
            includes the topic.
            7. Total length 60-180 seconds, 10-20 scenes.

            ## Speaking share
            %s""";

    static final String QUALITY_SYSTEM_PROMPT = """
            You grade podcast shorts scripts before media generation. Check that the hook \
            grabs attention, the three body parts are logical, the call to action closes \
            naturally, the tone stays conversational, the length fits one to three \
            minutes, image prompts are in English, and the speaking share is balanced \
            (host 40-60%, participants share the rest).""";

    private static final Map<String, String> DEFAULT_CAST = new LinkedHashMap<>();

    static {
        DEFAULT_CAST.put(Scene.HOST, "Dad and host. Explains the topic and leads the conversation in plain words.");
        DEFAULT_CAST.put("son", "Curious kid who keeps asking what things mean.");
        DEFAULT_CAST.put("daughter", "Sharp, witty kid who adds her own takes.");
    }

    private final TextGenerator text;
    private final SpeakerRoster roster;
    private final Path outputDir;
    private final double qualityThreshold;

    public ScriptDraftStage(TextGenerator text, SpeakerRoster roster, Path outputDir, double qualityThreshold) {
        super(Stage.DRAFT, "Script generation");
        this.text = text;
        this.roster = roster;
        this.outputDir = outputDir;
        this.qualityThreshold = qualityThreshold;
    }

    @Override
    protected Outcome produce(PipelineState state, int attempt) throws IOException {
        Map<String, String> labels = speakerLabels(state.getSelectedSpeakers());
        String feedback = state.getHumanFeedback();

        String userPrompt = feedback != null && !feedback.isBlank()
                ? revisionPrompt(state, feedback)
                : draftPrompt(state);
        if (feedback != null) {
            log.info("Run {} revising script with reviewer feedback", state.getRunId());
        }

        ScriptDraft draft = text.generate(systemPrompt(state.getSelectedSpeakers(), labels), userPrompt, ScriptDraft.class);
        if (draft.getScenes() == null || draft.getScenes().isEmpty()) {
            throw new GeneratorException("Script draft has no scenes");
        }
        log.info("Run {} script '{}' with {} scenes ({}s)",
                state.getRunId(), draft.getTitle(), draft.getScenes().size(), draft.getEstimatedDurationSec());

        ScriptData script = toScriptData(draft);
        Path scriptFile = export(state.getRunId(), draft, labels);

        QualityEvaluation evaluation = text.generate(QUALITY_SYSTEM_PROMPT, qualityPrompt(draft), QualityEvaluation.class);

        String scriptFilePath = scriptFile.toString();
        StateUpdate update = StateUpdate.of(s -> {
            s.setScriptData(script);
            s.setScriptFilePath(scriptFilePath);
        }).and(ScriptDraftStage::resetReview);

        return new Outcome(update, assess(evaluation.getScore(), qualityThreshold, evaluation.getFeedback(), attempt));
    }

    @Override
    protected StateUpdate onFailure(PipelineState state) {
        return StateUpdate.of(s -> {
            s.setScriptData(ScriptData.empty());
            s.setScriptFilePath(null);
        }).and(ScriptDraftStage::resetReview);
    }

    private static void resetReview(PipelineState state) {
        state.setHumanApproved(null);
        state.setHumanFeedback(null);
    }

    // ---------------- prompts ----------------

    /**
     * Display names by speaker tag: host and participant_1..N from the roster, or
     * the default three-person cast when nobody was selected.
     */
    Map<String, String> speakerLabels(SelectedSpeakers speakers) {
        Map<String, String> labels = new LinkedHashMap<>();
        if (speakers == null || speakers.getHost() == null) {
            labels.put(Scene.HOST, "Dad");
            labels.put("son", "Son");
            labels.put("daughter", "Daughter");
            return labels;
        }
        labels.put(Scene.HOST, nameOf(speakers.getHost()));
        List<String> participants = speakers.getParticipants();
        for (int i = 0; i < participants.size(); i++) {
            labels.put(SelectedSpeakers.participantRole(i + 1), nameOf(participants.get(i)));
        }
        return labels;
    }

    private String systemPrompt(SelectedSpeakers speakers, Map<String, String> labels) {
        List<String> cast = new ArrayList<>();
        if (speakers == null || speakers.getHost() == null) {
            DEFAULT_CAST.forEach((tag, role) -> cast.add("- **" + tag + "** (" + labels.get(tag) + "): " + role));
        } else {
            cast.add("- **host** (" + labels.get(Scene.HOST) + "): leads the conversation. "
                    + descriptionOf(speakers.getHost()));
            List<String> participants = speakers.getParticipants();
            for (int i = 0; i < participants.size(); i++) {
                String tag = SelectedSpeakers.participantRole(i + 1);
                cast.add("- **" + tag + "** (" + labels.get(tag) + "): " + descriptionOf(participants.get(i))
                        + ". Joins in naturally.");
            }
        }

        int participantCount = labels.size() - 1;
        String hostShare = labels.size() <= 3 ? "50-60%" : "40-50%";
        List<String> share = new ArrayList<>();
        share.add("- host(" + labels.get(Scene.HOST) + "): " + hostShare);
        if (participantCount > 0) {
            String participantShare = Math.max(10, 45 / participantCount) + "-" + Math.max(15, 55 / participantCount) + "%";
            labels.keySet().stream()
                    .filter(tag -> !Scene.HOST.equals(tag))
                    .forEach(tag -> share.add("- " + tag + "(" + labels.get(tag) + "): " + participantShare));
        }

        String tags = labels.keySet().stream().map(tag -> "\"" + tag + "\"").collect(Collectors.joining(", "));
        return String.format(SYSTEM_PROMPT_TEMPLATE, labels.size(), String.join("\n", cast), tags, String.join("\n", share));
    }

    private static String draftPrompt(PipelineState state) {
        TrendData trends = trendsOf(state);
        return "Write a family podcast short about the trending topic below.\n\n"
                + topicSection(state, trends)
                + "## Host persona\n" + persona(state.getUserPreferences()) + "\n\n"
                + "Follow the hook, three body parts, call to action structure and set the speaker of every scene.";
    }

    private static String revisionPrompt(PipelineState state, String feedback) {
        TrendData trends = trendsOf(state);
        return "Revise the family podcast short about the trending topic below.\n\n"
                + topicSection(state, trends)
                + "## Host persona\n" + persona(state.getUserPreferences()) + "\n\n"
                + "## Requested changes\n" + feedback + "\n\n"
                + "Apply the requested changes and keep the hook, three body parts, call to action structure.";
    }

    private static String topicSection(PipelineState state, TrendData trends) {
        String topic = state.getTopicSelected() != null ? state.getTopicSelected() : trends.getSelectedTopic();
        String summaries = trends.getTopicSummaries().stream()
                .map(t -> "- " + t.getKeyword() + ": " + t.getSummary())
                .collect(Collectors.joining("\n"));
        return "## Topic\n"
                + "- Selected topic: " + topic + "\n"
                + "- Category: " + trends.getCategory() + "\n"
                + "- Trend summaries:\n" + (summaries.isEmpty() ? "(none)" : summaries) + "\n\n"
                + "Include \"" + topic + "\" as a visual element in every image prompt, in portrait composition.\n\n";
    }

    static String persona(Map<String, Object> preferences) {
        List<String> lines = new ArrayList<>();
        addPersonaLine(lines, "Name / channel", preferences.get("name"));
        addPersonaLine(lines, "Speech style", preferences.get("speech_style"));
        Object fillers = preferences.get("filler_words");
        if (fillers instanceof List && !((List<?>) fillers).isEmpty()) {
            lines.add("- Filler words: " + ((List<?>) fillers).stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }
        addPersonaLine(lines, "Tone", preferences.get("tone"));
        addPersonaLine(lines, "Target audience", preferences.get("target_audience"));
        return lines.isEmpty() ? "(no persona; use a friendly, casual tone)" : String.join("\n", lines);
    }

    private static void addPersonaLine(List<String> lines, String label, Object value) {
        if (value != null && !String.valueOf(value).isBlank()) {
            lines.add("- " + label + ": " + value);
        }
    }

    private static String qualityPrompt(ScriptDraft draft) {
        StringBuilder prompt = new StringBuilder()
                .append("Title: ").append(draft.getTitle()).append('\n')
                .append("Estimated duration: ").append(draft.getEstimatedDurationSec()).append("s\n\n")
                .append("## Hook\n").append(draft.getHookText()).append("\n\n")
                .append("## Body\n");
        List<BodyPart> parts = draft.getBodyParts();
        for (int i = 0; i < parts.size(); i++) {
            BodyPart part = parts.get(i);
            prompt.append("Part ").append(i + 1).append(" [").append(part.getEmotion()).append("]: ")
                    .append(part.getText()).append("\n  Key point: ").append(part.getKeyPoint()).append('\n');
        }
        prompt.append("\n## Call to action\n").append(draft.getCtaText()).append("\n\n## Image prompts\n");
        for (Scene scene : draft.getScenes()) {
            prompt.append("- ").append(scene.getSceneId()).append(" (").append(scene.getSpeaker()).append("): ")
                    .append(scene.getImagePrompt()).append('\n');
        }
        return prompt.toString();
    }

    // ---------------- output ----------------

    static ScriptData toScriptData(ScriptDraft draft) {
        List<String> parts = new ArrayList<>();
        parts.add(draft.getHookText());
        for (BodyPart part : draft.getBodyParts()) {
            parts.add(part.getText());
        }
        parts.add(draft.getCtaText());

        ScriptData script = new ScriptData();
        script.setTitle(draft.getTitle());
        script.setFullScript(String.join(" ", parts).trim());
        script.setScenes(new ArrayList<>(draft.getScenes()));
        script.setHook(draft.getHookText());
        script.setCta(draft.getCtaText());
        script.setEstimatedDurationSec(draft.getEstimatedDurationSec());
        script.setTrendBannerText(draft.getTrendBannerText());
        return script;
    }

    private Path export(String runId, ScriptDraft draft, Map<String, String> labels) throws IOException {
        Path dir = outputDir.resolve(runId);
        Files.createDirectories(dir);
        Path file = dir.resolve("script.txt");

        List<String> lines = new ArrayList<>();
        lines.add("# " + draft.getTitle());
        lines.add("# Estimated duration: " + draft.getEstimatedDurationSec() + "s");
        lines.add("");
        for (Scene scene : draft.getScenes()) {
            String label = labels.getOrDefault(scene.getSpeaker(), scene.getSpeaker());
            lines.add("[" + scene.getSceneId() + "] (" + label + ") " + scene.getText());
        }
        lines.add("");
        Files.writeString(file, String.join("\n", lines), StandardCharsets.UTF_8);
        log.debug("Script exported to {}", file);
        return file;
    }

    private String nameOf(String memberKey) {
        return roster.find(memberKey).map(SpeakerRoster.Member::getName).orElse(memberKey);
    }

    private String descriptionOf(String memberKey) {
        return roster.find(memberKey).map(SpeakerRoster.Member::getDescription).orElse("");
    }

    private static TrendData trendsOf(PipelineState state) {
        return state.getTrendData() == null ? TrendData.empty() : state.getTrendData();
    }
}
