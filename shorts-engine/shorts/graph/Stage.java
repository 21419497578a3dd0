package shorts.graph;

/**
 * Stages of a shorts run. The graph is fixed; {@link QualityGatedRouter} owns
 * the transitions between them.
 */
public enum Stage {

    RESEARCH("research"),
    TOPIC_GATE("topic_gate"),
    SPEAKER_GATE("speaker_gate"),
    DRAFT("draft"),
    REVIEW_GATE("review_gate"),
    AUDIO_CHOICE_GATE("audio_choice_gate"),
    MEDIA("media"),
    HOOK_GATE("hook_gate"),
    ASSEMBLE("assemble"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String key;

    Stage(String key) {
        this.key = key;
    }

    /**
     * Stable name used in the checkpoint store, retry counters and assessments.
     */
    public String key() {
        return key;
    }

    public boolean isGate() {
        return this == TOPIC_GATE
                || this == SPEAKER_GATE
                || this == REVIEW_GATE
                || this == AUDIO_CHOICE_GATE
                || this == HOOK_GATE;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isRetryable() {
        return this == RESEARCH || this == DRAFT || this == MEDIA || this == ASSEMBLE;
    }

    public static Stage fromKey(String key) {
        for (Stage stage : values()) {
            if (stage.key.equals(key)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + key);
    }
}
