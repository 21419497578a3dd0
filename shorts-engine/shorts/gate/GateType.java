package shorts.gate;

import shorts.graph.Stage;

/**
 * The human decisions a run can wait for, each bound to one gate stage.
 */
public enum GateType {

    TOPIC_SELECTION("topic_selection", Stage.TOPIC_GATE),
    SPEAKER_SELECTION("speaker_selection", Stage.SPEAKER_GATE),
    SCRIPT_REVIEW("script_review", Stage.REVIEW_GATE),
    AUDIO_CHOICE("audio_choice", Stage.AUDIO_CHOICE_GATE),
    HOOK_PROMPT("hook_prompt", Stage.HOOK_GATE);

    private final String tag;
    private final Stage stage;

    GateType(String tag, Stage stage) {
        this.tag = tag;
        this.stage = stage;
    }

    /**
     * Value of the {@code type} key in the published payload.
     */
    public String tag() {
        return tag;
    }

    public Stage stage() {
        return stage;
    }

    public static GateType fromTag(String tag) {
        for (GateType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown gate type: " + tag);
    }

    public static GateType forStage(Stage stage) {
        for (GateType type : values()) {
            if (type.stage == stage) {
                return type;
            }
        }
        throw new IllegalArgumentException("Stage " + stage.key() + " is not a gate");
    }
}
