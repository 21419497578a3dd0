package shorts.gate;

import shorts.graph.StateUpdate;

/**
 * A validated human decision: the fields it writes and a one-line summary for
 * the log.
 */
public final class GateDecision {

    private final GateType type;
    private final StateUpdate update;
    private final String summary;

    public GateDecision(GateType type, StateUpdate update, String summary) {
        this.type = type;
        this.update = update;
        this.summary = summary;
    }

    public GateType getType() {
        return type;
    }

    public StateUpdate getUpdate() {
        return update;
    }

    public String getSummary() {
        return summary;
    }
}
