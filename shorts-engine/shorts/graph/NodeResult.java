package shorts.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one node invocation: either a state update to merge, or a request
 * to suspend the run with a payload for a human.
 */
public final class NodeResult {

    private final StateUpdate update;
    private final Map<String, Object> suspensionPayload;

    private NodeResult(StateUpdate update, Map<String, Object> suspensionPayload) {
        this.update = update;
        this.suspensionPayload = suspensionPayload;
    }

    public static NodeResult update(StateUpdate update) {
        return new NodeResult(update, null);
    }

    public static NodeResult suspend(Map<String, Object> payload) {
        return new NodeResult(StateUpdate.none(), Collections.unmodifiableMap(new LinkedHashMap<>(payload)));
    }

    public boolean isSuspended() {
        return suspensionPayload != null;
    }

    public StateUpdate getUpdate() {
        return update;
    }

    public Map<String, Object> getSuspensionPayload() {
        return suspensionPayload;
    }
}
