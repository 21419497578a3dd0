package shorts.gate;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import shorts.graph.NodeResult;
import shorts.graph.Stage;
import shorts.graph.StageNode;
import shorts.model.PipelineState;

/**
 * A stage that stops the run until a person decides.
 *
 * <p>Running the gate only publishes a payload built from the state; the run is
 * then suspended. {@link #decide} is called when the decision arrives. It
 * validates the resume payload, applies defaults and returns the fields to
 * write. Gates keep no state of their own between the two calls.
 */
public abstract class HumanGate implements StageNode {

    private final GateType type;

    protected HumanGate(GateType type) {
        this.type = type;
    }

    public GateType type() {
        return type;
    }

    @Override
    public Stage stage() {
        return type.stage();
    }

    @Override
    public final NodeResult run(PipelineState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type.tag());
        payload.putAll(publish(state));
        return NodeResult.suspend(payload);
    }

    /**
     * Payload entries shown to the decision maker, {@code message} included.
     */
    protected abstract Map<String, Object> publish(PipelineState state);

    /**
     * @throws ResumeRejectedException when the payload is missing a required
     *                                 key or carries an invalid value
     */
    public abstract GateDecision decide(PipelineState state, Map<String, Object> payload);

    // ---------------- payload helpers ----------------

    protected static String requireString(PipelineState state, Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new ResumeRejectedException(state.getRunId(), "'" + key + "' is required");
        }
        return ((String) value).trim();
    }

    protected static String optionalString(PipelineState state, Map<String, Object> payload, String key,
                                           String defaultValue) {
        Object value = payload.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof String)) {
            throw new ResumeRejectedException(state.getRunId(), "'" + key + "' must be a string");
        }
        String text = ((String) value).trim();
        return text.isEmpty() ? defaultValue : text;
    }

    protected static boolean requireBoolean(PipelineState state, Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof Boolean)) {
            throw new ResumeRejectedException(state.getRunId(), "'" + key + "' is required and must be true or false");
        }
        return (Boolean) value;
    }

    protected static List<String> optionalStringList(PipelineState state, Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection)) {
            throw new ResumeRejectedException(state.getRunId(), "'" + key + "' must be a list");
        }
        Collection<?> items = (Collection<?>) value;
        for (Object item : items) {
            if (!(item instanceof String) || ((String) item).isBlank()) {
                throw new ResumeRejectedException(state.getRunId(), "'" + key + "' must contain only names");
            }
        }
        return items.stream().map(item -> ((String) item).trim()).toList();
    }

    protected static Map<String, String> requireStringMap(PipelineState state, Map<String, Object> payload,
                                                          String key) {
        Object value = payload.get(key);
        if (!(value instanceof Map) || ((Map<?, ?>) value).isEmpty()) {
            throw new ResumeRejectedException(state.getRunId(), "'" + key + "' is required");
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!(entry.getKey() instanceof String) || !(entry.getValue() instanceof String)
                    || ((String) entry.getValue()).isBlank()) {
                throw new ResumeRejectedException(state.getRunId(), "'" + key + "' must map names to paths");
            }
            result.put((String) entry.getKey(), (String) entry.getValue());
        }
        return result;
    }
}
