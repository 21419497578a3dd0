package shorts.gate;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.graph.StateUpdate;
import shorts.model.PipelineState;

/**
 * Last human check before media generation. A rejection sends the run back to
 * drafting with the reviewer's feedback.
 */
public class ScriptReviewGate extends HumanGate {

    private static final Logger log = LoggerFactory.getLogger(ScriptReviewGate.class);

    public ScriptReviewGate() {
        super(GateType.SCRIPT_REVIEW);
    }

    @Override
    protected Map<String, Object> publish(PipelineState state) {
        log.info("Run {} waiting for script review", state.getRunId());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("script_data", state.getScriptData());
        payload.put("script_file_path", state.getScriptFilePath());
        payload.put("message", "Review the script. Approve it or send feedback for a revision.");
        return payload;
    }

    @Override
    public GateDecision decide(PipelineState state, Map<String, Object> payload) {
        boolean approved = requireBoolean(state, payload, "approved");
        String feedback = optionalString(state, payload, "feedback", null);
        log.info("Run {} script review: approved={} feedback={}", state.getRunId(), approved, feedback != null);

        StateUpdate update = StateUpdate.of(s -> {
            s.setHumanApproved(approved);
            s.setHumanFeedback(feedback);
        });
        return new GateDecision(type(), update, approved ? "approved" : "rejected");
    }
}
