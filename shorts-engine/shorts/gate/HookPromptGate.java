package shorts.gate;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.graph.StateUpdate;
import shorts.model.PipelineState;

/**
 * Shows the generated hook video prompt before the expensive video call. The
 * user may edit it and may ask for a still image instead of a clip.
 */
public class HookPromptGate extends HumanGate {

    public static final String MODE_VIDEO = "video";
    public static final String MODE_IMAGE = "image";

    private static final Logger log = LoggerFactory.getLogger(HookPromptGate.class);

    public HookPromptGate() {
        super(GateType.HOOK_PROMPT);
    }

    @Override
    protected Map<String, Object> publish(PipelineState state) {
        log.info("Run {} waiting for hook prompt review", state.getRunId());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", publishedPrompt(state));
        payload.put("message", "Review the hook video prompt. Edit it or approve it as is.");
        return payload;
    }

    @Override
    public GateDecision decide(PipelineState state, Map<String, Object> payload) {
        String published = publishedPrompt(state);
        String prompt = optionalString(state, payload, "prompt", published);
        String mode = optionalString(state, payload, "hook_mode", MODE_VIDEO);
        if (!MODE_VIDEO.equals(mode) && !MODE_IMAGE.equals(mode)) {
            throw new ResumeRejectedException(state.getRunId(), "hook_mode must be video or image, got '" + mode + "'");
        }
        log.info("Run {} hook prompt approved (changed={}, mode={})", state.getRunId(), !prompt.equals(published), mode);

        StateUpdate update = StateUpdate.of(s -> {
            s.setHookVideoPrompt(prompt);
            s.setHookMode(mode);
            s.setHookPromptApproved(true);
        });
        return new GateDecision(type(), update, "mode=" + mode);
    }

    private static String publishedPrompt(PipelineState state) {
        return state.getHookVideoPrompt() == null ? "" : state.getHookVideoPrompt();
    }
}
