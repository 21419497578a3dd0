package shorts.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorts.model.PipelineState;

@DisplayName("HookPromptGate Tests")
class HookPromptGateTest {

    private final HookPromptGate gate = new HookPromptGate();
    private PipelineState state;

    @BeforeEach
    void setUp() {
        state = PipelineState.initial("run-1", "owner-1", Map.of());
        state.setHookVideoPrompt("Family around a kitchen table, slow push-in");
    }

    @Test
    @DisplayName("An empty decision keeps the generated prompt in video mode")
    void defaults() {
        gate.decide(state, Map.of()).getUpdate().applyTo(state);

        assertThat(state.getHookVideoPrompt()).isEqualTo("Family around a kitchen table, slow push-in");
        assertThat(state.getHookMode()).isEqualTo(HookPromptGate.MODE_VIDEO);
        assertThat(state.getHookPromptApproved()).isTrue();
    }

    @Test
    @DisplayName("An edited prompt and image mode are applied")
    void editedPrompt() {
        gate.decide(state, Map.of("prompt", "Close-up of a calendar", "hook_mode", "image"))
                .getUpdate().applyTo(state);

        assertThat(state.getHookVideoPrompt()).isEqualTo("Close-up of a calendar");
        assertThat(state.getHookMode()).isEqualTo(HookPromptGate.MODE_IMAGE);
    }

    @Test
    @DisplayName("Unknown hook modes are rejected")
    void rejectsUnknownMode() {
        assertThatThrownBy(() -> gate.decide(state, Map.of("hook_mode", "gif")))
                .isInstanceOf(ResumeRejectedException.class)
                .hasMessageContaining("gif");
    }
}
