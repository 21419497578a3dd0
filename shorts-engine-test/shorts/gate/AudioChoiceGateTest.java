package shorts.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorts.model.AudioSource;
import shorts.model.PipelineState;
import shorts.model.Scene;
import shorts.model.ScriptData;

@DisplayName("AudioChoiceGate Tests")
class AudioChoiceGateTest {

    private final AudioChoiceGate gate = new AudioChoiceGate();
    private PipelineState state;

    @BeforeEach
    void setUp() {
        state = PipelineState.initial("run-1", "owner-1", Map.of());
        ScriptData script = ScriptData.empty();
        script.setScenes(List.of(
                new Scene("hook", "Did you hear?", 5, "excited", "hook image", Scene.HOST),
                new Scene("body_1_1", "Here is why.", 8, "informative", "body image", "participant_1")));
        state.setScriptData(script);
    }

    @Test
    @DisplayName("Publishes the scenes to record")
    @SuppressWarnings("unchecked")
    void publishesScenes() {
        Map<String, Object> payload = gate.run(state).getSuspensionPayload();

        assertThat((List<Map<String, Object>>) payload.get("scenes"))
                .extracting(m -> m.get("scene_id"))
                .containsExactly("hook", "body_1_1");
    }

    @Test
    @DisplayName("tts needs no files")
    void ttsChoice() {
        gate.decide(state, Map.of("audio_source", "tts")).getUpdate().applyTo(state);

        assertThat(state.getAudioSource()).isEqualTo(AudioSource.TTS);
        assertThat(state.getAudioFiles()).isNull();
        assertThat(state.getAudioChoiceApproved()).isTrue();
    }

    @Test
    @DisplayName("manual accepts recordings for a subset of scenes")
    void manualChoice() {
        gate.decide(state, Map.of("audio_source", "manual", "audio_files", Map.of("hook", "/rec/hook.mp3")))
                .getUpdate().applyTo(state);

        assertThat(state.getAudioSource()).isEqualTo(AudioSource.MANUAL);
        assertThat(state.getAudioFiles()).containsExactly(Map.entry("hook", "/rec/hook.mp3"));
    }

    @Test
    @DisplayName("manual without files, with unknown scenes, or an unknown source is rejected")
    void rejectsInvalidChoices() {
        assertThatThrownBy(() -> gate.decide(state, Map.of("audio_source", "manual")))
                .isInstanceOf(ResumeRejectedException.class)
                .hasMessageContaining("audio_files");
        assertThatThrownBy(() -> gate.decide(state, Map.of("audio_source", "manual",
                "audio_files", Map.of("outro", "/rec/outro.mp3"))))
                .isInstanceOf(ResumeRejectedException.class)
                .hasMessageContaining("outro");
        assertThatThrownBy(() -> gate.decide(state, Map.of("audio_source", "radio")))
                .isInstanceOf(ResumeRejectedException.class)
                .hasMessageContaining("radio");
    }
}
