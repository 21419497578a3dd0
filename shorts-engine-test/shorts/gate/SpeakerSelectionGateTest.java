package shorts.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorts.config.SpeakerRoster;
import shorts.model.PipelineState;

@DisplayName("SpeakerSelectionGate Tests")
class SpeakerSelectionGateTest {

    private final SpeakerRoster roster = new SpeakerRoster(List.of(
            new SpeakerRoster.Member("me", "Me", "Dad and host", "voice-dad"),
            new SpeakerRoster.Member("jiho", "Jiho", "Curious kid", "voice-jiho"),
            new SpeakerRoster.Member("grandma", "Grandma", "Wise grandmother", "")),
            "fallback-voice");

    private final SpeakerSelectionGate gate = new SpeakerSelectionGate(roster);
    private final PipelineState state = PipelineState.initial("run-1", "owner-1", Map.of());

    @Test
    @DisplayName("Publishes every roster member")
    @SuppressWarnings("unchecked")
    void publishesRoster() {
        Map<String, Object> payload = gate.run(state).getSuspensionPayload();

        assertThat(payload).containsEntry("type", "speaker_selection");
        assertThat((List<Map<String, Object>>) payload.get("members"))
                .extracting(m -> m.get("key"))
                .containsExactly("me", "jiho", "grandma");
    }

    @Test
    @DisplayName("Resolves voices by role, with the fallback for members without one")
    void resolvesVoices() {
        gate.decide(state, Map.of("host", "me", "participants", List.of("jiho", "grandma")))
                .getUpdate().applyTo(state);

        assertThat(state.getSelectedSpeakers().getHost()).isEqualTo("me");
        assertThat(state.getSelectedSpeakers().getParticipants()).containsExactly("jiho", "grandma");
        assertThat(state.getVoiceIds())
                .containsEntry("host", "voice-dad")
                .containsEntry("participant_1", "voice-jiho")
                .containsEntry("participant_2", "fallback-voice");
        assertThat(state.getSpeakerSelectionApproved()).isTrue();
    }

    @Test
    @DisplayName("Participants are optional")
    void participantsOptional() {
        gate.decide(state, Map.of("host", "grandma")).getUpdate().applyTo(state);

        assertThat(state.getSelectedSpeakers().getParticipants()).isEmpty();
        assertThat(state.getVoiceIds()).containsOnlyKeys("host");
    }

    @Test
    @DisplayName("Names outside the roster are rejected")
    void rejectsUnknownNames() {
        assertThatThrownBy(() -> gate.decide(state, Map.of("host", "stranger")))
                .isInstanceOf(ResumeRejectedException.class)
                .hasMessageContaining("stranger");
        assertThatThrownBy(() -> gate.decide(state, Map.of("host", "me", "participants", List.of("ghost"))))
                .isInstanceOf(ResumeRejectedException.class)
                .hasMessageContaining("ghost");
        assertThatThrownBy(() -> gate.decide(state, Map.of("host", "me", "participants", "jiho")))
                .isInstanceOf(ResumeRejectedException.class);
    }
}
