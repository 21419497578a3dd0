package shorts.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorts.model.SelectedSpeakers;

@DisplayName("SpeakerRoster Tests")
class SpeakerRosterTest {

    private final SpeakerRoster roster = new SpeakerRoster(List.of(
            new SpeakerRoster.Member("me", "Me", "Dad and host", "voice-me"),
            new SpeakerRoster.Member("jiho", "Jiho", "Curious kid", "voice-jiho"),
            new SpeakerRoster.Member("grandma", "Grandma", "Wise", "")), "fallback");

    @Test
    @DisplayName("Voices are keyed by scene speaker tag in participant order")
    void resolvesVoices() {
        Map<String, String> voices = roster.resolveVoices(new SelectedSpeakers("me", List.of("grandma", "jiho")));

        assertThat(voices).containsExactly(
                Map.entry("host", "voice-me"),
                Map.entry("participant_1", "fallback"),
                Map.entry("participant_2", "voice-jiho"));
    }

    @Test
    @DisplayName("Unknown members get the fallback voice")
    void unknownMember() {
        assertThat(roster.resolveVoices(new SelectedSpeakers("stranger", List.of())))
                .containsExactly(Map.entry("host", "fallback"));
    }

    @Test
    @DisplayName("Lookup keeps roster order")
    void lookup() {
        assertThat(roster.contains("jiho")).isTrue();
        assertThat(roster.find("nobody")).isEmpty();
        assertThat(roster.members()).extracting(SpeakerRoster.Member::getName)
                .containsExactly("Me", "Jiho", "Grandma");
        assertThat(roster.find("me").orElseThrow().getPhotoUrl()).isEqualTo("/files/assets/pic/me.jpeg");
    }
}
