package shorts.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PipelineSettings Tests")
class PipelineSettingsTest {

    @Test
    @DisplayName("Missing properties fall back to the defaults")
    void defaults() {
        PipelineSettings settings = PipelineSettings.from(ShortsProperties.fromMap(Map.of()));

        assertThat(settings.getMaxRetries()).isEqualTo(2);
        assertThat(settings.getQualityThreshold()).isEqualTo(0.7);
        assertThat(settings.getCaptionToleranceSec()).isEqualTo(1.0);
        assertThat(settings.getVideoWidth()).isEqualTo(1080);
        assertThat(settings.getVideoHeight()).isEqualTo(1920);
        assertThat(settings.getMinDurationSec()).isEqualTo(30.0);
        assertThat(settings.getOutputDir()).isEqualTo(Path.of("output"));
        assertThat(settings.getRoster().members()).isEmpty();
        assertThat(settings.getRoster().getFallbackVoiceId()).isEqualTo("default_voice_id");
    }

    @Test
    @DisplayName("Flat keys bind to typed values, nested groups and the roster list")
    void bindsProperties() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("shorts.max-retries", "4");
        values.put("shorts.quality-threshold", "0.8");
        values.put("shorts.video.width", "720");
        values.put("shorts.video.max-duration-sec", "90");
        values.put("shorts.output-dir", "/tmp/shorts");
        values.put("shorts.roster.1.key", "me");
        values.put("shorts.roster.1.name", "Me");
        values.put("shorts.roster.1.voice-id", "voice-me");
        values.put("shorts.roster.2.key", "jiho");
        values.put("shorts.voice.fallback", "narrator");
        values.put("shorts.demo.failure-rate", "0.25");
        values.put("shorts.unknown-key", "ignored");

        ShortsProperties properties = ShortsProperties.fromMap(values);
        PipelineSettings settings = PipelineSettings.from(properties);

        assertThat(settings.getMaxRetries()).isEqualTo(4);
        assertThat(settings.getQualityThreshold()).isEqualTo(0.8);
        assertThat(settings.getVideoWidth()).isEqualTo(720);
        assertThat(settings.getVideoHeight()).isEqualTo(1920);
        assertThat(settings.getMaxDurationSec()).isEqualTo(90.0);
        assertThat(settings.getOutputDir()).isEqualTo(Path.of("/tmp/shorts"));
        assertThat(settings.getRoster().members())
                .extracting(SpeakerRoster.Member::getKey)
                .containsExactly("me", "jiho");
        assertThat(settings.getRoster().find("me").orElseThrow().getVoiceId()).isEqualTo("voice-me");
        assertThat(settings.getRoster().find("jiho").orElseThrow().getName()).isEqualTo("jiho");
        assertThat(settings.getRoster().getFallbackVoiceId()).isEqualTo("narrator");
        assertThat(properties.getDemo().getFailureRate()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("A value that is not a number is rejected")
    void malformedValue() {
        assertThatThrownBy(() -> ShortsProperties.fromMap(Map.of("shorts.max-retries", "two")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to bind");
    }

    @Test
    @DisplayName("The bundled properties file is loaded and system properties win")
    void loadWithOverride() {
        System.setProperty("shorts.max-retries", "5");
        System.setProperty("shorts.roster.1.voice-id", "voice-override");
        try {
            PipelineSettings settings = PipelineSettings.load();

            assertThat(settings.getMaxRetries()).isEqualTo(5);
            assertThat(settings.getQualityThreshold()).isEqualTo(0.7);
            assertThat(settings.getRoster().members()).hasSize(8);
            assertThat(settings.getRoster().members().get(0).getKey()).isEqualTo("me");
            assertThat(settings.getRoster().find("me").orElseThrow().getVoiceId()).isEqualTo("voice-override");
            assertThat(settings.getRoster().contains("grandma")).isTrue();
            assertThat(settings.getChannelIntroText()).startsWith("Right now");
        } finally {
            System.clearProperty("shorts.max-retries");
            System.clearProperty("shorts.roster.1.voice-id");
        }
    }

    @Test
    @DisplayName("A negative retry budget is rejected")
    void negativeRetries() {
        assertThatThrownBy(() -> PipelineSettings.builder().maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRetries");

        assertThatThrownBy(() -> PipelineSettings.from(ShortsProperties.fromMap(Map.of("shorts.max-retries", "-1"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
