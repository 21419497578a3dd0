package shorts.timeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("SrtWriter Tests")
class SrtWriterTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "0.0     | 00:00:00,000",
            "1.5     | 00:00:01,500",
            "61.0004 | 00:01:01,000",
            "3725.25 | 01:02:05,250",
            "2.9996  | 00:00:03,000"
    })
    @DisplayName("Timestamps are rounded to the millisecond")
    void formatsTimestamps(double seconds, String expected) {
        assertThat(SrtWriter.timestamp(seconds)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Cues are numbered from one and separated by blank lines")
    void formatsCues() {
        String srt = SrtWriter.format(List.of(
                new Caption(0.0, 1.2, " Hello there "),
                new Caption(1.2, 2.5, "Second line")));

        assertThat(srt).isEqualTo("""
                1
                00:00:00,000 --> 00:00:01,200
                Hello there

                2
                00:00:01,200 --> 00:00:02,500
                Second line

                """);
    }

    @Test
    @DisplayName("Writes every bucket in order and creates missing directories")
    void writesBuckets(@TempDir Path dir) throws Exception {
        Path output = dir.resolve("nested/out/captions.srt");
        List<CaptionBucket> buckets = List.of(
                new CaptionBucket("hook", 0.0, 3.0, List.of(new Caption(0.0, 3.0, "one"))),
                new CaptionBucket("body_1_1", 3.0, 5.0, List.of()),
                new CaptionBucket("cta", 5.0, 7.0, List.of(new Caption(5.2, 7.0, "two"))));

        SrtWriter.write(buckets, output);

        String content = Files.readString(output, StandardCharsets.UTF_8);
        assertThat(content).startsWith("1\n00:00:00,000 --> 00:00:03,000\none\n");
        assertThat(content).contains("2\n00:00:05,200 --> 00:00:07,000\ntwo\n");
    }
}
