package shorts.timeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes captions in SubRip format.
 */
public final class SrtWriter {

    private SrtWriter() {
    }

    public static Path write(List<CaptionBucket> buckets, Path output) throws IOException {
        List<Caption> captions = new ArrayList<>();
        for (CaptionBucket bucket : buckets) {
            captions.addAll(bucket.getCaptions());
        }
        Path parent = output.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, format(captions), StandardCharsets.UTF_8);
        return output;
    }

    public static String format(List<Caption> captions) {
        StringBuilder srt = new StringBuilder();
        int index = 1;
        for (Caption caption : captions) {
            srt.append(index++).append('\n')
                    .append(timestamp(caption.getStartSec()))
                    .append(" --> ")
                    .append(timestamp(caption.getEndSec()))
                    .append('\n')
                    .append(caption.getText() == null ? "" : caption.getText().strip())
                    .append("\n\n");
        }
        return srt.toString();
    }

    static String timestamp(double seconds) {
        long millis = Math.round(seconds * 1000.0);
        long hours = millis / 3_600_000;
        long minutes = (millis / 60_000) % 60;
        long secs = (millis / 1000) % 60;
        long ms = millis % 1000;
        return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, ms);
    }
}
