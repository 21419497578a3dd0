package shorts.timeline;

import java.util.Comparator;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A transcribed caption span, offsets in seconds relative to the start of the
 * concatenated narration.
 */
public final class Caption {

    static final Comparator<Caption> TIMELINE_ORDER = Comparator
            .comparingDouble(Caption::getStartSec)
            .thenComparingDouble(Caption::getEndSec)
            .thenComparing(Caption::getText, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final double startSec;
    private final double endSec;
    private final String text;

    @JsonCreator
    public Caption(@JsonProperty("start_sec") double startSec,
                   @JsonProperty("end_sec") double endSec,
                   @JsonProperty("text") String text) {
        if (endSec < startSec) {
            throw new IllegalArgumentException("Caption ends before it starts: " + startSec + " > " + endSec);
        }
        this.startSec = startSec;
        this.endSec = endSec;
        this.text = text;
    }

    public double midpoint() {
        return (startSec + endSec) / 2.0;
    }

    public Caption withEnd(double newEndSec) {
        return new Caption(startSec, newEndSec, text);
    }

    public double getStartSec() {
        return startSec;
    }

    public double getEndSec() {
        return endSec;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Caption)) {
            return false;
        }
        Caption other = (Caption) o;
        return Double.compare(startSec, other.startSec) == 0
                && Double.compare(endSec, other.endSec) == 0
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startSec, endSec, text);
    }

    @Override
    public String toString() {
        return "[" + startSec + "-" + endSec + "] " + text;
    }
}
