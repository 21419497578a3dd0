package shorts.timeline;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.model.AudioSegment;

/**
 * Splits a flat caption stream into per-scene buckets using the measured
 * durations of the scene audio segments.
 *
 * <p>Scene {@code i} owns the window {@code [cursor, cursor + duration_i)} where
 * the cursor is the sum of all previous durations. A caption belongs to the
 * window containing its midpoint and is never split across scenes. When the last
 * caption of a bucket ends less than {@code toleranceSec} before the window end,
 * its end is moved to the window end so captions stay on screen until the scene
 * cuts.
 *
 * <p>The result does not depend on the order captions arrive in.
 */
public class SceneTimelineComposer {

    private static final Logger log = LoggerFactory.getLogger(SceneTimelineComposer.class);

    public static final double DEFAULT_TOLERANCE_SEC = 1.0;

    private final double toleranceSec;

    public SceneTimelineComposer() {
        this(DEFAULT_TOLERANCE_SEC);
    }

    public SceneTimelineComposer(double toleranceSec) {
        if (toleranceSec < 0) {
            throw new IllegalArgumentException("toleranceSec must not be negative");
        }
        this.toleranceSec = toleranceSec;
    }

    public List<CaptionBucket> compose(List<AudioSegment> segments, List<Caption> captions) {
        double[] starts = new double[segments.size()];
        double[] ends = new double[segments.size()];
        double cursor = 0.0;
        for (int i = 0; i < segments.size(); i++) {
            starts[i] = cursor;
            cursor += segments.get(i).getDuration();
            ends[i] = cursor;
        }

        List<List<Caption>> assigned = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            assigned.add(new ArrayList<>());
        }

        List<Caption> ordered = new ArrayList<>(captions);
        ordered.sort(Caption.TIMELINE_ORDER);

        int dropped = 0;
        for (Caption caption : ordered) {
            int index = windowIndexOf(caption.midpoint(), starts, ends);
            if (index < 0) {
                dropped++;
                log.debug("Caption outside every scene window dropped: {}", caption);
                continue;
            }
            assigned.get(index).add(caption);
        }
        if (dropped > 0) {
            log.warn("{} of {} captions fell outside the narration timeline ({}s)", dropped, captions.size(), cursor);
        }

        List<CaptionBucket> buckets = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            List<Caption> bucket = assigned.get(i);
            if (!bucket.isEmpty()) {
                int lastIndex = bucket.size() - 1;
                Caption last = bucket.get(lastIndex);
                if (ends[i] - last.getEndSec() < toleranceSec) {
                    bucket.set(lastIndex, last.withEnd(ends[i]));
                }
            }
            buckets.add(new CaptionBucket(segments.get(i).getSceneId(), starts[i], ends[i], bucket));
        }
        return buckets;
    }

    // Windows are contiguous and sorted, so a binary search on the start offsets suffices.
    private static int windowIndexOf(double instant, double[] starts, double[] ends) {
        int low = 0;
        int high = starts.length - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (instant < starts[mid]) {
                high = mid - 1;
            } else if (instant >= ends[mid]) {
                low = mid + 1;
            } else {
                return mid;
            }
        }
        return -1;
    }
}
