package shorts.timeline;

import java.util.List;

/**
 * Captions that belong to one scene, with the scene's window on the narration
 * timeline ({@code [windowStart, windowEnd)}).
 */
public final class CaptionBucket {

    private final String sceneId;
    private final double windowStart;
    private final double windowEnd;
    private final List<Caption> captions;

    public CaptionBucket(String sceneId, double windowStart, double windowEnd, List<Caption> captions) {
        this.sceneId = sceneId;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.captions = List.copyOf(captions);
    }

    public boolean contains(double instant) {
        return windowStart <= instant && instant < windowEnd;
    }

    public boolean isEmpty() {
        return captions.isEmpty();
    }

    public String getSceneId() {
        return sceneId;
    }

    public double getWindowStart() {
        return windowStart;
    }

    public double getWindowEnd() {
        return windowEnd;
    }

    public List<Caption> getCaptions() {
        return captions;
    }
}
