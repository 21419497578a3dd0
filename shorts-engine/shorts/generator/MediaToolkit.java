package shorts.generator;

import java.nio.file.Path;
import java.util.List;

import shorts.timeline.RenderPlan;

/**
 * Local media operations: probing, joining and rendering.
 */
public interface MediaToolkit {

    /**
     * Duration of an audio or video file in seconds.
     */
    double probeDuration(Path media);

    /**
     * Joins audio files end to end, in the given order.
     */
    Path concatenate(List<Path> inputs, Path output);

    /**
     * Renders the final vertical video described by {@code plan}.
     */
    Path render(RenderPlan plan, Path output);
}
