package shorts.timeline;

import java.util.List;

/**
 * Everything the renderer needs: clip order, geometry and optional background music.
 */
public final class RenderPlan {

    private final List<SceneClipPlan> clips;
    private final int width;
    private final int height;
    private final int fps;
    private final String bgmPath;

    public RenderPlan(List<SceneClipPlan> clips, int width, int height, int fps, String bgmPath) {
        this.clips = List.copyOf(clips);
        this.width = width;
        this.height = height;
        this.fps = fps;
        this.bgmPath = bgmPath;
    }

    public double totalDurationSec() {
        return clips.stream().mapToDouble(SceneClipPlan::getDuration).sum();
    }

    public List<SceneClipPlan> getClips() {
        return clips;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getFps() {
        return fps;
    }

    public String getBgmPath() {
        return bgmPath;
    }
}
