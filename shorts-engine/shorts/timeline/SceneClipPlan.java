package shorts.timeline;

import java.util.List;

/**
 * One clip of the final video. Caption offsets are on the narration timeline;
 * subtract {@link #getSceneStart()} to place them inside the clip.
 */
public final class SceneClipPlan {

    private final String sceneId;
    private final String audioPath;
    private final String imagePath;
    private final String videoPath; // null: still image
    private final List<Caption> captions;
    private final double sceneStart;
    private final double duration;
    private final String bannerText; // null: no banner
    private final boolean intro;

    public SceneClipPlan(String sceneId,
                         String audioPath,
                         String imagePath,
                         String videoPath,
                         List<Caption> captions,
                         double sceneStart,
                         double duration,
                         String bannerText,
                         boolean intro) {
        this.sceneId = sceneId;
        this.audioPath = audioPath;
        this.imagePath = imagePath;
        this.videoPath = videoPath;
        this.captions = List.copyOf(captions);
        this.sceneStart = sceneStart;
        this.duration = duration;
        this.bannerText = bannerText;
        this.intro = intro;
    }

    public String getSceneId() {
        return sceneId;
    }

    public String getAudioPath() {
        return audioPath;
    }

    public String getImagePath() {
        return imagePath;
    }

    public String getVideoPath() {
        return videoPath;
    }

    public boolean hasVideo() {
        return videoPath != null && !videoPath.isEmpty();
    }

    public List<Caption> getCaptions() {
        return captions;
    }

    public double getSceneStart() {
        return sceneStart;
    }

    public double getDuration() {
        return duration;
    }

    public String getBannerText() {
        return bannerText;
    }

    public boolean isIntro() {
        return intro;
    }
}
