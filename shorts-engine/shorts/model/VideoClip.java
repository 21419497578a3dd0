package shorts.model;

public class VideoClip {

    private String sceneId;
    private String videoPath = ""; // empty when the scene has no clip
    private double duration;

    public VideoClip() {
    }

    public VideoClip(String sceneId, String videoPath, double duration) {
        this.sceneId = sceneId;
        this.videoPath = videoPath;
        this.duration = duration;
    }

    public boolean hasVideo() {
        return videoPath != null && !videoPath.isEmpty();
    }

    public String getSceneId() {
        return sceneId;
    }

    public void setSceneId(String sceneId) {
        this.sceneId = sceneId;
    }

    public String getVideoPath() {
        return videoPath;
    }

    public void setVideoPath(String videoPath) {
        this.videoPath = videoPath;
    }

    public double getDuration() {
        return duration;
    }

    public void setDuration(double duration) {
        this.duration = duration;
    }
}
