package shorts.model;

public class AudioSegment {

    private String sceneId;
    private String audioPath;
    private double duration; // measured, seconds

    public AudioSegment() {
    }

    public AudioSegment(String sceneId, String audioPath, double duration) {
        this.sceneId = sceneId;
        this.audioPath = audioPath;
        this.duration = duration;
    }

    public String getSceneId() {
        return sceneId;
    }

    public void setSceneId(String sceneId) {
        this.sceneId = sceneId;
    }

    public String getAudioPath() {
        return audioPath;
    }

    public void setAudioPath(String audioPath) {
        this.audioPath = audioPath;
    }

    public double getDuration() {
        return duration;
    }

    public void setDuration(double duration) {
        this.duration = duration;
    }
}
