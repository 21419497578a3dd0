package shorts.model;

/**
 * Descriptor of the assembled short. {@code degraded} marks an artifact that
 * was accepted after the assembly stage ran out of retries.
 */
public class EditorOutput {

    private String finalVideoPath = "";
    private String captionSrtPath = "";
    private String thumbnailPath = "";
    private VideoMetadata metadata = new VideoMetadata();
    private double durationSec;
    private boolean degraded;

    public static EditorOutput empty() {
        return new EditorOutput();
    }

    public boolean hasVideo() {
        return finalVideoPath != null && !finalVideoPath.isEmpty();
    }

    public String getFinalVideoPath() {
        return finalVideoPath;
    }

    public void setFinalVideoPath(String finalVideoPath) {
        this.finalVideoPath = finalVideoPath;
    }

    public String getCaptionSrtPath() {
        return captionSrtPath;
    }

    public void setCaptionSrtPath(String captionSrtPath) {
        this.captionSrtPath = captionSrtPath;
    }

    public String getThumbnailPath() {
        return thumbnailPath;
    }

    public void setThumbnailPath(String thumbnailPath) {
        this.thumbnailPath = thumbnailPath;
    }

    public VideoMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(VideoMetadata metadata) {
        this.metadata = metadata;
    }

    public double getDurationSec() {
        return durationSec;
    }

    public void setDurationSec(double durationSec) {
        this.durationSec = durationSec;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }
}
