package shorts.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One narrated unit of the script. The scene id is the join key for every
 * per-scene collection produced downstream (audio, images, clips, captions).
 */
public class Scene {

    public static final String HOST = "host";

    private String sceneId;
    private String text;
    private double duration;
    private String emotion = "neutral";
    private String imagePrompt;
    private String speaker = HOST; // host | participant_1..N

    public Scene() {
    }

    public Scene(String sceneId, String text, double duration, String emotion, String imagePrompt, String speaker) {
        this.sceneId = sceneId;
        this.text = text;
        this.duration = duration;
        this.emotion = emotion;
        this.imagePrompt = imagePrompt;
        this.speaker = speaker;
    }

    @JsonIgnore
    public boolean isHook() {
        return "hook".equals(sceneId);
    }

    @JsonIgnore
    public boolean isBody() {
        return sceneId != null && sceneId.startsWith("body_");
    }

    @JsonIgnore
    public boolean isCallToAction() {
        return sceneId != null && sceneId.startsWith("cta");
    }

    public String getSceneId() {
        return sceneId;
    }

    public void setSceneId(String sceneId) {
        this.sceneId = sceneId;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public double getDuration() {
        return duration;
    }

    public void setDuration(double duration) {
        this.duration = duration;
    }

    public String getEmotion() {
        return emotion;
    }

    public void setEmotion(String emotion) {
        this.emotion = emotion;
    }

    public String getImagePrompt() {
        return imagePrompt;
    }

    public void setImagePrompt(String imagePrompt) {
        this.imagePrompt = imagePrompt;
    }

    public String getSpeaker() {
        return speaker;
    }

    public void setSpeaker(String speaker) {
        this.speaker = speaker;
    }
}
