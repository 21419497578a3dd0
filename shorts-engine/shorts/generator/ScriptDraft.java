package shorts.generator;

import java.util.ArrayList;
import java.util.List;

import shorts.model.Scene;

/**
 * Structured answer of the scriptwriting prompt: a hook, three body parts and
 * a call to action, split into one scene per speaker turn.
 */
public class ScriptDraft {

    private String title = "";
    private String hookText = "";
    private List<BodyPart> bodyParts = new ArrayList<>();
    private String ctaText = "";
    private List<Scene> scenes = new ArrayList<>();
    private String trendBannerText = "";
    private double estimatedDurationSec;

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getHookText() {
        return hookText;
    }

    public void setHookText(String hookText) {
        this.hookText = hookText;
    }

    public List<BodyPart> getBodyParts() {
        return bodyParts;
    }

    public void setBodyParts(List<BodyPart> bodyParts) {
        this.bodyParts = bodyParts;
    }

    public String getCtaText() {
        return ctaText;
    }

    public void setCtaText(String ctaText) {
        this.ctaText = ctaText;
    }

    public List<Scene> getScenes() {
        return scenes;
    }

    public void setScenes(List<Scene> scenes) {
        this.scenes = scenes;
    }

    public String getTrendBannerText() {
        return trendBannerText;
    }

    public void setTrendBannerText(String trendBannerText) {
        this.trendBannerText = trendBannerText;
    }

    public double getEstimatedDurationSec() {
        return estimatedDurationSec;
    }

    public void setEstimatedDurationSec(double estimatedDurationSec) {
        this.estimatedDurationSec = estimatedDurationSec;
    }
}
