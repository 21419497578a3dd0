package shorts.model;

import java.util.ArrayList;
import java.util.List;

public class ScriptData {

    private String title = "";
    private String fullScript = "";
    private List<Scene> scenes = new ArrayList<>();
    private String hook = "";
    private String cta = "";
    private double estimatedDurationSec;
    private String trendBannerText;

    public static ScriptData empty() {
        return new ScriptData();
    }

    public List<String> sceneIds() {
        List<String> ids = new ArrayList<>(scenes.size());
        for (Scene scene : scenes) {
            ids.add(scene.getSceneId());
        }
        return ids;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getFullScript() {
        return fullScript;
    }

    public void setFullScript(String fullScript) {
        this.fullScript = fullScript;
    }

    public List<Scene> getScenes() {
        return scenes;
    }

    public void setScenes(List<Scene> scenes) {
        this.scenes = scenes;
    }

    public String getHook() {
        return hook;
    }

    public void setHook(String hook) {
        this.hook = hook;
    }

    public String getCta() {
        return cta;
    }

    public void setCta(String cta) {
        this.cta = cta;
    }

    public double getEstimatedDurationSec() {
        return estimatedDurationSec;
    }

    public void setEstimatedDurationSec(double estimatedDurationSec) {
        this.estimatedDurationSec = estimatedDurationSec;
    }

    public String getTrendBannerText() {
        return trendBannerText;
    }

    public void setTrendBannerText(String trendBannerText) {
        this.trendBannerText = trendBannerText;
    }
}
