package shorts.model;

public class ImageAsset {

    private String sceneId;
    private String imagePath;
    private String prompt;

    public ImageAsset() {
    }

    public ImageAsset(String sceneId, String imagePath, String prompt) {
        this.sceneId = sceneId;
        this.imagePath = imagePath;
        this.prompt = prompt;
    }

    public String getSceneId() {
        return sceneId;
    }

    public void setSceneId(String sceneId) {
        this.sceneId = sceneId;
    }

    public String getImagePath() {
        return imagePath;
    }

    public void setImagePath(String imagePath) {
        this.imagePath = imagePath;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }
}
