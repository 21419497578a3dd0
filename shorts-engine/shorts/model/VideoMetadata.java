package shorts.model;

import java.util.ArrayList;
import java.util.List;

public class VideoMetadata {

    private String title = "";
    private String description = "";
    private List<String> tags = new ArrayList<>();
    private String category = "";

    public VideoMetadata() {
    }

    public VideoMetadata(String title, String description, List<String> tags, String category) {
        this.title = title;
        this.description = description;
        this.tags = new ArrayList<>(tags);
        this.category = category;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }
}
