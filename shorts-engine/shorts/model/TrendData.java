package shorts.model;

import java.util.ArrayList;
import java.util.List;

public class TrendData {

    private List<String> keywords = new ArrayList<>();
    private List<TopicSummary> topicSummaries = new ArrayList<>();
    private String selectedTopic = "";
    private String category = "";

    public TrendData() {
    }

    public TrendData(List<String> keywords,
                     List<TopicSummary> topicSummaries,
                     String selectedTopic,
                     String category) {
        this.keywords = new ArrayList<>(keywords);
        this.topicSummaries = new ArrayList<>(topicSummaries);
        this.selectedTopic = selectedTopic;
        this.category = category;
    }

    public static TrendData empty() {
        return new TrendData();
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<TopicSummary> getTopicSummaries() {
        return topicSummaries;
    }

    public void setTopicSummaries(List<TopicSummary> topicSummaries) {
        this.topicSummaries = topicSummaries;
    }

    public String getSelectedTopic() {
        return selectedTopic;
    }

    public void setSelectedTopic(String selectedTopic) {
        this.selectedTopic = selectedTopic;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }
}
