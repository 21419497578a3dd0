package shorts.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured answer of the trend analysis prompt.
 */
public class TrendAnalysis {

    private List<KeywordAnalysis> analyses = new ArrayList<>();
    private String recommendedTopic = "";
    private String recommendedCategory = "";
    private String reasoning = "";

    public List<KeywordAnalysis> getAnalyses() {
        return analyses;
    }

    public void setAnalyses(List<KeywordAnalysis> analyses) {
        this.analyses = analyses;
    }

    public String getRecommendedTopic() {
        return recommendedTopic;
    }

    public void setRecommendedTopic(String recommendedTopic) {
        this.recommendedTopic = recommendedTopic;
    }

    public String getRecommendedCategory() {
        return recommendedCategory;
    }

    public void setRecommendedCategory(String recommendedCategory) {
        this.recommendedCategory = recommendedCategory;
    }

    public String getReasoning() {
        return reasoning;
    }

    public void setReasoning(String reasoning) {
        this.reasoning = reasoning;
    }
}
