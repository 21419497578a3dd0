package shorts.generator;

public class KeywordAnalysis {

    private String keyword;
    private String whyTrending;
    private String category;
    private double relevanceScore; // 0.0 - 1.0, fitness as a shorts topic
    private String summary;
    private String source;

    public KeywordAnalysis() {
    }

    public KeywordAnalysis(String keyword, String whyTrending, String category, double relevanceScore,
                           String summary, String source) {
        this.keyword = keyword;
        this.whyTrending = whyTrending;
        this.category = category;
        this.relevanceScore = relevanceScore;
        this.summary = summary;
        this.source = source;
    }

    public String getKeyword() {
        return keyword;
    }

    public void setKeyword(String keyword) {
        this.keyword = keyword;
    }

    public String getWhyTrending() {
        return whyTrending;
    }

    public void setWhyTrending(String whyTrending) {
        this.whyTrending = whyTrending;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public double getRelevanceScore() {
        return relevanceScore;
    }

    public void setRelevanceScore(double relevanceScore) {
        this.relevanceScore = relevanceScore;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }
}
