package shorts.model;

public class TopicSummary {

    private String keyword;
    private String summary;
    private String source; // google_trends | news | youtube
    private double trendingScore;

    public TopicSummary() {
    }

    public TopicSummary(String keyword, String summary, String source, double trendingScore) {
        this.keyword = keyword;
        this.summary = summary;
        this.source = source;
        this.trendingScore = trendingScore;
    }

    public String getKeyword() {
        return keyword;
    }

    public void setKeyword(String keyword) {
        this.keyword = keyword;
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

    public double getTrendingScore() {
        return trendingScore;
    }

    public void setTrendingScore(double trendingScore) {
        this.trendingScore = trendingScore;
    }
}
