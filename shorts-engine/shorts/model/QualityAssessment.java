package shorts.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A stage's verdict on its own output, consumed only by the router.
 */
public final class QualityAssessment {

    private final String stageName;
    private final boolean passed;
    private final double score; // 0.0 - 1.0
    private final String feedback;
    private final int attempt;

    @JsonCreator
    public QualityAssessment(@JsonProperty("stage_name") String stageName,
                             @JsonProperty("passed") boolean passed,
                             @JsonProperty("score") double score,
                             @JsonProperty("feedback") String feedback,
                             @JsonProperty("attempt") int attempt) {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1]: " + score);
        }
        this.stageName = stageName;
        this.passed = passed;
        this.score = score;
        this.feedback = feedback;
        this.attempt = attempt;
    }

    public static QualityAssessment fromScore(String stageName, double score, double threshold,
                                              String feedback, int attempt) {
        double clamped = Math.max(0.0, Math.min(1.0, score));
        return new QualityAssessment(stageName, clamped >= threshold, clamped, feedback, attempt);
    }

    public static QualityAssessment crashed(String stageName, String feedback, int attempt) {
        return new QualityAssessment(stageName, false, 0.0, feedback, attempt);
    }

    public String getStageName() {
        return stageName;
    }

    public boolean isPassed() {
        return passed;
    }

    public double getScore() {
        return score;
    }

    public String getFeedback() {
        return feedback;
    }

    public int getAttempt() {
        return attempt;
    }

    @Override
    public String toString() {
        return stageName + "#" + attempt + (passed ? " passed " : " failed ") + score;
    }
}
