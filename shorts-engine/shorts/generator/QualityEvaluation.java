package shorts.generator;

/**
 * A model's self-evaluation of a stage output.
 */
public class QualityEvaluation {

    private double score;
    private String feedback = "";

    public QualityEvaluation() {
    }

    public QualityEvaluation(double score, String feedback) {
        this.score = score;
        this.feedback = feedback;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public String getFeedback() {
        return feedback;
    }

    public void setFeedback(String feedback) {
        this.feedback = feedback;
    }
}
