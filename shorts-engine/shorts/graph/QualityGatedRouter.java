package shorts.graph;

import shorts.model.EditorOutput;
import shorts.model.PipelineState;
import shorts.model.QualityAssessment;

/**
 * The transition function of the workflow graph.
 *
 * <p>A retryable stage moves on when its latest assessment passed (or there is
 * none), runs again while it has attempts left, and otherwise goes to its
 * failure successor. {@code maxRetries} counts re-attempts: a stage runs at
 * most {@code maxRetries + 1} times over the life of a run.
 *
 * <p>Assembly is the only stage whose exhaustion still completes the run; the
 * artifact is then flagged as degraded.
 */
public class QualityGatedRouter {

    private final int maxRetries;

    public QualityGatedRouter(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
    }

    public Stage route(Stage current, PipelineState state) {
        return switch (current) {
            case RESEARCH, DRAFT, MEDIA, ASSEMBLE -> routeRetryable(current, state);
            case TOPIC_GATE -> Stage.SPEAKER_GATE;
            case SPEAKER_GATE -> Stage.DRAFT;
            case REVIEW_GATE -> Boolean.TRUE.equals(state.getHumanApproved()) ? Stage.AUDIO_CHOICE_GATE : Stage.DRAFT;
            case AUDIO_CHOICE_GATE -> Stage.MEDIA;
            case HOOK_GATE -> Stage.ASSEMBLE;
            case COMPLETED, FAILED -> current;
        };
    }

    /**
     * True when {@code current} failed its latest attempt and has no attempts left.
     */
    public boolean isExhausted(Stage current, PipelineState state) {
        if (!current.isRetryable()) {
            return false;
        }
        QualityAssessment quality = assessmentOf(current, state);
        return quality != null && !quality.isPassed() && retriesUsed(current, state) >= maxRetries;
    }

    /**
     * Writes the outcome of an exhausted stage: the error summary for stages that
     * fail the run, the degraded flag for assembly.
     */
    public void recordExhaustion(Stage current, PipelineState state) {
        if (current == Stage.ASSEMBLE) {
            if (state.getEditorOutput() == null) {
                state.setEditorOutput(EditorOutput.empty());
            }
            state.getEditorOutput().setDegraded(true);
            return;
        }
        QualityAssessment quality = assessmentOf(current, state);
        state.setError(String.format("Stage '%s' failed after %d attempts (score %.2f): %s",
                current.key(),
                state.attemptsOf(current.key()),
                quality == null ? 0.0 : quality.getScore(),
                quality == null ? "no assessment" : quality.getFeedback()));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private Stage routeRetryable(Stage current, PipelineState state) {
        QualityAssessment quality = assessmentOf(current, state);
        if (quality == null || quality.isPassed()) {
            return successorOf(current);
        }
        if (retriesUsed(current, state) < maxRetries) {
            return current;
        }
        return current == Stage.ASSEMBLE ? Stage.COMPLETED : Stage.FAILED;
    }

    // The counter holds attempts so far; the first attempt is not a retry.
    private static int retriesUsed(Stage stage, PipelineState state) {
        return Math.max(0, state.attemptsOf(stage.key()) - 1);
    }

    // An assessment left over from an earlier stage does not count for this one.
    private static QualityAssessment assessmentOf(Stage stage, PipelineState state) {
        QualityAssessment quality = state.getQuality();
        if (quality == null || !stage.key().equals(quality.getStageName())) {
            return null;
        }
        return quality;
    }

    private static Stage successorOf(Stage stage) {
        return switch (stage) {
            case RESEARCH -> Stage.TOPIC_GATE;
            case DRAFT -> Stage.REVIEW_GATE;
            case MEDIA -> Stage.HOOK_GATE;
            case ASSEMBLE -> Stage.COMPLETED;
            default -> throw new IllegalStateException("No successor for " + stage);
        };
    }
}
