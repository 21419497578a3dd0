package shorts.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.graph.NodeResult;
import shorts.graph.Stage;
import shorts.graph.StageNode;
import shorts.graph.StateUpdate;
import shorts.model.PipelineState;
import shorts.model.QualityAssessment;

/**
 * Base for generation stages. Counts the attempt, runs the stage body, and
 * turns any exception into a failing assessment so the router can retry.
 * Errors never escape as exceptions from here.
 */
public abstract class QualityStage implements StageNode {

    private static final Logger log = LoggerFactory.getLogger(QualityStage.class);

    /**
     * What one attempt produced: fields to write and the stage's own verdict.
     */
    protected static final class Outcome {

        private final StateUpdate update;
        private final QualityAssessment quality;

        public Outcome(StateUpdate update, QualityAssessment quality) {
            this.update = update;
            this.quality = quality;
        }
    }

    private final Stage stage;
    private final String label;

    protected QualityStage(Stage stage, String label) {
        if (!stage.isRetryable()) {
            throw new IllegalArgumentException(stage.key() + " is not a generation stage");
        }
        this.stage = stage;
        this.label = label;
    }

    @Override
    public Stage stage() {
        return stage;
    }

    @Override
    public final NodeResult run(PipelineState state) {
        String key = stage.key();
        int attempt = state.attemptsOf(key) + 1;
        log.info("Run {} {} started (attempt {})", state.getRunId(), key, attempt);

        StateUpdate update;
        try {
            Outcome outcome = produce(state, attempt);
            QualityAssessment quality = outcome.quality;
            update = outcome.update.and(s -> s.setQuality(quality));
            log.info("Run {} {} done: score={} passed={}", state.getRunId(), key, quality.getScore(), quality.isPassed());
        } catch (Exception e) {
            log.error("Run {} {} attempt {} failed", state.getRunId(), key, attempt, e);
            QualityAssessment crashed = QualityAssessment.crashed(key, label + " failed due to an error. Will retry.", attempt);
            update = onFailure(state).and(s -> s.setQuality(crashed));
        }
        return NodeResult.update(update.and(s -> s.recordAttempt(key, attempt)));
    }

    /**
     * One attempt of the stage. May throw anything; the base class records it.
     */
    protected abstract Outcome produce(PipelineState state, int attempt) throws Exception;

    /**
     * Fields to reset when an attempt throws.
     */
    protected StateUpdate onFailure(PipelineState state) {
        return StateUpdate.none();
    }

    protected QualityAssessment assess(double score, double threshold, String feedback, int attempt) {
        return QualityAssessment.fromScore(stage.key(), score, threshold, feedback, attempt);
    }
}
