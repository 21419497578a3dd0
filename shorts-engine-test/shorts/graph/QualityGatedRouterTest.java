package shorts.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import shorts.model.EditorOutput;
import shorts.model.PipelineState;
import shorts.model.QualityAssessment;

@DisplayName("QualityGatedRouter Tests")
class QualityGatedRouterTest {

    private final QualityGatedRouter router = new QualityGatedRouter(2);
    private PipelineState state;

    @BeforeEach
    void setUp() {
        state = PipelineState.initial("run-1", "owner-1", Map.of());
    }

    private void assess(Stage stage, boolean passed, int attempt) {
        state.setQuality(new QualityAssessment(stage.key(), passed, passed ? 0.9 : 0.4, "feedback", attempt));
        state.recordAttempt(stage.key(), attempt);
    }

    @ParameterizedTest
    @CsvSource({
            "RESEARCH, TOPIC_GATE",
            "DRAFT, REVIEW_GATE",
            "MEDIA, HOOK_GATE",
            "ASSEMBLE, COMPLETED"
    })
    @DisplayName("A passed stage moves to its successor")
    void passedStageMovesOn(Stage stage, Stage successor) {
        assess(stage, true, 1);

        assertThat(router.route(stage, state)).isEqualTo(successor);
        assertThat(router.isExhausted(stage, state)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = Stage.class, names = {"RESEARCH", "DRAFT", "MEDIA", "ASSEMBLE"})
    @DisplayName("A failed stage runs again while attempts remain")
    void failedStageRetries(Stage stage) {
        assess(stage, false, 1);
        assertThat(router.route(stage, state)).isEqualTo(stage);

        assess(stage, false, 2);
        assertThat(router.route(stage, state)).isEqualTo(stage);
    }

    @ParameterizedTest
    @EnumSource(value = Stage.class, names = {"RESEARCH", "DRAFT", "MEDIA"})
    @DisplayName("Exhausting the retries fails the run")
    void exhaustionFails(Stage stage) {
        assess(stage, false, 4);

        assertThat(router.route(stage, state)).isEqualTo(Stage.FAILED);
        assertThat(router.isExhausted(stage, state)).isTrue();

        router.recordExhaustion(stage, state);
        assertThat(state.getError())
                .isEqualTo("Stage '" + stage.key() + "' failed after 4 attempts (score 0.40): feedback");
    }

    @Test
    @DisplayName("A stage runs at most maxRetries + 1 times")
    void retryBudget() {
        for (int attempt = 1; attempt <= 3; attempt++) {
            assess(Stage.DRAFT, false, attempt);
            Stage next = router.route(Stage.DRAFT, state);
            if (attempt < 3) {
                assertThat(next).isEqualTo(Stage.DRAFT);
            } else {
                assertThat(next).isEqualTo(Stage.FAILED);
            }
        }
    }

    // R counts re-attempts, so a stage gets R + 1 failing assessments before it is
    // abandoned. Two failures with R = 2 still allow the third, passing attempt.
    @Test
    @DisplayName("R consecutive failures leave one retry; R + 1 never route back")
    void consecutiveFailureBoundary() {
        assess(Stage.RESEARCH, false, 1);
        assess(Stage.RESEARCH, false, 2);
        assertThat(router.route(Stage.RESEARCH, state)).isEqualTo(Stage.RESEARCH);
        assertThat(router.isExhausted(Stage.RESEARCH, state)).isFalse();

        assess(Stage.RESEARCH, false, 3);
        assertThat(router.route(Stage.RESEARCH, state)).isEqualTo(Stage.FAILED);
        assertThat(router.isExhausted(Stage.RESEARCH, state)).isTrue();

        assess(Stage.RESEARCH, true, 3);
        assertThat(router.route(Stage.RESEARCH, state)).isEqualTo(Stage.TOPIC_GATE);
    }

    @Test
    @DisplayName("Assembly exhaustion completes with a degraded artifact")
    void assemblyExhaustionDegrades() {
        assess(Stage.ASSEMBLE, false, 3);

        assertThat(router.route(Stage.ASSEMBLE, state)).isEqualTo(Stage.COMPLETED);
        router.recordExhaustion(Stage.ASSEMBLE, state);

        assertThat(state.getEditorOutput()).isNotNull();
        assertThat(state.getEditorOutput().isDegraded()).isTrue();
        assertThat(state.getError()).isNull();
    }

    @Test
    @DisplayName("Degrading keeps the partial artifact")
    void degradingKeepsPaths() {
        EditorOutput output = EditorOutput.empty();
        output.setFinalVideoPath("out/final.mp4");
        state.setEditorOutput(output);
        assess(Stage.ASSEMBLE, false, 3);

        router.recordExhaustion(Stage.ASSEMBLE, state);

        assertThat(state.getEditorOutput().getFinalVideoPath()).isEqualTo("out/final.mp4");
    }

    @Test
    @DisplayName("An assessment from another stage is ignored")
    void staleAssessmentIgnored() {
        assess(Stage.RESEARCH, false, 3);

        assertThat(router.route(Stage.DRAFT, state)).isEqualTo(Stage.REVIEW_GATE);
        assertThat(router.isExhausted(Stage.DRAFT, state)).isFalse();
    }

    @Test
    @DisplayName("Gates route to their fixed successors")
    void gateRoutes() {
        assertThat(router.route(Stage.TOPIC_GATE, state)).isEqualTo(Stage.SPEAKER_GATE);
        assertThat(router.route(Stage.SPEAKER_GATE, state)).isEqualTo(Stage.DRAFT);
        assertThat(router.route(Stage.AUDIO_CHOICE_GATE, state)).isEqualTo(Stage.MEDIA);
        assertThat(router.route(Stage.HOOK_GATE, state)).isEqualTo(Stage.ASSEMBLE);

        state.setHumanApproved(false);
        assertThat(router.route(Stage.REVIEW_GATE, state)).isEqualTo(Stage.DRAFT);
        state.setHumanApproved(true);
        assertThat(router.route(Stage.REVIEW_GATE, state)).isEqualTo(Stage.AUDIO_CHOICE_GATE);
    }

    @Test
    @DisplayName("Terminal stages stay put")
    void terminalStagesStay() {
        assertThat(router.route(Stage.COMPLETED, state)).isEqualTo(Stage.COMPLETED);
        assertThat(router.route(Stage.FAILED, state)).isEqualTo(Stage.FAILED);
    }

    @Test
    @DisplayName("Zero retries means a single attempt")
    void zeroRetries() {
        QualityGatedRouter strict = new QualityGatedRouter(0);
        assess(Stage.MEDIA, false, 1);

        assertThat(strict.route(Stage.MEDIA, state)).isEqualTo(Stage.FAILED);
    }

    @Test
    @DisplayName("Negative retry budgets are rejected")
    void negativeBudgetRejected() {
        assertThatThrownBy(() -> new QualityGatedRouter(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
