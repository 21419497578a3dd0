package shorts.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorts.graph.NodeResult;
import shorts.model.PipelineState;
import shorts.model.TopicSummary;
import shorts.model.TrendData;

@DisplayName("TopicSelectionGate Tests")
class TopicSelectionGateTest {

    private final TopicSelectionGate gate = new TopicSelectionGate();
    private PipelineState state;

    @BeforeEach
    void setUp() {
        state = PipelineState.initial("run-1", "owner-1", Map.of());
        TrendData trends = TrendData.empty();
        trends.setSelectedTopic("Four-day work week");
        trends.setTopicSummaries(List.of(new TopicSummary("Four-day work week", "Pilot results are out.", "news", 0.9)));
        state.setTrendData(trends);
    }

    @Test
    @DisplayName("Publishes the topics and the recommendation under the gate tag")
    void publishesTopics() {
        NodeResult result = gate.run(state);

        assertThat(result.isSuspended()).isTrue();
        assertThat(result.getSuspensionPayload())
                .containsEntry("type", "topic_selection")
                .containsEntry("recommended_topic", "Four-day work week")
                .containsKeys("topics", "message");
    }

    @Test
    @DisplayName("The selected topic is written to the trend data and the state")
    void appliesSelection() {
        GateDecision decision = gate.decide(state, Map.of("selected_topic", "  Heatwave records "));
        decision.getUpdate().applyTo(state);

        assertThat(decision.getType()).isEqualTo(GateType.TOPIC_SELECTION);
        assertThat(state.getTopicSelected()).isEqualTo("Heatwave records");
        assertThat(state.getTrendData().getSelectedTopic()).isEqualTo("Heatwave records");
        assertThat(state.getTopicSelectionApproved()).isTrue();
    }

    @Test
    @DisplayName("A missing topic is rejected without touching the state")
    void rejectsMissingTopic() {
        assertThatThrownBy(() -> gate.decide(state, Map.of("selected_topic", " ")))
                .isInstanceOf(ResumeRejectedException.class)
                .hasMessageContaining("run-1")
                .hasMessageContaining("selected_topic");
        assertThat(state.getTopicSelected()).isNull();
    }
}
