package shorts.gate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.graph.StateUpdate;
import shorts.model.PipelineState;
import shorts.model.TopicSummary;
import shorts.model.TrendData;

/**
 * Presents the researched topics; the chosen one drives scriptwriting.
 */
public class TopicSelectionGate extends HumanGate {

    private static final Logger log = LoggerFactory.getLogger(TopicSelectionGate.class);

    public TopicSelectionGate() {
        super(GateType.TOPIC_SELECTION);
    }

    @Override
    protected Map<String, Object> publish(PipelineState state) {
        TrendData trends = state.getTrendData() == null ? TrendData.empty() : state.getTrendData();
        List<TopicSummary> topics = trends.getTopicSummaries();
        log.info("Run {} waiting for topic selection ({} topics)", state.getRunId(), topics.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("topics", topics);
        payload.put("recommended_topic", trends.getSelectedTopic());
        payload.put("message", "Review the trend results and pick one topic.");
        return payload;
    }

    @Override
    public GateDecision decide(PipelineState state, Map<String, Object> payload) {
        String topic = requireString(state, payload, "selected_topic");
        log.info("Run {} topic selected: {}", state.getRunId(), topic);

        StateUpdate update = StateUpdate.of(s -> {
            if (s.getTrendData() == null) {
                s.setTrendData(TrendData.empty());
            }
            s.getTrendData().setSelectedTopic(topic);
            s.setTopicSelected(topic);
            s.setTopicSelectionApproved(true);
        });
        return new GateDecision(type(), update, "topic=" + topic);
    }
}
