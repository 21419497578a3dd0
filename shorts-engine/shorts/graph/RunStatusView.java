package shorts.graph;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

import shorts.gate.GateType;
import shorts.model.QualityAssessment;

/**
 * What a client can observe about a run. Built only from persisted records, so
 * it is the same whichever process answers.
 */
public class RunStatusView {

    private final String runId;
    private final String ownerId;
    private final RunStatus status;
    private final Stage stage;
    private final GateType waitingOn;
    private final Map<String, Object> payload;
    private final Map<String, Integer> retryCounts;
    private final QualityAssessment quality;
    private final String error;
    private final Instant updatedAt;

    public RunStatusView(String runId,
                         String ownerId,
                         RunStatus status,
                         Stage stage,
                         GateType waitingOn,
                         Map<String, Object> payload,
                         Map<String, Integer> retryCounts,
                         QualityAssessment quality,
                         String error,
                         Instant updatedAt) {
        this.runId = runId;
        this.ownerId = ownerId;
        this.status = status;
        this.stage = stage;
        this.waitingOn = waitingOn;
        this.payload = payload == null ? Collections.emptyMap() : Collections.unmodifiableMap(payload);
        this.retryCounts = Collections.unmodifiableMap(retryCounts);
        this.quality = quality;
        this.error = error;
        this.updatedAt = updatedAt;
    }

    public String getRunId() {
        return runId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * The gate the run is suspended on; {@code null} unless {@link RunStatus#WAITING}.
     */
    public GateType getWaitingOn() {
        return waitingOn;
    }

    /**
     * The exact payload published by the gate; empty unless waiting.
     */
    public Map<String, Object> getPayload() {
        return payload;
    }

    public Map<String, Integer> getRetryCounts() {
        return retryCounts;
    }

    public QualityAssessment getQuality() {
        return quality;
    }

    public String getError() {
        return error;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "RunStatusView{" +
                "runId='" + runId + '\'' +
                ", status=" + status +
                ", stage=" + stage.key() +
                (waitingOn != null ? ", waitingOn=" + waitingOn.tag() : "") +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
