package engine;

import java.time.Instant;
import java.util.Objects;

public class RunRecord {

    private final String runId;
    private final String ownerId;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String stage;
    private final String stateJson; // full pipeline state, opaque to the store

    public RunRecord(String runId,
                     String ownerId,
                     Instant createdAt,
                     Instant updatedAt,
                     String stage,
                     String stateJson) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.ownerId = ownerId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.stage = stage;
        this.stateJson = stateJson;
    }

    public RunRecord withState(String stage, String stateJson, Instant updatedAt) {
        return new RunRecord(runId, ownerId, createdAt, updatedAt, stage, stateJson);
    }

    public String getRunId() {
        return runId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getStage() {
        return stage;
    }

    public String getStateJson() {
        return stateJson;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RunRecord)) {
            return false;
        }
        RunRecord other = (RunRecord) o;
        return runId.equals(other.runId)
                && Objects.equals(ownerId, other.ownerId)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(updatedAt, other.updatedAt)
                && Objects.equals(stage, other.stage)
                && Objects.equals(stateJson, other.stateJson);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, ownerId, createdAt, updatedAt, stage, stateJson);
    }

    @Override
    public String toString() {
        return "RunRecord{runId=" + runId + ", stage=" + stage + ", updatedAt=" + updatedAt + "}";
    }
}
