package engine;

import java.time.Instant;
import java.util.Objects;

public class SuspensionRecord {

    private final String runId;
    private final String stage;
    private final String payloadJson; // what the human must decide
    private final Instant suspendedAt;

    public SuspensionRecord(String runId,
                            String stage,
                            String payloadJson,
                            Instant suspendedAt) {
        this.runId = runId;
        this.stage = stage;
        this.payloadJson = payloadJson;
        this.suspendedAt = suspendedAt;
    }

    public String getRunId() {
        return runId;
    }

    public String getStage() {
        return stage;
    }

    public String getPayloadJson() {
        return payloadJson;
    }

    public Instant getSuspendedAt() {
        return suspendedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SuspensionRecord)) {
            return false;
        }
        SuspensionRecord other = (SuspensionRecord) o;
        return Objects.equals(runId, other.runId)
                && Objects.equals(stage, other.stage)
                && Objects.equals(payloadJson, other.payloadJson)
                && Objects.equals(suspendedAt, other.suspendedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, stage, payloadJson, suspendedAt);
    }
}
