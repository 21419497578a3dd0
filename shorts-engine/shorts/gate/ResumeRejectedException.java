package shorts.gate;

/**
 * A resume request that cannot be applied: the run is not waiting on that gate,
 * or the decision payload is invalid. State is never touched when this is thrown.
 */
public class ResumeRejectedException extends RuntimeException {

    private final String runId;

    public ResumeRejectedException(String runId, String reason) {
        super("Resume rejected for run " + runId + ": " + reason);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
