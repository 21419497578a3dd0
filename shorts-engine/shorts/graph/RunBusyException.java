package shorts.graph;

/**
 * Thrown when a dispatch cycle is requested for a run that already has one in
 * flight in this process.
 */
public class RunBusyException extends RuntimeException {

    private final String runId;

    public RunBusyException(String runId) {
        super("Run " + runId + " is already being advanced");
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
