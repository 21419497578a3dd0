package shorts.graph;

public enum RunStatus {
    RUNNING,
    WAITING,
    COMPLETED,
    FAILED
}
