package engine;

/**
 * Raised when the checkpoint backend cannot be reached or a statement fails.
 * Always transient from the workflow's point of view: callers retry later,
 * the run itself is not failed.
 */
public class CheckpointStoreException extends RuntimeException {

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
