package shorts.generator;

/**
 * Failure of an external generator (model call, synthesis, media tool). Stages
 * turn it into a failing assessment; it never escapes a stage boundary.
 */
public class GeneratorException extends RuntimeException {

    public GeneratorException(String message) {
        super(message);
    }

    public GeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
