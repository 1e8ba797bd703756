package taskline.coordinator.error;

/**
 * Base type for errors raised by the queue engine.
 */
public class TasklineException extends RuntimeException {

    public TasklineException(String message) {
        super(message);
    }

    public TasklineException(String message, Throwable cause) {
        super(message, cause);
    }
}
