package taskline.coordinator.error;

/**
 * The broker could not accept a new task. The task was not created.
 */
public class SubmissionException extends TasklineException {

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
