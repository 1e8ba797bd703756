package taskline.coordinator.error;

/**
 * The task broker could not be reached.
 */
public class BrokerUnavailableException extends TasklineException {

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
