package taskline.coordinator.error;

/**
 * The shared status/ledger store could not be reached or rejected a statement.
 */
public class StoreUnavailableException extends TasklineException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
