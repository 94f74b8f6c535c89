package gpufleet.orchestrator.store;

/**
 * The state store could not be reached or rejected a statement.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
