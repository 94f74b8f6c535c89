package gpufleet.orchestrator.provider;

/**
 * A call to the compute provider or to a worker failed or timed out.
 * Always a soft, per-call failure for the control loop.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
