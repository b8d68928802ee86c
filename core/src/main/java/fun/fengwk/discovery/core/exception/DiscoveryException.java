package fun.fengwk.discovery.core.exception;

/**
 * Base type for typed failures raised by the discovery engine.
 *
 * <p>The retryable flag tells callers whether repeating the same request may succeed.</p>
 *
 * @author fengwk
 */
public class DiscoveryException extends RuntimeException {

    private final boolean retryable;

    public DiscoveryException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public DiscoveryException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

}
