package fun.fengwk.discovery.core.exception;

/**
 * Thrown when the external places provider fails, times out or answers with an unusable payload.
 * The search path recovers from it with local-only results.
 *
 * @author fengwk
 */
public class ExternalProviderDegradedException extends DiscoveryException {

    public ExternalProviderDegradedException(String message) {
        super(message, true);
    }

    public ExternalProviderDegradedException(String message, Throwable cause) {
        super(message, true, cause);
    }

}
