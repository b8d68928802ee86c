package fun.fengwk.discovery.core.exception;

/**
 * Thrown when the cache store cannot be reached.
 *
 * @author fengwk
 */
public class CacheUnavailableException extends DiscoveryException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, true, cause);
    }

}
