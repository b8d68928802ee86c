package fun.fengwk.discovery.core.exception;

/**
 * Thrown when a request is malformed. Never retried.
 *
 * @author fengwk
 */
public class SearchValidationException extends DiscoveryException {

    public SearchValidationException(String message) {
        super(message, false);
    }

}
