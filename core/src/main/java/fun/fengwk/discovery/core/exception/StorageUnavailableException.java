package fun.fengwk.discovery.core.exception;

/**
 * Thrown when the relational store (catalog or search history) cannot be read or written.
 *
 * @author fengwk
 */
public class StorageUnavailableException extends DiscoveryException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, true, cause);
    }

}
