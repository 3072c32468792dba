package villagecompute.captions.exceptions;

/**
 * Exception thrown when a referenced caption or schedule does not exist.
 *
 * <p>
 * Extends RuntimeException per project standards. The reservation path maps it to HTTP 400 because the caller sent an
 * id that was never valid; lookups by path parameter map it to HTTP 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
