package villagecompute.captions.exceptions;

/**
 * Exception thrown when a request is malformed (e.g., missing ids, out-of-range hour, quotas exceeding the count).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
