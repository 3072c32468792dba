package villagecompute.captions.exceptions;

import villagecompute.captions.api.types.CaptionSelectionResultType;

/**
 * Exception thrown when a selection request with {@code fail_on_shortfall} cannot fill its count or tier quotas.
 *
 * <p>
 * Carries the partial selection and pool health so callers can inspect what was available. Mapped to HTTP 422.
 */
public class PoolExhaustionException extends RuntimeException {

    private final CaptionSelectionResultType partialResult;

    public PoolExhaustionException(String message, CaptionSelectionResultType partialResult) {
        super(message);
        this.partialResult = partialResult;
    }

    public CaptionSelectionResultType getPartialResult() {
        return partialResult;
    }
}
