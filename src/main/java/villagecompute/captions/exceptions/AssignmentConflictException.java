package villagecompute.captions.exceptions;

import java.util.List;

/**
 * Exception thrown when a reservation batch could not be applied because at least one caption is already held within
 * its cooldown window. No part of the batch remains reserved when this is thrown.
 *
 * <p>
 * Mapped to HTTP 409 Conflict. Callers should select a fresh candidate list and retry.
 */
public class AssignmentConflictException extends RuntimeException {

    private final List<Long> conflictingCaptionIds;

    public AssignmentConflictException(String message, List<Long> conflictingCaptionIds) {
        super(message);
        this.conflictingCaptionIds = List.copyOf(conflictingCaptionIds);
    }

    public AssignmentConflictException(String message, List<Long> conflictingCaptionIds, Throwable cause) {
        super(message, cause);
        this.conflictingCaptionIds = List.copyOf(conflictingCaptionIds);
    }

    public List<Long> getConflictingCaptionIds() {
        return conflictingCaptionIds;
    }
}
