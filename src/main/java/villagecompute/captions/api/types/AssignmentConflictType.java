package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 409 body returned when a reservation batch lost to an existing or concurrent reservation.
 */
public record AssignmentConflictType(@JsonProperty("error") String error,
        @JsonProperty("conflicting_caption_ids") List<Long> conflictingCaptionIds) {

    public static final String ERROR_MESSAGE = "conflict: captions already reserved";

    public static AssignmentConflictType of(List<Long> conflictingCaptionIds) {
        return new AssignmentConflictType(ERROR_MESSAGE, conflictingCaptionIds);
    }
}
