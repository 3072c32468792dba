package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Response type for a successful reservation batch.
 */
public record AssignmentLockResultType(@JsonProperty("schedule_id") String scheduleId,
        @JsonProperty("assignment_ids") List<UUID> assignmentIds, @JsonProperty("locked_count") int lockedCount) {
}
