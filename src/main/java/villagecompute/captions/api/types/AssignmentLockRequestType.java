package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request type for POST /api/captions/assignments. All tuples are reserved together or none are.
 *
 * <pre>{@code
 * {
 *   "schedule_id": "sched-2026-w45",
 *   "creator_id": "alice",
 *   "assignments": [{"caption_id": 42, "date": "2026-11-02", "hour": 19}]
 * }
 * }</pre>
 */
public record AssignmentLockRequestType(@NotBlank @JsonProperty("schedule_id") String scheduleId,
        @NotBlank @JsonProperty("creator_id") String creatorId,
        @NotEmpty @Valid @JsonProperty("assignments") List<AssignmentItemType> assignments) {
}
