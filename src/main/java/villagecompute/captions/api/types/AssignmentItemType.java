package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * One (caption, date, hour) tuple to reserve.
 */
public record AssignmentItemType(@NotNull @JsonProperty("caption_id") Long captionId,
        @NotNull @JsonProperty("date") LocalDate date, @NotNull @Min(0) @Max(23) @JsonProperty("hour") Integer hour) {
}
