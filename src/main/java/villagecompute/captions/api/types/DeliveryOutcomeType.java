package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * Delivery result of one sent caption.
 */
public record DeliveryOutcomeType(@NotNull @JsonProperty("caption_id") Long captionId,
        @NotBlank @JsonProperty("creator_id") String creatorId,
        @NotNull @Min(0) @JsonProperty("sent_count") Integer sentCount,
        @NotNull @Min(0) @JsonProperty("viewed_count") Integer viewedCount,
        @NotNull @Min(0) @JsonProperty("purchased_count") Integer purchasedCount,
        @NotNull @PositiveOrZero @JsonProperty("earnings") Double earnings,
        @NotNull @JsonProperty("sent_at") Instant sentAt) {
}
