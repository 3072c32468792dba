package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.Map;

/**
 * Request type for selecting captions for one creator.
 *
 * <p>
 * Used for POST /api/captions/selections. Example request:
 *
 * <pre>{@code
 * {
 *   "creator_id": "alice",
 *   "count_needed": 30,
 *   "lookback_days": 30,
 *   "behavioral_segment": "price_insensitive",
 *   "price_tier_quota_map": {"budget": 10, "standard": 15, "premium": 5},
 *   "target_date": "2026-11-02",
 *   "fail_on_shortfall": false
 * }
 * }</pre>
 *
 * @param creatorId
 *            creator the captions are chosen for
 * @param countNeeded
 *            number of captions to return
 * @param lookbackDays
 *            how far back the creator's diversity window reaches (defaults to 30)
 * @param behavioralSegment
 *            saturation segment label ({@code price_sensitive}, {@code price_insensitive} or any other value)
 * @param priceTierQuotaMap
 *            minimum captions per price tier, keyed by tier name
 * @param targetDate
 *            delivery date used for the cooldown check (defaults to tomorrow)
 * @param failOnShortfall
 *            when true, a request that cannot be fully satisfied fails instead of returning a partial result
 */
public record CaptionSelectionRequestType(@NotBlank @JsonProperty("creator_id") String creatorId,
        @NotNull @Min(1) @Max(500) @JsonProperty("count_needed") Integer countNeeded,
        @Min(1) @Max(365) @JsonProperty("lookback_days") Integer lookbackDays,
        @JsonProperty("behavioral_segment") String behavioralSegment,
        @JsonProperty("price_tier_quota_map") Map<String, Integer> priceTierQuotaMap,
        @JsonProperty("target_date") LocalDate targetDate,
        @JsonProperty("fail_on_shortfall") Boolean failOnShortfall) {

    public static final int DEFAULT_LOOKBACK_DAYS = 30;

    public int lookbackDaysOrDefault() {
        return lookbackDays != null ? lookbackDays : DEFAULT_LOOKBACK_DAYS;
    }

    public boolean failOnShortfallOrDefault() {
        return Boolean.TRUE.equals(failOnShortfall);
    }
}
