package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Size of the candidate pool after each filter stage of a selection request.
 *
 * @param tierShortfalls
 *            per tier, how many captions the quota asked for beyond what the eligible pool held
 */
public record PoolHealthType(@JsonProperty("total_available") int totalAvailable,
        @JsonProperty("after_cooldown_filter") int afterCooldownFilter,
        @JsonProperty("after_restriction_filter") int afterRestrictionFilter,
        @JsonProperty("after_budget_filter") int afterBudgetFilter, @JsonProperty("final_selected") int finalSelected,
        @JsonProperty("tier_shortfalls") Map<String, Integer> tierShortfalls) {
}
