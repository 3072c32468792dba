package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of one feedback run.
 *
 * @param outcomesProcessed
 *            delivery outcomes folded into the ledger
 * @param statsUpdated
 *            (caption, creator) rows that received new observations
 * @param statsDecayed
 *            rows of touched creators that were only decayed
 * @param creatorsTouched
 *            distinct creators in the batch
 */
public record FeedbackRunResultType(@JsonProperty("outcomes_processed") int outcomesProcessed,
        @JsonProperty("stats_updated") int statsUpdated, @JsonProperty("stats_decayed") int statsDecayed,
        @JsonProperty("creators_touched") int creatorsTouched) {

    public static FeedbackRunResultType empty() {
        return new FeedbackRunResultType(0, 0, 0, 0);
    }
}
