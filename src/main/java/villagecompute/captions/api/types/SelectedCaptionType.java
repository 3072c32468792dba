package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One caption chosen by the selection engine, in selection order.
 *
 * @param captionId
 *            caption primary key
 * @param captionText
 *            caption text
 * @param priceTier
 *            tier name (lower case)
 * @param triggerTag
 *            trigger tag, null when untagged
 * @param category
 *            content category
 * @param compositeScore
 *            final ranking score
 * @param selectionStrategy
 *            {@code explore}, {@code exploit} or {@code balanced}
 * @param wilsonBounds
 *            confidence interval of the caption's success rate for this creator
 * @param diversityViolation
 *            true when no alternative could satisfy the hard diversity rules at this position
 */
public record SelectedCaptionType(@JsonProperty("caption_id") Long captionId,
        @JsonProperty("caption_text") String captionText, @JsonProperty("price_tier") String priceTier,
        @JsonProperty("trigger_tag") String triggerTag, @JsonProperty("category") String category,
        @JsonProperty("composite_score") double compositeScore,
        @JsonProperty("selection_strategy") String selectionStrategy,
        @JsonProperty("wilson_bounds") WilsonBoundsType wilsonBounds,
        @JsonProperty("diversity_violation") boolean diversityViolation) {
}
