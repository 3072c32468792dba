package villagecompute.captions.services;

import villagecompute.captions.data.models.PriceTier;

/**
 * The attributes of one past or pending assignment that diversity rules look at.
 *
 * @param captionId
 *            caption assigned
 * @param priceTier
 *            tier of the caption
 * @param triggerTag
 *            trigger tag, null when untagged
 * @param category
 *            content category
 */
public record PatternEntry(Long captionId, PriceTier priceTier, String triggerTag, String category) {
}
