package villagecompute.captions.services;

import villagecompute.captions.data.models.PriceTier;

import java.util.Comparator;

/**
 * An eligible caption with every score the ranker needs.
 *
 * @param captionId
 *            caption primary key
 * @param text
 *            caption text
 * @param priceTier
 *            price tier
 * @param triggerTag
 *            trigger tag, or null
 * @param category
 *            content category
 * @param thompsonScore
 *            blended Thompson sample in [0, 1]
 * @param diversityScore
 *            soft diversity score
 * @param avgEmv
 *            expected monetary value (observed, or cold-start estimate)
 * @param totalObservations
 *            deliveries folded into this arm's stats
 * @param bounds
 *            Wilson interval of the arm
 * @param compositeScore
 *            final ranking score
 * @param strategy
 *            {@code explore}, {@code exploit} or {@code balanced}
 */
public record ScoredCandidate(Long captionId, String text, PriceTier priceTier, String triggerTag, String category,
        double thompsonScore, double diversityScore, double avgEmv, long totalObservations, WilsonBounds bounds,
        double compositeScore, String strategy) {

    /**
     * Ranking order: composite descending, then fewer observations (more to learn), then lower caption id.
     */
    public static final Comparator<ScoredCandidate> BY_RANK = Comparator
            .comparingDouble(ScoredCandidate::compositeScore).reversed()
            .thenComparingLong(ScoredCandidate::totalObservations).thenComparing(ScoredCandidate::captionId);

    public PatternEntry toPatternEntry() {
        return new PatternEntry(captionId, priceTier, triggerTag, category);
    }
}
