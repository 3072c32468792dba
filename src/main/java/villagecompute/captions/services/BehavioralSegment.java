package villagecompute.captions.services;

import villagecompute.captions.data.models.PriceTier;

import java.util.Locale;

/**
 * Price sensitivity of a creator's audience, as reported by the saturation analytics.
 */
public enum BehavioralSegment {

    PRICE_SENSITIVE,

    PRICE_INSENSITIVE,

    NEUTRAL;

    static final double HIGH_END_BOOST = 1.3;
    static final double LOW_END_BOOST = 1.2;

    /**
     * Resolves a segment label. Unknown or missing labels are neutral.
     *
     * @param raw
     *            label such as {@code price_insensitive} or {@code Price-Sensitive}
     */
    public static BehavioralSegment fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEUTRAL;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (BehavioralSegment segment : values()) {
            if (segment.name().equals(normalized)) {
                return segment;
            }
        }
        return NEUTRAL;
    }

    /**
     * Score multiplier this segment applies to a tier.
     */
    public double multiplierFor(PriceTier tier) {
        if (this == PRICE_INSENSITIVE && tier.isHighEnd()) {
            return HIGH_END_BOOST;
        }
        if (this == PRICE_SENSITIVE && tier.isLowEnd()) {
            return LOW_END_BOOST;
        }
        return 1.0;
    }
}
