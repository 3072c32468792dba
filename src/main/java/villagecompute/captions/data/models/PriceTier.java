package villagecompute.captions.data.models;

import java.util.Locale;
import java.util.Optional;

/**
 * Price tier of a caption's promoted offer, cheapest first.
 *
 * <p>
 * Entities persist the constant name ({@code PREMIUM}). The lower-case {@link #getValue() value} is the wire form:
 * API payloads, quota maps and raw restriction data refer to tiers by it.
 */
public enum PriceTier {

    BUDGET("budget"),
    STANDARD("standard"),
    MID("mid"),
    PREMIUM("premium"),
    LUXURY("luxury"),
    VIP("vip");

    private final String value;

    PriceTier(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a tier from free-form text (case-insensitive, surrounding whitespace ignored).
     *
     * @param raw
     *            tier name such as {@code "premium"} or {@code "PREMIUM"}
     * @return the tier, or empty when the text names no tier
     */
    public static Optional<PriceTier> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (PriceTier tier : values()) {
            if (tier.value.equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /** Price-insensitive segments favour these tiers. */
    public boolean isHighEnd() {
        return this == PREMIUM || this == LUXURY;
    }

    /** Price-sensitive segments favour these tiers. */
    public boolean isLowEnd() {
        return this == BUDGET || this == STANDARD;
    }
}
