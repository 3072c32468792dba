package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.captions.services.WilsonBounds;

/**
 * Wilson score interval reported alongside each selected caption.
 */
public record WilsonBoundsType(@JsonProperty("lower") double lower, @JsonProperty("upper") double upper,
        @JsonProperty("exploration_bonus") double explorationBonus) {

    public static WilsonBoundsType fromBounds(WilsonBounds bounds) {
        return new WilsonBoundsType(bounds.lower(), bounds.upper(), bounds.explorationBonus());
    }
}
