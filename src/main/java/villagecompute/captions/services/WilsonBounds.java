package villagecompute.captions.services;

/**
 * Wilson score interval of an arm's success rate plus its exploration bonus.
 *
 * @param lower
 *            lower bound, in [0, 1]
 * @param upper
 *            upper bound, in [lower, 1]
 * @param explorationBonus
 *            {@code 1 / sqrt(n + 1)}, shrinking as observations accumulate
 */
public record WilsonBounds(double lower, double upper, double explorationBonus) {

    /** Bounds of an arm with no observations. */
    public static final WilsonBounds NO_DATA = new WilsonBounds(0.0, 1.0, 1.0);

    /** Bounds of an arm with a single observation. */
    public static final WilsonBounds SINGLE_OBSERVATION = new WilsonBounds(0.0, 1.0, 0.7);

    public double width() {
        return upper - lower;
    }
}
