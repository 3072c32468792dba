package villagecompute.captions.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Service for calculating Wilson score confidence intervals of caption success rates.
 *
 * <p>
 * The interval bounds the true probability that a delivery of a caption beats the creator's median EMV, accounting for
 * how few observations an arm may have. The lower bound doubles as a conservative point estimate in
 * {@link ThompsonSamplingService}; the width drives the explore/exploit labelling of selections.
 *
 * <p>
 * <b>Algorithm:</b> Wilson score interval
 * <ul>
 * <li>Formula: (p̂ + z²/2n ± z × √(p̂(1-p̂)/n + z²/4n²)) / (1 + z²/n)</li>
 * <li>Where: n = successes + failures, p̂ = successes/n</li>
 * <li>z = 1.645 (90%), 1.96 (95%), 2.576 (99%); any other confidence level uses 1.96</li>
 * </ul>
 *
 * <p>
 * <b>Edge Cases:</b>
 * <ul>
 * <li>n = 0 → (0, 1, 1.0)</li>
 * <li>0 &lt; n ≤ 1 → (0, 1, 0.7); decayed counts may fall below one observation</li>
 * <li>negative or NaN counts are treated as 0</li>
 * </ul>
 *
 * <p>
 * Counts are real-valued because the feedback job decays them. The method never throws: statistical edge cases are
 * answered with the widest interval instead.
 *
 * @see <a href="https://en.wikipedia.org/wiki/Binomial_proportion_confidence_interval#Wilson_score_interval">Wilson
 *      Score Interval</a>
 */
@ApplicationScoped
public class WilsonScoreService {

    private static final Logger LOG = Logger.getLogger(WilsonScoreService.class);

    public static final double Z_SCORE_90_PERCENT = 1.645;

    public static final double Z_SCORE_95_PERCENT = 1.96;

    public static final double Z_SCORE_99_PERCENT = 2.576;

    private static final double CONFIDENCE_EPSILON = 1e-9;

    /**
     * Calculates the Wilson interval at 95% confidence.
     */
    public WilsonBounds calculateBounds(double successes, double failures) {
        return calculateBounds(successes, failures, 0.95);
    }

    /**
     * Calculates the Wilson interval and exploration bonus of an arm.
     *
     * @param successes
     *            decayed success count
     * @param failures
     *            decayed failure count
     * @param confidence
     *            confidence level (0.90, 0.95 or 0.99)
     * @return bounds clamped to [0, 1] with lower ≤ upper
     */
    public WilsonBounds calculateBounds(double successes, double failures, double confidence) {
        double s = sanitize(successes);
        double f = sanitize(failures);
        double n = s + f;

        if (n == 0.0) {
            return WilsonBounds.NO_DATA;
        }
        if (n <= 1.0) {
            return WilsonBounds.SINGLE_OBSERVATION;
        }

        double z = zScoreFor(confidence);
        double p = s / n;
        double zSquared = z * z;

        double center = p + zSquared / (2 * n);
        double margin = z * Math.sqrt((p * (1 - p) + zSquared / (4 * n)) / n);
        double denominator = 1 + zSquared / n;

        double lower = clamp((center - margin) / denominator);
        double upper = clamp((center + margin) / denominator);
        if (lower > upper) {
            lower = upper;
        }
        double explorationBonus = 1.0 / Math.sqrt(n + 1);

        LOG.tracef("Wilson bounds calculated: s=%.4f, f=%.4f, z=%.3f, lower=%.6f, upper=%.6f", s, f, z, lower, upper);

        return new WilsonBounds(lower, upper, explorationBonus);
    }

    /**
     * Maps a confidence level to its two-tailed z-score. Unrecognised levels fall back to 95%.
     */
    public double zScoreFor(double confidence) {
        if (Math.abs(confidence - 0.90) < CONFIDENCE_EPSILON) {
            return Z_SCORE_90_PERCENT;
        }
        if (Math.abs(confidence - 0.99) < CONFIDENCE_EPSILON) {
            return Z_SCORE_99_PERCENT;
        }
        return Z_SCORE_95_PERCENT;
    }

    private static double sanitize(double count) {
        if (Double.isNaN(count) || count < 0) {
            return 0.0;
        }
        if (Double.isInfinite(count)) {
            return Double.MAX_VALUE / 4;
        }
        return count;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
