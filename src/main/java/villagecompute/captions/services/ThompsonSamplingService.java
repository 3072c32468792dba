package villagecompute.captions.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Draws Thompson samples for caption arms using a normal approximation of the Beta posterior.
 *
 * <p>
 * <b>Algorithm:</b>
 * <ul>
 * <li>Posterior Beta(α, β) with α = successes + 1, β = failures + 1 (uniform prior)</li>
 * <li>mean = α/(α+β), variance = αβ/((α+β)²(α+β+1))</li>
 * <li>Standard normal z from Box-Muller over two uniforms; u1 is drawn from (0, 1] so ln(u1) stays finite</li>
 * <li>sample = clamp(mean + √variance × z)</li>
 * <li>result = clamp(sample × rate + wilsonLower95 × (1 − rate))</li>
 * </ul>
 *
 * <p>
 * The exploration rate blends the random draw with the conservative Wilson lower bound: rate 1.0 is pure Thompson
 * Sampling, rate 0.0 is a deterministic ranking by lower bound.
 *
 * <p>
 * The random source defaults to {@link ThreadLocalRandom} so concurrent selection requests never contend on a shared
 * generator. Tests pass a seeded generator through {@link #ThompsonSamplingService(RandomGenerator, WilsonScoreService)}.
 */
@ApplicationScoped
public class ThompsonSamplingService {

    private static final Logger LOG = Logger.getLogger(ThompsonSamplingService.class);

    private final RandomGenerator random;

    @Inject
    WilsonScoreService wilsonScoreService;

    public ThompsonSamplingService() {
        this.random = null;
    }

    public ThompsonSamplingService(RandomGenerator random, WilsonScoreService wilsonScoreService) {
        this.random = random;
        this.wilsonScoreService = wilsonScoreService;
    }

    /**
     * Draws one blended sample for an arm.
     *
     * @param successes
     *            decayed success count (negative or NaN treated as 0)
     * @param failures
     *            decayed failure count (negative or NaN treated as 0)
     * @param explorationRate
     *            weight of the random draw, clamped to [0, 1]
     * @return score in [0, 1]
     */
    public double sample(double successes, double failures, double explorationRate) {
        double s = nonNegative(successes);
        double f = nonNegative(failures);
        double rate = clamp(explorationRate);

        double alpha = s + 1.0;
        double beta = f + 1.0;
        double sum = alpha + beta;
        double mean = alpha / sum;
        double variance = (alpha * beta) / (sum * sum * (sum + 1.0));

        double draw = clamp(mean + Math.sqrt(variance) * standardNormal());
        double wilsonLower = wilsonScoreService.calculateBounds(s, f, 0.95).lower();

        double result = clamp(draw * rate + wilsonLower * (1.0 - rate));
        LOG.tracef("Thompson sample: s=%.3f, f=%.3f, rate=%.2f, draw=%.4f, result=%.4f", s, f, rate, draw, result);
        return result;
    }

    double standardNormal() {
        RandomGenerator generator = random != null ? random : ThreadLocalRandom.current();
        double u1 = 1.0 - generator.nextDouble();
        double u2 = generator.nextDouble();
        return Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
    }

    private static double nonNegative(double value) {
        return Double.isNaN(value) || value < 0 ? 0.0 : value;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
