package villagecompute.captions.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the blended Thompson sampler, using a seeded random source so results are reproducible.
 */
public class ThompsonSamplingServiceTest {

    private static final int DRAWS = 1000;

    private WilsonScoreService wilsonScoreService;
    private ThompsonSamplingService samplingService;

    @BeforeEach
    public void setup() {
        wilsonScoreService = new WilsonScoreService();
        samplingService = new ThompsonSamplingService(new Random(42), wilsonScoreService);
    }

    /**
     * Every sample lies in [0, 1], including for empty and extreme arms.
     */
    @Test
    public void testSample_alwaysWithinUnitInterval() {
        double[][] arms = {{0, 0}, {1, 0}, {0, 100}, {100, 0}, {20, 10}, {-3, Double.NaN}};
        for (double[] arm : arms) {
            for (int i = 0; i < 200; i++) {
                double sample = samplingService.sample(arm[0], arm[1], 0.5);
                assertTrue(sample >= 0.0 && sample <= 1.0, "sample out of range for arm " + arm[0] + "/" + arm[1]);
            }
        }
    }

    /**
     * With 20 successes, 10 failures and the default exploration rate, every draw stays within 0.15 of the Wilson
     * lower bound.
     */
    @Test
    public void testSample_defaultRate_staysNearWilsonLower() {
        double lower = wilsonScoreService.calculateBounds(20, 10).lower();
        for (int i = 0; i < DRAWS; i++) {
            double sample = samplingService.sample(20, 10, 0.2);
            assertEquals(lower, sample, 0.15, "draw " + i + " strayed from the lower bound");
        }
    }

    /**
     * With full exploration the samples average to the Beta posterior mean α/(α+β).
     */
    @Test
    public void testSample_fullExploration_meanMatchesPosterior() {
        double sum = 0.0;
        for (int i = 0; i < DRAWS; i++) {
            sum += samplingService.sample(20, 10, 1.0);
        }
        assertEquals(21.0 / 32.0, sum / DRAWS, 0.02);
    }

    /**
     * With no exploration the sample is exactly the Wilson lower bound.
     */
    @Test
    public void testSample_zeroExploration_returnsWilsonLower() {
        double lower = wilsonScoreService.calculateBounds(40, 10).lower();
        assertEquals(lower, samplingService.sample(40, 10, 0.0), 1e-12);
    }

    /**
     * The same seed yields the same sequence.
     */
    @Test
    public void testSample_sameSeed_reproducible() {
        ThompsonSamplingService first = new ThompsonSamplingService(new Random(7), wilsonScoreService);
        ThompsonSamplingService second = new ThompsonSamplingService(new Random(7), wilsonScoreService);
        for (int i = 0; i < 10; i++) {
            assertEquals(first.sample(5, 5, 0.5), second.sample(5, 5, 0.5), 1e-15);
        }
    }
}
