package villagecompute.captions.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the decay and median arithmetic of the feedback update.
 */
public class FeedbackUpdateServiceTest {

    private FeedbackUpdateService feedbackUpdateService;

    @BeforeEach
    public void setup() {
        feedbackUpdateService = new FeedbackUpdateService();
    }

    /**
     * 14 days at 4 updates a day is one half-life: the weight halves.
     */
    @Test
    public void testApplyDecay_fiftySixUpdates_halvesWeight() {
        double decay = feedbackUpdateService.decayFactor(14, 4);
        double count = 80.0;
        for (int i = 0; i < 56; i++) {
            count = feedbackUpdateService.applyDecay(count, decay, 0.0, 100.0);
        }
        assertEquals(40.0, count, 0.01);
    }

    /**
     * New observations are added after decay and the result is capped.
     */
    @Test
    public void testApplyDecay_capsAndFloors() {
        assertEquals(100.0, feedbackUpdateService.applyDecay(99.0, 0.99, 5.0, 100.0), 1e-9);
        assertEquals(0.0, feedbackUpdateService.applyDecay(-4.0, 0.99, 0.0, 100.0), 1e-9);
        assertEquals(10.0 * 0.5 + 2.0, feedbackUpdateService.applyDecay(10.0, 0.5, 2.0, 100.0), 1e-9);
    }

    /**
     * Repeated decay approaches zero without going below it.
     */
    @Test
    public void testApplyDecay_longIdle_approachesZero() {
        double decay = feedbackUpdateService.decayFactor(14, 4);
        double count = 3.0;
        for (int i = 0; i < 5000; i++) {
            count = feedbackUpdateService.applyDecay(count, decay, 0.0, 100.0);
        }
        assertTrue(count >= 0.0);
        assertTrue(count < 0.01);
    }

    @Test
    public void testMedian_oddEvenAndEmpty() {
        assertEquals(3.0, feedbackUpdateService.median(List.of(5.0, 1.0, 3.0)), 1e-9);
        assertEquals(2.5, feedbackUpdateService.median(List.of(4.0, 1.0, 2.0, 3.0)), 1e-9);
        assertEquals(0.0, feedbackUpdateService.median(List.of()), 1e-9);
    }
}
