/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.captions.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.OptionalInt;

import org.junit.jupiter.api.Test;

import villagecompute.captions.config.BanditConfig.BanditConfigurationException;
import villagecompute.captions.data.models.PriceTier;

/**
 * Unit tests for {@link BanditConfig} validation and table parsing.
 *
 * <p>
 * Lightweight tests that set the injected fields directly instead of starting Quarkus.
 */
class BanditConfigTest {

    private static BanditConfig defaults() {
        BanditConfig config = new BanditConfig();
        config.cooldownDays = 7;
        config.explorationRate = 0.2;
        config.confidenceLevel = 0.95;
        config.coldStartConversion = 0.05;
        config.weeklyCapsSetting = "scarcity=3,urgency=5";
        config.priceBaseSetting = "budget=5,premium=25";
        config.expiryDays = 7;
        config.halfLifeDays = 14;
        config.updatesPerDay = 4;
        config.countCap = 100;
        config.medianWindowDays = 30;
        config.maxLookbackHours = 48;
        config.maxBatchSize = 10000;
        return config;
    }

    /**
     * Verifies that the default settings validate and the tables are parsed.
     */
    @Test
    void testValidationSucceedsWithDefaults() {
        BanditConfig config = defaults();

        assertDoesNotThrow(config::validateConfiguration, "Validation should succeed with default settings");
        assertEquals(OptionalInt.of(3), config.weeklyCapFor("Scarcity"));
        assertEquals(OptionalInt.empty(), config.weeklyCapFor("curiosity"));
        assertEquals(25.0, config.priceBaseFor(PriceTier.PREMIUM), 1e-9);
        assertEquals(0.0, config.priceBaseFor(PriceTier.VIP), 1e-9);
    }

    /**
     * Verifies that an exploration rate outside [0, 1] fails startup.
     */
    @Test
    void testValidationFailsWithExplorationRateAboveOne() {
        BanditConfig config = defaults();
        config.explorationRate = 1.5;

        assertThrows(BanditConfigurationException.class, config::validateConfiguration,
                "Validation should fail when the exploration rate exceeds 1");
    }

    /**
     * Verifies that a non-positive half-life fails startup.
     */
    @Test
    void testValidationFailsWithZeroHalfLife() {
        BanditConfig config = defaults();
        config.halfLifeDays = 0;

        assertThrows(BanditConfigurationException.class, config::validateConfiguration,
                "Validation should fail when the half-life is zero");
    }

    /**
     * Verifies that a negative cooldown fails startup.
     */
    @Test
    void testValidationFailsWithNegativeCooldown() {
        BanditConfig config = defaults();
        config.cooldownDays = -1;

        assertThrows(BanditConfigurationException.class, config::validateConfiguration,
                "Validation should fail when the cooldown is negative");
    }

    /**
     * Verifies that cap entries are trimmed and lower-cased, and blank items are skipped.
     */
    @Test
    void testParseWeeklyCapsNormalisesKeys() {
        Map<String, Integer> caps = BanditConfig.parseWeeklyCaps(" Scarcity = 3 ,, FOMO=4 ");

        assertEquals(Map.of("scarcity", 3, "fomo", 4), caps);
        assertTrue(BanditConfig.parseWeeklyCaps("").isEmpty());
    }

    /**
     * Verifies that malformed cap entries are rejected.
     */
    @Test
    void testParseWeeklyCapsRejectsMalformedEntries() {
        assertThrows(BanditConfigurationException.class, () -> BanditConfig.parseWeeklyCaps("scarcity"));
        assertThrows(BanditConfigurationException.class, () -> BanditConfig.parseWeeklyCaps("scarcity=lots"));
        assertThrows(BanditConfigurationException.class, () -> BanditConfig.parseWeeklyCaps("scarcity=-1"));
    }

    /**
     * Verifies that the price table rejects tiers the engine does not know.
     */
    @Test
    void testParsePriceBaseRejectsUnknownTier() {
        assertThrows(BanditConfigurationException.class, () -> BanditConfig.parsePriceBase("platinum=99"));
        assertEquals(Map.of(PriceTier.MID, 15.0), BanditConfig.parsePriceBase("mid=15"));
    }
}
