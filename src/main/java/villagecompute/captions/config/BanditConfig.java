/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.captions.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.captions.data.models.PriceTier;

/**
 * Tunables of the caption selection bandit.
 *
 * <p>
 * Scalar settings are injected directly. The trigger cap table ({@code bandit.trigger.weekly-caps}) and the price base
 * table ({@code bandit.price-base}) are written as {@code key=value} lists and parsed once at startup:
 *
 * <pre>
 * bandit.trigger.weekly-caps=scarcity=3,urgency=5,fomo=4
 * bandit.price-base=budget=5,standard=10,premium=25
 * </pre>
 *
 * <p>
 * The bean is {@link Startup} so a malformed table or an out-of-range value stops the application before it serves a
 * single request.
 */
@ApplicationScoped
@Startup
public class BanditConfig {

    private static final Logger LOG = Logger.getLogger(BanditConfig.class);

    @ConfigProperty(
            name = "bandit.cooldown-days",
            defaultValue = "7")
    int cooldownDays;

    @ConfigProperty(
            name = "bandit.exploration-rate",
            defaultValue = "0.2")
    double explorationRate;

    @ConfigProperty(
            name = "bandit.confidence-level",
            defaultValue = "0.95")
    double confidenceLevel;

    @ConfigProperty(
            name = "bandit.cold-start-conversion",
            defaultValue = "0.05")
    double coldStartConversion;

    @ConfigProperty(
            name = "bandit.trigger.weekly-caps",
            defaultValue = "scarcity=3,urgency=5,fomo=4,exclusivity=4,social_proof=6,curiosity=7,flash_sale=2")
    String weeklyCapsSetting;

    @ConfigProperty(
            name = "bandit.price-base",
            defaultValue = "budget=5,standard=10,mid=15,premium=25,luxury=40,vip=75")
    String priceBaseSetting;

    @ConfigProperty(
            name = "bandit.restrictions.enabled",
            defaultValue = "true")
    boolean restrictionsEnabled;

    @ConfigProperty(
            name = "bandit.assignment.expiry-days",
            defaultValue = "7")
    int expiryDays;

    @ConfigProperty(
            name = "bandit.feedback.half-life-days",
            defaultValue = "14")
    double halfLifeDays;

    @ConfigProperty(
            name = "bandit.feedback.updates-per-day",
            defaultValue = "4")
    double updatesPerDay;

    @ConfigProperty(
            name = "bandit.feedback.count-cap",
            defaultValue = "100")
    double countCap;

    @ConfigProperty(
            name = "bandit.feedback.median-window-days",
            defaultValue = "30")
    int medianWindowDays;

    @ConfigProperty(
            name = "bandit.feedback.max-lookback-hours",
            defaultValue = "48")
    int maxLookbackHours;

    @ConfigProperty(
            name = "bandit.feedback.max-batch-size",
            defaultValue = "10000")
    int maxBatchSize;

    private Map<String, Integer> weeklyCaps = Collections.emptyMap();

    private Map<PriceTier, Double> priceBase = new EnumMap<>(PriceTier.class);

    @PostConstruct
    public void validateConfiguration() {
        requireRange("bandit.cooldown-days", cooldownDays, 0, 365);
        requireRange("bandit.exploration-rate", explorationRate, 0.0, 1.0);
        requireRange("bandit.cold-start-conversion", coldStartConversion, 0.0, 1.0);
        requireRange("bandit.assignment.expiry-days", expiryDays, 1, 365);
        requirePositive("bandit.feedback.half-life-days", halfLifeDays);
        requirePositive("bandit.feedback.updates-per-day", updatesPerDay);
        requirePositive("bandit.feedback.count-cap", countCap);
        requirePositive("bandit.feedback.median-window-days", medianWindowDays);
        requirePositive("bandit.feedback.max-lookback-hours", maxLookbackHours);
        requirePositive("bandit.feedback.max-batch-size", maxBatchSize);

        if (confidenceLevel != 0.90 && confidenceLevel != 0.95 && confidenceLevel != 0.99) {
            LOG.warnf("bandit.confidence-level=%.3f is not one of 0.90/0.95/0.99, Wilson bounds will use z=1.96",
                    confidenceLevel);
        }
        if (expiryDays < cooldownDays) {
            LOG.warnf("bandit.assignment.expiry-days (%d) is shorter than bandit.cooldown-days (%d); captions will be "
                    + "released before their cooldown ends", expiryDays, cooldownDays);
        }

        weeklyCaps = parseWeeklyCaps(weeklyCapsSetting);
        priceBase = parsePriceBase(priceBaseSetting);

        LOG.infof("Bandit configured: cooldown=%dd, exploration=%.2f, confidence=%.2f, halfLife=%.1fd x %.1f/day, "
                + "caps=%s", cooldownDays, explorationRate, confidenceLevel, halfLifeDays, updatesPerDay, weeklyCaps);
    }

    static Map<String, Integer> parseWeeklyCaps(String raw) {
        Map<String, Integer> caps = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : parsePairs("bandit.trigger.weekly-caps", raw).entrySet()) {
            try {
                int cap = Integer.parseInt(entry.getValue());
                if (cap < 0) {
                    throw new BanditConfigurationException(
                            "bandit.trigger.weekly-caps: cap for '" + entry.getKey() + "' must not be negative");
                }
                caps.put(entry.getKey(), cap);
            } catch (NumberFormatException e) {
                throw new BanditConfigurationException("bandit.trigger.weekly-caps: cap for '" + entry.getKey()
                        + "' is not an integer: " + entry.getValue(), e);
            }
        }
        return Collections.unmodifiableMap(caps);
    }

    static Map<PriceTier, Double> parsePriceBase(String raw) {
        Map<PriceTier, Double> bases = new EnumMap<>(PriceTier.class);
        for (Map.Entry<String, String> entry : parsePairs("bandit.price-base", raw).entrySet()) {
            PriceTier tier = PriceTier.fromValue(entry.getKey()).orElseThrow(
                    () -> new BanditConfigurationException("bandit.price-base: unknown price tier " + entry.getKey()));
            try {
                bases.put(tier, Double.parseDouble(entry.getValue()));
            } catch (NumberFormatException e) {
                throw new BanditConfigurationException(
                        "bandit.price-base: price for '" + entry.getKey() + "' is not a number: " + entry.getValue(),
                        e);
            }
        }
        return Collections.unmodifiableMap(bases);
    }

    private static Map<String, String> parsePairs(String property, String raw) {
        Map<String, String> pairs = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return pairs;
        }
        for (String item : raw.split(",")) {
            if (item.isBlank()) {
                continue;
            }
            int separator = item.indexOf('=');
            if (separator <= 0 || separator == item.length() - 1) {
                throw new BanditConfigurationException(property + ": expected key=value but found '" + item.trim() + "'");
            }
            pairs.put(item.substring(0, separator).trim().toLowerCase(Locale.ROOT), item.substring(separator + 1).trim());
        }
        return pairs;
    }

    private static void requireRange(String property, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new BanditConfigurationException(property + " must be within [" + min + ", " + max + "] but was " + value);
        }
    }

    private static void requirePositive(String property, double value) {
        if (Double.isNaN(value) || value <= 0) {
            throw new BanditConfigurationException(property + " must be positive but was " + value);
        }
    }

    public int getCooldownDays() {
        return cooldownDays;
    }

    public double getExplorationRate() {
        return explorationRate;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public double getColdStartConversion() {
        return coldStartConversion;
    }

    public int getExpiryDays() {
        return expiryDays;
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public double getUpdatesPerDay() {
        return updatesPerDay;
    }

    public double getCountCap() {
        return countCap;
    }

    public int getMedianWindowDays() {
        return medianWindowDays;
    }

    public int getMaxLookbackHours() {
        return maxLookbackHours;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    /**
     * Whether creator allow-lists and restriction profiles apply when the {@code caption_restrictions_enabled} feature
     * flag row is absent.
     */
    public boolean isRestrictionsEnabled() {
        return restrictionsEnabled;
    }

    /**
     * Returns the weekly cap of a trigger tag. Untagged captions and tags missing from the table are uncapped.
     */
    public OptionalInt weeklyCapFor(String triggerTag) {
        if (triggerTag == null || triggerTag.isBlank()) {
            return OptionalInt.empty();
        }
        Integer cap = weeklyCaps.get(triggerTag.trim().toLowerCase(Locale.ROOT));
        return cap == null ? OptionalInt.empty() : OptionalInt.of(cap);
    }

    /**
     * Returns the typical offer price of a tier, or 0 when the tier is absent from {@code bandit.price-base}.
     */
    public double priceBaseFor(PriceTier tier) {
        return priceBase.getOrDefault(tier, 0.0);
    }

    public static class BanditConfigurationException extends RuntimeException {

        public BanditConfigurationException(String message) {
            super(message);
        }

        public BanditConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
