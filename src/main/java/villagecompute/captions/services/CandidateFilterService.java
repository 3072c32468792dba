package villagecompute.captions.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.captions.config.BanditConfig;
import villagecompute.captions.data.models.ActiveAssignment;
import villagecompute.captions.data.models.Caption;
import villagecompute.captions.data.models.CaptionFilterAuditLog;
import villagecompute.captions.data.models.CaptionFilterAuditLog.Enforcement;
import villagecompute.captions.data.models.CaptionFilterAuditLog.RuleType;
import villagecompute.captions.data.models.CreatorAllowedProfile;
import villagecompute.captions.data.models.CreatorRestriction;
import villagecompute.captions.data.models.FeatureFlag;
import villagecompute.captions.data.models.PriceTier;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Reduces the caption pool to the captions a creator may receive on a target date.
 *
 * <p>
 * <b>Stages</b> (in order, each reported in pool health):
 * <ol>
 * <li>inactive captions are dropped</li>
 * <li>cooldown: captions held by any creator's active, unexpired assignment within ± cooldown days of the target date
 * are dropped</li>
 * <li>restrictions: captions whose exclusion list names the creator are dropped; then, unless the
 * {@code caption_restrictions_enabled} flag is off, captions outside the creator's allow-list, or matching the
 * creator's restricted categories, restricted price tiers or hard patterns, are dropped; soft pattern matches cost
 * −0.1 each</li>
 * <li>budget: captions whose trigger tag has reached its weekly cap are dropped</li>
 * </ol>
 *
 * <p>
 * Restriction data is free text maintained by hand. Anything unreadable (bad JSON, an invalid regex, an unknown tier)
 * is logged at WARN and ignored, so a data error never empties the pool. Every restriction removal and soft penalty is
 * recorded in {@link CaptionFilterAuditLog}.
 */
@ApplicationScoped
public class CandidateFilterService {

    private static final Logger LOG = Logger.getLogger(CandidateFilterService.class);

    static final double SOFT_PATTERN_PENALTY = -0.1;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    @Inject
    BanditConfig banditConfig;

    @Inject
    TriggerBudgetService triggerBudgetService;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Runs all filter stages. Must be called within a transaction because audit rows are written.
     *
     * @param requestId
     *            selection request id, recorded on audit rows
     * @param creatorId
     *            creator the captions are for
     * @param targetDate
     *            delivery date used for the cooldown window
     * @param pool
     *            candidate captions
     * @param weeklyUsage
     *            creator's trigger usage this week
     * @param now
     *            reference instant for assignment expiry
     * @return eligible captions and stage counts
     */
    public FilterResult filter(UUID requestId, String creatorId, LocalDate targetDate, List<Caption> pool,
            Map<String, Integer> weeklyUsage, Instant now) {
        int totalAvailable = pool.size();

        List<Caption> active = pool.stream().filter(c -> c.active).toList();

        Set<Long> held = findHeldCaptionIds(targetDate, now);
        List<Caption> afterCooldown = active.stream().filter(c -> !held.contains(c.id)).toList();

        RestrictionProfile profile = restrictionsEnabled() ? loadProfile(creatorId) : RestrictionProfile.NONE;
        List<EligibleCaption> afterRestriction = applyRestrictions(requestId, creatorId, afterCooldown, profile, now);

        List<EligibleCaption> eligible = new ArrayList<>(afterRestriction.size());
        for (EligibleCaption candidate : afterRestriction) {
            double penalty = triggerBudgetService.calculatePenalty(candidate.caption().triggerTag, weeklyUsage);
            if (triggerBudgetService.isExcluded(penalty)) {
                continue;
            }
            eligible.add(new EligibleCaption(candidate.caption(), penalty, candidate.softPatternPenalty()));
        }

        LOG.debugf("Filtered pool for creator %s on %s: total=%d, active=%d, cooldown=%d, restriction=%d, budget=%d",
                creatorId, targetDate, totalAvailable, active.size(), afterCooldown.size(), afterRestriction.size(),
                eligible.size());

        return new FilterResult(eligible, totalAvailable, afterCooldown.size(), afterRestriction.size(),
                eligible.size());
    }

    /**
     * Returns the ids of captions held by any active, unexpired assignment within ± cooldown of the date.
     */
    public Set<Long> findHeldCaptionIds(LocalDate targetDate, Instant now) {
        int cooldown = banditConfig.getCooldownDays();
        return ActiveAssignment.findActiveInWindow(targetDate.minusDays(cooldown), targetDate.plusDays(cooldown), now)
                .stream().map(a -> a.captionId).collect(Collectors.toSet());
    }

    /**
     * Reads the {@code caption_restrictions_enabled} flag, falling back to {@code bandit.restrictions.enabled} when no
     * flag row exists.
     */
    public boolean restrictionsEnabled() {
        boolean enabled = FeatureFlag.findByKey(FeatureFlag.CAPTION_RESTRICTIONS_ENABLED).map(f -> f.enabled)
                .orElse(banditConfig.isRestrictionsEnabled());
        if (!enabled) {
            LOG.debug("Caption restrictions disabled, skipping allow-lists and restriction profiles");
        }
        return enabled;
    }

    private List<EligibleCaption> applyRestrictions(UUID requestId, String creatorId, List<Caption> captions,
            RestrictionProfile profile, Instant now) {
        List<EligibleCaption> kept = new ArrayList<>(captions.size());
        List<CaptionFilterAuditLog> audit = new ArrayList<>();

        for (Caption caption : captions) {
            Optional<CaptionFilterAuditLog> removal = findHardViolation(caption, creatorId, profile);
            if (removal.isPresent()) {
                audit.add(removal.get());
                continue;
            }

            double softPenalty = 0.0;
            for (Pattern pattern : profile.softPatterns()) {
                if (pattern.matcher(caption.text).find()) {
                    softPenalty += SOFT_PATTERN_PENALTY;
                    audit.add(auditEntry(creatorId, caption, RuleType.PATTERN_SOFT, pattern.pattern(),
                            Enforcement.SOFT));
                }
            }
            kept.add(new EligibleCaption(caption, 0.0, softPenalty));
        }

        for (CaptionFilterAuditLog entry : audit) {
            entry.requestId = requestId;
            entry.poolSizeBefore = captions.size();
            entry.poolSizeAfter = kept.size();
            entry.filteredAt = now;
            entry.persist();
        }
        if (!audit.isEmpty()) {
            LOG.infof("Restrictions for creator %s removed %d and penalised %d captions (request %s)", creatorId,
                    captions.size() - kept.size(), audit.size() - (captions.size() - kept.size()), requestId);
        }
        return kept;
    }

    private Optional<CaptionFilterAuditLog> findHardViolation(Caption caption, String creatorId,
            RestrictionProfile profile) {
        if (parseList(caption.excludedCreatorIds, "caption " + caption.id + " exclusion list").contains(creatorId)) {
            return Optional.of(auditEntry(creatorId, caption, RuleType.CREATOR_EXCLUDED, creatorId, Enforcement.HARD));
        }
        if (!profile.allowedCategories().isEmpty() && (caption.category == null
                || !profile.allowedCategories().contains(caption.category.toLowerCase(Locale.ROOT)))) {
            return Optional.of(auditEntry(creatorId, caption, RuleType.NOT_ALLOWED_CATEGORY,
                    String.valueOf(caption.category), Enforcement.HARD));
        }
        if (!profile.allowedPriceTiers().isEmpty() && !profile.allowedPriceTiers().contains(caption.priceTier)) {
            return Optional.of(auditEntry(creatorId, caption, RuleType.NOT_ALLOWED_PRICE_TIER,
                    caption.priceTier.getValue(), Enforcement.HARD));
        }
        if (caption.category != null && profile.categories().contains(caption.category.toLowerCase(Locale.ROOT))) {
            return Optional.of(auditEntry(creatorId, caption, RuleType.CATEGORY, caption.category, Enforcement.HARD));
        }
        if (profile.priceTiers().contains(caption.priceTier)) {
            return Optional.of(auditEntry(creatorId, caption, RuleType.PRICE_TIER, caption.priceTier.getValue(),
                    Enforcement.HARD));
        }
        for (Pattern pattern : profile.hardPatterns()) {
            if (pattern.matcher(caption.text).find()) {
                return Optional.of(
                        auditEntry(creatorId, caption, RuleType.PATTERN_HARD, pattern.pattern(), Enforcement.HARD));
            }
        }
        return Optional.empty();
    }

    /**
     * Loads and parses the creator's latest allow-list and active restriction profile. Malformed entries are dropped
     * individually.
     */
    RestrictionProfile loadProfile(String creatorId) {
        Set<String> allowedCategories = Set.of();
        Set<PriceTier> allowedTiers = Set.of();
        Optional<CreatorAllowedProfile> allowed = CreatorAllowedProfile.findLatestActiveForCreator(creatorId);
        if (allowed.isPresent()) {
            String source = "allow-list of creator " + creatorId;
            allowedCategories = lowerCase(parseList(allowed.get().allowedCategories, source + " (categories)"));
            allowedTiers = parseTiers(allowed.get().allowedPriceTiers, source + " (price tiers)");
        }

        Optional<CreatorRestriction> restriction = CreatorRestriction.findActiveForCreator(creatorId);
        if (restriction.isEmpty()) {
            return new RestrictionProfile(allowedCategories, allowedTiers, Set.of(), Set.of(), List.of(), List.of());
        }
        CreatorRestriction row = restriction.get();
        String source = "restrictions of creator " + creatorId;

        return new RestrictionProfile(allowedCategories, allowedTiers,
                lowerCase(parseList(row.restrictedCategories, source + " (categories)")),
                parseTiers(row.restrictedPriceTiers, source + " (price tiers)"),
                compile(row.hardPatterns, source + " (hard patterns)"),
                compile(row.softPatterns, source + " (soft patterns)"));
    }

    private static Set<String> lowerCase(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    /**
     * Resolves tier names, skipping unknown ones. An allow-list made only of unknown tiers therefore allows all.
     */
    private Set<PriceTier> parseTiers(String raw, String source) {
        Set<PriceTier> tiers = EnumSet.noneOf(PriceTier.class);
        for (String value : parseList(raw, source)) {
            PriceTier.fromValue(value).ifPresentOrElse(tiers::add,
                    () -> LOG.warnf("Ignoring unknown price tier '%s' in %s", value, source));
        }
        return tiers;
    }

    private List<Pattern> compile(String raw, String source) {
        List<Pattern> patterns = new ArrayList<>();
        for (String value : parseList(raw, source)) {
            try {
                patterns.add(Pattern.compile(value, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                LOG.warnf("Ignoring invalid pattern '%s' in %s: %s", value, source, e.getDescription());
            }
        }
        return patterns;
    }

    /**
     * Parses a JSON array or comma separated list. Returns an empty list for blank or unreadable input.
     */
    List<String> parseList(String raw, String source) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("[")) {
            try {
                List<String> values = objectMapper.readValue(trimmed, STRING_LIST);
                return values.stream().filter(v -> v != null && !v.isBlank()).map(String::trim).toList();
            } catch (JsonProcessingException e) {
                LOG.warnf("Malformed list in %s, treating as unrestricted: %s", source, e.getOriginalMessage());
                return List.of();
            }
        }
        List<String> values = new ArrayList<>();
        for (String value : trimmed.split(",")) {
            if (!value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    private static CaptionFilterAuditLog auditEntry(String creatorId, Caption caption, RuleType ruleType,
            String ruleValue, Enforcement enforcement) {
        CaptionFilterAuditLog entry = new CaptionFilterAuditLog();
        entry.creatorId = creatorId;
        entry.captionId = caption.id;
        entry.ruleType = ruleType;
        entry.ruleValue = ruleValue;
        entry.enforcement = enforcement;
        return entry;
    }

    /**
     * Parsed restriction data. Empty allow sets allow everything.
     */
    record RestrictionProfile(Set<String> allowedCategories, Set<PriceTier> allowedPriceTiers, Set<String> categories,
            Set<PriceTier> priceTiers, List<Pattern> hardPatterns, List<Pattern> softPatterns) {

        static final RestrictionProfile NONE = new RestrictionProfile(Set.of(), Set.of(), Set.of(), Set.of(),
                List.of(), List.of());
    }
}
