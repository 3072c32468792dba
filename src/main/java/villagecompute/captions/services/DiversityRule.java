package villagecompute.captions.services;

/**
 * Hard diversity rules enforced while ordering a selection.
 */
public enum DiversityRule {

    /** No price tier more than twice in a row. */
    TIER_RUN,

    /** No trigger tag repeated within the last three assignments. */
    TRIGGER_REPEAT,

    /** No category twice in a row. */
    CATEGORY_REPEAT
}
