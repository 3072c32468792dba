package villagecompute.captions.services;

import villagecompute.captions.data.models.Caption;

/**
 * A caption that survived filtering, with the penalties the filter attached to it.
 *
 * @param caption
 *            the caption
 * @param budgetPenalty
 *            trigger budget penalty (0.0, −0.2 or −0.5)
 * @param softPatternPenalty
 *            −0.1 per matching soft restriction pattern
 */
public record EligibleCaption(Caption caption, double budgetPenalty, double softPatternPenalty) {
}
