package villagecompute.captions.services;

/**
 * A selected candidate and whether it had to break a hard diversity rule.
 */
public record RankedPick(ScoredCandidate candidate, boolean diversityViolation) {
}
