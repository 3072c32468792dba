package villagecompute.captions.services;

import villagecompute.captions.data.models.PriceTier;

import java.util.List;
import java.util.Map;

/**
 * Result of ranking: picks in selection order plus quota deficits per tier.
 */
public record RankingOutcome(List<RankedPick> picks, Map<PriceTier, Integer> tierShortfalls) {

    public boolean hasShortfall(int countNeeded) {
        return picks.size() < countNeeded || !tierShortfalls.isEmpty();
    }
}
