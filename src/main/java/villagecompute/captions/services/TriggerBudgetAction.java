/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.captions.services;

/**
 * Weekly trigger budget states of a creator, by share of the trigger's cap already used.
 *
 * <ul>
 * <li>NORMAL (&lt;60%): no penalty</li>
 * <li>CAUTION (60-80%): −0.2 on the composite score</li>
 * <li>WARNING (80-100%): −0.5 on the composite score</li>
 * <li>EXCLUDE (≥100%): the caption is removed from the candidate pool</li>
 * </ul>
 *
 * @see TriggerBudgetService
 */
public enum TriggerBudgetAction {

    NORMAL(0.0),

    CAUTION(-0.2),

    WARNING(-0.5),

    /**
     * Cap reached for this ISO week.
     */
    EXCLUDE(-1.0);

    private final double penalty;

    TriggerBudgetAction(double penalty) {
        this.penalty = penalty;
    }

    public double getPenalty() {
        return penalty;
    }
}
