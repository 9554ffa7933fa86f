package org.tilecascade.runtime;

/**
 * Metrics a bonus rule can be triggered by.
 *
 * @param cascades Cascades of the resolve that just finished.
 * @param comboMultiplier Combo multiplier after that resolve.
 * @param cumulativeMatches Runs matched in the round so far.
 */
public record BonusContext(int cascades, double comboMultiplier, int cumulativeMatches) {

    /**
     * Builds the context for a finished resolve.
     * @param result The resolve summary.
     * @param session The round's counters.
     * @return The context.
     */
    public static BonusContext of(CascadeResult result, RoundSession session) {
        return new BonusContext(result.cascades(), session.getComboMultiplier(), session.getMatches());
    }
}
