package org.tilecascade.runtime;

import java.util.List;

/**
 * Summary of one resolve.
 *
 * @param cascades Number of cascades; 0 if the swap matched nothing.
 * @param groups Runs matched over all cascades.
 * @param destroyed Tiles destroyed over all cascades.
 * @param points Score gained over all cascades.
 * @param comboMultiplier Combo multiplier after the last cascade (1.0 without cascades).
 * @param steps Per-cascade details.
 */
public record CascadeResult(int cascades, int groups, int destroyed, long points, double comboMultiplier, List<CascadeStep> steps) {

    public CascadeResult {
        steps = List.copyOf(steps);
    }

    /**
     * A resolve that found nothing.
     * @return The empty result.
     */
    public static CascadeResult none() {
        return new CascadeResult(0, 0, 0, 0L, 1.0, List.of());
    }

    public boolean hadMatches() {
        return cascades > 0;
    }
}
