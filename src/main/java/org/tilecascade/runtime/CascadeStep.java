package org.tilecascade.runtime;

/**
 * Accounting of one scan-destroy-refill cycle.
 *
 * @param cascadeIndex 1 for the cascade caused by the swap itself, then 2, 3, ...
 * @param groups Runs found by the scan (before expansion).
 * @param matchedCells Cells marked by the scan.
 * @param destroyed Tiles destroyed after expansion.
 * @param tileBonus Score from the destroyed tiles' bonus and scoreBoost values.
 * @param cascadePoints Score from the cascade formula.
 */
public record CascadeStep(int cascadeIndex, int groups, int matchedCells, int destroyed, long tileBonus, long cascadePoints) {

    public long points() {
        return tileBonus + cascadePoints;
    }
}
