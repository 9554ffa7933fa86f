package org.tilecascade.runtime;

import org.tilecascade.runtime.model.BonusRule;
import org.tilecascade.runtime.model.CellCoordinate;

/**
 * A bonus rule that fired.
 *
 * @param rule The rule.
 * @param summary Human-readable reward text.
 * @param spawnedAt Cell of the spawned tile, or null if the reward spawned nothing.
 */
public record BonusActivation(BonusRule rule, String summary, CellCoordinate spawnedAt) {
}
