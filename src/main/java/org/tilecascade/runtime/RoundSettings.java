package org.tilecascade.runtime;

import org.tilecascade.runtime.model.BlockCatalog;
import org.tilecascade.runtime.model.BoardModifier;
import org.tilecascade.runtime.model.BonusRule;

import java.util.List;
import java.util.Objects;

/**
 * Validated parameters of one round.
 *
 * @param gridSize Rows and columns.
 * @param targetMatches Runs required to win.
 * @param moveBudget Moves available at round start.
 * @param catalog Block types for generation, refill and spawns.
 * @param bonusRules One-shot rewards.
 * @param boardModifier Blocked cells.
 */
public record RoundSettings(int gridSize, int targetMatches, int moveBudget, BlockCatalog catalog,
                            List<BonusRule> bonusRules, BoardModifier boardModifier) {

    public RoundSettings {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(boardModifier, "boardModifier");
        bonusRules = List.copyOf(bonusRules);
        if (targetMatches <= 0) {
            throw new IllegalArgumentException("Target matches must be positive: " + targetMatches);
        }
        if (moveBudget <= 0) {
            throw new IllegalArgumentException("Move budget must be positive: " + moveBudget);
        }
    }
}
