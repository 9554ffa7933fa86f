package org.tilecascade.runtime;

import org.tilecascade.runtime.model.BlockCatalog;
import org.tilecascade.runtime.model.BlockType;
import org.tilecascade.runtime.model.BonusReward;
import org.tilecascade.runtime.model.BonusRule;
import org.tilecascade.runtime.model.CellCoordinate;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.spi.IRandomProvider;
import org.tilecascade.runtime.worldgen.TileFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fires bonus rules whose metric reaches their threshold. Every rule fires at most once per
 * round; the fired ids are kept in the {@link RoundSession}.
 */
public class BonusRuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(BonusRuleEngine.class);

    private final List<BonusRule> rules;
    private final BlockCatalog catalog;
    private final TileFactory tileFactory;
    private final IRandomProvider random;

    /**
     * Creates an engine.
     *
     * @param rules The round's rules, in evaluation order.
     * @param catalog Catalog used to resolve spawn rewards.
     * @param tileFactory Creates spawned tiles.
     * @param randomProvider Chooses spawn cells.
     */
    public BonusRuleEngine(List<BonusRule> rules, BlockCatalog catalog, TileFactory tileFactory, IRandomProvider randomProvider) {
        this.rules = List.copyOf(rules);
        this.catalog = catalog;
        this.tileFactory = tileFactory;
        this.random = randomProvider;
    }

    /**
     * Evaluates all rules that have not fired yet and applies the rewards of those that fire.
     *
     * @param context The metrics of the resolve that just finished.
     * @param grid The grid, receives spawned tiles.
     * @param session The round's counters.
     * @return The rules that fired, in evaluation order.
     */
    public List<BonusActivation> evaluate(BonusContext context, Grid grid, RoundSession session) {
        List<BonusActivation> activations = new ArrayList<>();
        for (BonusRule rule : rules) {
            if (session.isTriggered(rule.id()) || !isMet(rule, context)) {
                continue;
            }
            session.markTriggered(rule.id());
            CellCoordinate spawnedAt = apply(rule.reward(), grid, session);
            BonusActivation activation = new BonusActivation(rule, rule.name() + ": " + rule.reward().summary(), spawnedAt);
            LOG.debug("Bonus '{}' fired ({} >= {}): {}", rule.id(), rule.triggerType().wireName(), rule.threshold(), activation.summary());
            activations.add(activation);
        }
        return activations;
    }

    private static boolean isMet(BonusRule rule, BonusContext context) {
        return switch (rule.triggerType()) {
            case TOTAL_MATCHES -> context.cumulativeMatches() >= rule.threshold();
            case COMBO -> context.comboMultiplier() >= rule.threshold();
            case CASCADE -> context.cascades() >= rule.threshold();
        };
    }

    private CellCoordinate apply(BonusReward reward, Grid grid, RoundSession session) {
        if (reward.extraMoves() != 0) {
            session.adjustMoves(reward.extraMoves());
        }
        if (reward.score() != 0) {
            session.addScore(reward.score());
        }
        if (reward.spawnSpecialBlockId() != null && !reward.spawnSpecialBlockId().isBlank()) {
            return spawn(reward.spawnSpecialBlockId(), grid);
        }
        return null;
    }

    /**
     * Places one tile of the given type on a random empty playable cell. Unknown ids fall back
     * to the first catalog entry.
     *
     * @return The cell used, or null if the grid has no empty cell.
     */
    private CellCoordinate spawn(String blockTypeId, Grid grid) {
        BlockType type = catalog.find(blockTypeId).orElseGet(() -> {
            LOG.debug("Spawn reward names unknown block type '{}', using '{}'", blockTypeId, catalog.first().id());
            return catalog.first();
        });
        List<CellCoordinate> freeCells = grid.emptyCells();
        if (freeCells.isEmpty()) {
            return null;
        }
        CellCoordinate target = freeCells.get(random.nextInt(freeCells.size()));
        grid.place(target.row(), target.col(), tileFactory.create(type));
        return target;
    }
}
