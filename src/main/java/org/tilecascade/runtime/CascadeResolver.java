package org.tilecascade.runtime;

import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.MatchMask;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.model.TilePower;
import org.tilecascade.runtime.worldgen.IBlockTypeSource;
import org.tilecascade.runtime.worldgen.TileFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the scan, expand, destroy and refill loop after a swap until the grid holds no run.
 * <p>
 * Each cascade scores {@code round(destroyed * 15 * (1 + (cascade - 1) * 0.25))} plus the bonus
 * score of every destroyed tile. The combo multiplier {@code 1 + (cascade - 1) * 0.5} is written
 * to the session for display; it is not applied to the score here.
 */
public class CascadeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(CascadeResolver.class);

    private final MatchScanner scanner;
    private final SpecialEffectExpander expander;
    private final IBlockTypeSource refillSource;
    private final TileFactory tileFactory;

    /**
     * Creates a resolver.
     *
     * @param scanner The match scanner.
     * @param expander The special effect expander.
     * @param refillSource Chooses the type of every refilled tile.
     * @param tileFactory Creates the refilled tiles.
     */
    public CascadeResolver(MatchScanner scanner, SpecialEffectExpander expander,
                           IBlockTypeSource refillSource, TileFactory tileFactory) {
        this.scanner = scanner;
        this.expander = expander;
        this.refillSource = refillSource;
        this.tileFactory = tileFactory;
    }

    /**
     * Resolves the grid to a fixed point. Does nothing once the round has ended.
     *
     * @param grid The grid, mutated in place.
     * @param session The round's counters, updated with score, matches and combo.
     * @return The summary of all cascades.
     * @throws IllegalStateException if the grid does not stabilise within
     *         {@link Config#MAX_CASCADES_PER_RESOLVE} cascades.
     */
    public CascadeResult resolve(Grid grid, RoundSession session) {
        if (session.isEnded()) {
            return CascadeResult.none();
        }
        List<CascadeStep> steps = new ArrayList<>();
        int cascadeIndex = 1;
        int totalGroups = 0;
        int totalDestroyed = 0;
        long totalPoints = 0;

        while (true) {
            ScanResult scan = scanner.scan(grid);
            if (!scan.hasMatches()) {
                break;
            }
            if (cascadeIndex > Config.MAX_CASCADES_PER_RESOLVE) {
                throw new IllegalStateException("Grid did not stabilise after " + Config.MAX_CASCADES_PER_RESOLVE
                        + " cascades; the refill source keeps producing runs");
            }

            MatchMask expanded = expander.expand(scan.mask(), grid);
            long tileBonus = 0;
            int destroyed = 0;
            int size = grid.getSize();
            for (int row = 0; row < size; row++) {
                for (int col = 0; col < size; col++) {
                    if (!expanded.isMarked(row, col)) {
                        continue;
                    }
                    Tile tile = grid.remove(row, col);
                    if (tile == null) {
                        continue;
                    }
                    tileBonus += tileBonus(tile);
                    destroyed++;
                }
            }

            long cascadePoints = cascadePoints(destroyed, cascadeIndex);
            session.addScore(tileBonus + cascadePoints);
            session.setComboMultiplier(comboMultiplier(cascadeIndex));
            session.addMatches(scan.groups());

            CascadeStep step = new CascadeStep(cascadeIndex, scan.groups(), scan.mask().count(), destroyed, tileBonus, cascadePoints);
            steps.add(step);
            LOG.debug("Cascade {}: groups={} matched={} destroyed={} points={}",
                    cascadeIndex, step.groups(), step.matchedCells(), destroyed, step.points());

            totalGroups += scan.groups();
            totalDestroyed += destroyed;
            totalPoints += step.points();

            refill(grid);
            cascadeIndex++;
        }

        if (steps.isEmpty()) {
            return CascadeResult.none();
        }
        return new CascadeResult(steps.size(), totalGroups, totalDestroyed, totalPoints, session.getComboMultiplier(), steps);
    }

    /**
     * Lets tiles fall within their gravity segments, then fills every empty playable cell from
     * the top of its segment down.
     *
     * @param grid The grid.
     */
    void refill(Grid grid) {
        int size = grid.getSize();
        for (int col = 0; col < size; col++) {
            grid.compactColumn(col);
            for (int row = 0; row < size; row++) {
                if (grid.isEmpty(row, col)) {
                    grid.place(row, col, tileFactory.create(refillSource.next(row, col)));
                }
            }
        }
    }

    /**
     * Score of one cascade before tile bonuses.
     *
     * @param destroyed Tiles destroyed in the cascade.
     * @param cascadeIndex The cascade number, starting at 1.
     * @return {@code round(destroyed * 15 * (1 + (cascadeIndex - 1) * 0.25))}
     */
    public static long cascadePoints(int destroyed, int cascadeIndex) {
        double cascadeBonus = 1 + (cascadeIndex - 1) * Config.CASCADE_BONUS_STEP;
        return Math.round(destroyed * Config.POINTS_PER_TILE * cascadeBonus);
    }

    /**
     * Combo multiplier reported after a cascade, rounded to one decimal.
     *
     * @param cascadeIndex The cascade number, starting at 1.
     * @return {@code 1 + (cascadeIndex - 1) * 0.5}
     */
    public static double comboMultiplier(int cascadeIndex) {
        return Math.round((1 + (cascadeIndex - 1) * Config.COMBO_STEP) * 10) / 10.0;
    }

    /**
     * Score granted when a tile is destroyed on top of the cascade formula.
     *
     * @param tile The destroyed tile.
     * @return The tile's bonus score, plus the scoreBoost extra for scoreBoost tiles.
     */
    public static long tileBonus(Tile tile) {
        long bonus = Math.max(0, tile.bonusScore());
        if (tile.power() == TilePower.SCORE_BOOST) {
            int base = tile.bonusScore() > 0 ? tile.bonusScore() : Config.SCORE_BOOST_DEFAULT;
            bonus += Math.max(Config.SCORE_BOOST_MIN, base);
        }
        return bonus;
    }
}
