package org.tilecascade.runtime.worldgen;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.tilecascade.runtime.Config;
import org.tilecascade.runtime.MatchScanner;
import org.tilecascade.runtime.model.BlockType;
import org.tilecascade.runtime.model.CellState;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills a fresh grid so that it starts without any run.
 * <p>
 * The grid is filled with weighted draws and regenerated up to
 * {@link Config#GENERATION_ATTEMPTS} times. If runs remain after the last attempt, they are
 * broken in place: cells are visited in row-major order and a cell that completes a run with
 * its two left or two upper neighbors is redrawn from the other colors.
 */
public class GridGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(GridGenerator.class);

    private final WeightedBlockPicker picker;
    private final TileFactory tileFactory;
    private final MatchScanner scanner = new MatchScanner();

    /**
     * Creates a generator.
     *
     * @param picker Weighted draws over the round's catalog.
     * @param tileFactory Factory for the new tiles.
     */
    public GridGenerator(WeightedBlockPicker picker, TileFactory tileFactory) {
        this.picker = picker;
        this.tileFactory = tileFactory;
    }

    /**
     * Fills every playable cell of the grid, replacing existing tiles.
     *
     * @param grid The grid to fill.
     * @return The number of fill attempts used.
     */
    public int generate(Grid grid) {
        int attempt = 0;
        boolean hasStartingMatches;
        do {
            fill(grid);
            hasStartingMatches = scanner.hasMatches(grid);
            attempt++;
        } while (hasStartingMatches && attempt < Config.GENERATION_ATTEMPTS);

        if (hasStartingMatches) {
            int repaired = breakRuns(grid);
            LOG.debug("Grid still had runs after {} attempts, redrew {} cells", attempt, repaired);
        }
        return attempt;
    }

    private void fill(Grid grid) {
        int size = grid.getSize();
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                if (grid.isBlocked(row, col)) {
                    continue;
                }
                grid.place(row, col, tileFactory.create(picker.pick()));
            }
        }
    }

    private int breakRuns(Grid grid) {
        int size = grid.getSize();
        int redrawn = 0;
        IntSet forbidden = new IntOpenHashSet();
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                Tile tile = grid.tileAt(row, col);
                if (tile == null) {
                    continue;
                }
                forbidden.clear();
                addPairColor(grid, row, col - 1, row, col - 2, forbidden);
                addPairColor(grid, row - 1, col, row - 2, col, forbidden);
                if (!forbidden.contains(tile.color())) {
                    continue;
                }
                BlockType replacement = picker.pickExcluding(forbidden);
                if (replacement == null) {
                    LOG.warn("Cannot break run at ({}, {}): catalog has too few colors", row, col);
                    continue;
                }
                grid.place(row, col, tileFactory.create(replacement));
                redrawn++;
            }
        }
        return redrawn;
    }

    private static void addPairColor(Grid grid, int r1, int c1, int r2, int c2, IntSet target) {
        if (grid.cellState(r1, c1) != CellState.OCCUPIED || grid.cellState(r2, c2) != CellState.OCCUPIED) {
            return;
        }
        int color = grid.tileAt(r1, c1).color();
        if (grid.tileAt(r2, c2).color() == color) {
            target.add(color);
        }
    }
}
