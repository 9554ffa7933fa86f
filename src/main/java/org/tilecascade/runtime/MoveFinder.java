package org.tilecascade.runtime;

import org.tilecascade.runtime.model.CellCoordinate;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.Swap;

import java.util.Optional;

/**
 * Looks for a swap that produces at least one run.
 */
public class MoveFinder {

    private final MatchScanner scanner;

    public MoveFinder(MatchScanner scanner) {
        this.scanner = scanner;
    }

    /**
     * Tries every pair of horizontally or vertically adjacent tiles in row-major order on a copy
     * of the grid.
     *
     * @param grid The grid; not modified.
     * @return The first swap that creates a run, or empty if there is none.
     */
    public Optional<Swap> findMatchingSwap(Grid grid) {
        int size = grid.getSize();
        Grid probe = grid.copy();
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                if (probe.tileAt(row, col) == null) {
                    continue;
                }
                CellCoordinate a = new CellCoordinate(row, col);
                for (CellCoordinate b : new CellCoordinate[]{new CellCoordinate(row, col + 1), new CellCoordinate(row + 1, col)}) {
                    if (probe.tileAt(b.row(), b.col()) == null) {
                        continue;
                    }
                    probe.swap(a, b);
                    boolean matches = scanner.hasMatches(probe);
                    probe.swap(a, b);
                    if (matches) {
                        return Optional.of(new Swap(a, b));
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Finds any legal swap, matching or not.
     *
     * @param grid The grid; not modified.
     * @return The first adjacent pair of tiles in row-major order, or empty if there is none.
     */
    public Optional<Swap> findAnySwap(Grid grid) {
        int size = grid.getSize();
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                if (grid.tileAt(row, col) == null) {
                    continue;
                }
                if (grid.tileAt(row, col + 1) != null) {
                    return Optional.of(new Swap(new CellCoordinate(row, col), new CellCoordinate(row, col + 1)));
                }
                if (grid.tileAt(row + 1, col) != null) {
                    return Optional.of(new Swap(new CellCoordinate(row, col), new CellCoordinate(row + 1, col)));
                }
            }
        }
        return Optional.empty();
    }
}
