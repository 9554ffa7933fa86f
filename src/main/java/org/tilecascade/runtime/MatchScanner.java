package org.tilecascade.runtime;

import org.tilecascade.runtime.model.IGridReader;
import org.tilecascade.runtime.model.MatchMask;
import org.tilecascade.runtime.model.Tile;

/**
 * Finds runs of at least {@link Config#MIN_RUN_LENGTH} tiles of the same color along rows and
 * columns. Empty and blocked cells always break a run. The scanner is stateless and never
 * modifies the grid.
 */
public class MatchScanner {

    /**
     * Scans every row left to right and every column top to bottom.
     *
     * @param grid The grid to scan.
     * @return The marked cells and the number of runs.
     */
    public ScanResult scan(IGridReader grid) {
        int size = grid.getSize();
        MatchMask mask = new MatchMask(size);
        int groups = 0;
        for (int row = 0; row < size; row++) {
            groups += scanLine(grid, mask, row, true);
        }
        for (int col = 0; col < size; col++) {
            groups += scanLine(grid, mask, col, false);
        }
        return new ScanResult(mask, groups);
    }

    /**
     * Checks whether the grid contains at least one run.
     * @param grid The grid.
     * @return true if a scan would report a group.
     */
    public boolean hasMatches(IGridReader grid) {
        return scan(grid).hasMatches();
    }

    private int scanLine(IGridReader grid, MatchMask mask, int line, boolean horizontal) {
        int size = grid.getSize();
        int groups = 0;
        int runStart = 0;
        int runLength = 0;
        int runColor = 0;
        for (int i = 0; i < size; i++) {
            Tile tile = horizontal ? grid.tileAt(line, i) : grid.tileAt(i, line);
            if (tile != null && runLength > 0 && tile.color() == runColor) {
                runLength++;
                continue;
            }
            groups += closeRun(mask, line, horizontal, runStart, runLength);
            if (tile != null) {
                runStart = i;
                runLength = 1;
                runColor = tile.color();
            } else {
                runLength = 0;
            }
        }
        groups += closeRun(mask, line, horizontal, runStart, runLength);
        return groups;
    }

    private int closeRun(MatchMask mask, int line, boolean horizontal, int start, int length) {
        if (length < Config.MIN_RUN_LENGTH) {
            return 0;
        }
        for (int i = start; i < start + length; i++) {
            if (horizontal) {
                mask.mark(line, i);
            } else {
                mask.mark(i, line);
            }
        }
        return 1;
    }
}
