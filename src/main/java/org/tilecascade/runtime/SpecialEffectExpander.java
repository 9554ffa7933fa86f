package org.tilecascade.runtime;

import org.tilecascade.runtime.model.IGridReader;
import org.tilecascade.runtime.model.MatchMask;
import org.tilecascade.runtime.model.Tile;

import java.util.HashSet;
import java.util.Set;

/**
 * Grows a match mask by the powers of the matched tiles.
 * <p>
 * Only the tiles marked in the input mask are considered. A special tile that is caught by
 * another tile's expansion does not fire in the same pass; it is simply destroyed.
 * The grid is not modified.
 */
public class SpecialEffectExpander {

    /**
     * Expands a scan mask.
     *
     * @param mask The cells matched by the scanner.
     * @param grid The grid the mask refers to.
     * @return A new mask containing the input cells and every cell reached by a power.
     */
    public MatchMask expand(MatchMask mask, IGridReader grid) {
        int size = grid.getSize();
        MatchMask expanded = mask.copy();
        Set<String> clearedTypes = new HashSet<>();

        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                if (!mask.isMarked(row, col)) {
                    continue;
                }
                Tile tile = grid.tileAt(row, col);
                if (tile == null) {
                    continue;
                }
                switch (tile.power()) {
                    case BOMB -> markNeighborhood(expanded, grid, row, col);
                    case LINE_HORIZONTAL -> markRow(expanded, grid, row);
                    case LINE_VERTICAL -> markColumn(expanded, grid, col);
                    case COLOR_CLEAR -> clearedTypes.add(tile.typeId());
                    case SCORE_BOOST, NONE -> {
                        // no expansion
                    }
                }
            }
        }

        if (!clearedTypes.isEmpty()) {
            for (int row = 0; row < size; row++) {
                for (int col = 0; col < size; col++) {
                    Tile tile = grid.tileAt(row, col);
                    if (tile != null && clearedTypes.contains(tile.typeId())) {
                        expanded.mark(row, col);
                    }
                }
            }
        }
        return expanded;
    }

    private static void markNeighborhood(MatchMask target, IGridReader grid, int row, int col) {
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                int r = row + dr;
                int c = col + dc;
                if (!grid.isBlocked(r, c)) {
                    target.mark(r, c);
                }
            }
        }
    }

    private static void markRow(MatchMask target, IGridReader grid, int row) {
        for (int c = 0; c < grid.getSize(); c++) {
            if (!grid.isBlocked(row, c)) {
                target.mark(row, c);
            }
        }
    }

    private static void markColumn(MatchMask target, IGridReader grid, int col) {
        for (int r = 0; r < grid.getSize(); r++) {
            if (!grid.isBlocked(r, col)) {
                target.mark(r, col);
            }
        }
    }
}
