package org.tilecascade.runtime.model;

/**
 * A pair of adjacent cells whose tiles are exchanged.
 * @param first The first selected cell.
 * @param second The second selected cell.
 */
public record Swap(CellCoordinate first, CellCoordinate second) {

    @Override
    public String toString() {
        return first + "<->" + second;
    }
}
