package org.tilecascade.runtime.model;

/**
 * A cell position on the grid.
 * @param row The row, counted from the top.
 * @param col The column, counted from the left.
 */
public record CellCoordinate(int row, int col) {

    /**
     * Checks whether the other cell shares an edge with this one (Manhattan distance 1).
     * @param other The other cell.
     * @return true if the cells are 4-adjacent.
     */
    public boolean isAdjacentTo(CellCoordinate other) {
        return Math.abs(row - other.row) + Math.abs(col - other.col) == 1;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
