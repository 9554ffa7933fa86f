package org.tilecascade.runtime.model;

/**
 * Read-only view of a {@link Grid}, handed to components that must not mutate cells.
 */
public interface IGridReader {

    int getSize();

    GridProperties getProperties();

    boolean inBounds(int row, int col);

    boolean isBlocked(int row, int col);

    CellState cellState(int row, int col);

    /**
     * Gets the tile in a cell.
     * @param row The row.
     * @param col The column.
     * @return The tile, or null if the cell is empty, blocked or outside the grid.
     */
    Tile tileAt(int row, int col);
}
