package org.tilecascade.runtime.model;

/**
 * Represents the shape of a square grid without the cell data.
 * This class provides the flat index arithmetic shared by the grid, the scanner masks and the
 * tools that report on a grid.
 */
public class GridProperties {
    private final int size;

    /**
     * Creates new grid properties.
     *
     * @param size The number of rows (and columns) of the grid.
     */
    public GridProperties(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Grid size must be positive: " + size);
        }
        this.size = size;
    }

    /**
     * Gets the number of rows (and columns).
     *
     * @return The grid size
     */
    public int getSize() {
        return size;
    }

    /**
     * Gets the number of cells.
     *
     * @return size * size
     */
    public int getCellCount() {
        return size * size;
    }

    /**
     * Checks whether a coordinate lies on the grid.
     *
     * @param row The row
     * @param col The column
     * @return true if inside the grid
     */
    public boolean inBounds(int row, int col) {
        return row >= 0 && row < size && col >= 0 && col < size;
    }

    /**
     * Converts a coordinate to its flat index.
     * <p>
     * Row-major order: {@code flatIndex = row * size + col}.
     *
     * @param row The row
     * @param col The column
     * @return The flat index
     * @throws IndexOutOfBoundsException if the coordinate is not on the grid
     */
    public int toFlatIndex(int row, int col) {
        if (!inBounds(row, col)) {
            throw new IndexOutOfBoundsException("Cell (" + row + "," + col + ") is outside a " + size + "x" + size + " grid");
        }
        return row * size + col;
    }

    /**
     * Converts a flat index to a coordinate.
     * <p>
     * This is the inverse operation of {@link #toFlatIndex(int, int)}.
     *
     * @param flatIndex The flat index to convert (must be non-negative)
     * @return The coordinate
     * @throws IllegalArgumentException if flatIndex is negative or beyond the last cell
     */
    public CellCoordinate flatIndexToCoordinate(int flatIndex) {
        if (flatIndex < 0 || flatIndex >= getCellCount()) {
            throw new IllegalArgumentException("Flat index out of range: " + flatIndex);
        }
        return new CellCoordinate(flatIndex / size, flatIndex % size);
    }
}
