package org.tilecascade.runtime.model;

import org.tilecascade.runtime.Config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * The square playing field. Cells live in a flat arena indexed by {@code row * size + col}; each
 * cell carries an explicit {@link CellState} tag instead of overloading null.
 * <p>
 * The grid is the only writer of its cells. The blocked-cell set is fixed at construction.
 */
public class Grid implements IGridReader {
    private final GridProperties properties;
    private final int size;
    private final CellState[] states;
    private final Tile[] tiles;

    /**
     * Creates an empty grid. Blocked cells outside the grid are ignored.
     *
     * @param size The number of rows and columns, within [{@link Config#MIN_GRID_SIZE}, {@link Config#MAX_GRID_SIZE}].
     * @param blockedCells Cells excluded from play for the round.
     */
    public Grid(int size, Collection<CellCoordinate> blockedCells) {
        if (size < Config.MIN_GRID_SIZE || size > Config.MAX_GRID_SIZE) {
            throw new IllegalArgumentException("Grid size must be within [" + Config.MIN_GRID_SIZE + ","
                    + Config.MAX_GRID_SIZE + "]: " + size);
        }
        this.properties = new GridProperties(size);
        this.size = size;
        this.states = new CellState[size * size];
        this.tiles = new Tile[size * size];
        Arrays.fill(this.states, CellState.EMPTY);
        for (CellCoordinate cell : blockedCells) {
            if (properties.inBounds(cell.row(), cell.col())) {
                states[properties.toFlatIndex(cell.row(), cell.col())] = CellState.BLOCKED;
            }
        }
    }

    /**
     * Creates an empty grid without blocked cells.
     * @param size The number of rows and columns.
     */
    public Grid(int size) {
        this(size, List.of());
    }

    private Grid(Grid source) {
        this.properties = source.properties;
        this.size = source.size;
        this.states = source.states.clone();
        this.tiles = source.tiles.clone();
    }

    /**
     * Creates an independent copy sharing the (immutable) tiles.
     * @return The copy.
     */
    public Grid copy() {
        return new Grid(this);
    }

    @Override
    public int getSize() {
        return size;
    }

    @Override
    public GridProperties getProperties() {
        return properties;
    }

    @Override
    public boolean inBounds(int row, int col) {
        return properties.inBounds(row, col);
    }

    /**
     * Checks if a cell is blocked. Cells outside the grid count as blocked.
     */
    @Override
    public boolean isBlocked(int row, int col) {
        if (!inBounds(row, col)) {
            return true;
        }
        return states[properties.toFlatIndex(row, col)] == CellState.BLOCKED;
    }

    @Override
    public CellState cellState(int row, int col) {
        if (!inBounds(row, col)) {
            return CellState.BLOCKED;
        }
        return states[properties.toFlatIndex(row, col)];
    }

    @Override
    public Tile tileAt(int row, int col) {
        if (!inBounds(row, col)) {
            return null;
        }
        return tiles[properties.toFlatIndex(row, col)];
    }

    /**
     * Checks whether a playable cell currently has no tile.
     * @param row The row.
     * @param col The column.
     * @return true for EMPTY cells; false for occupied, blocked or out-of-bounds cells.
     */
    public boolean isEmpty(int row, int col) {
        return cellState(row, col) == CellState.EMPTY;
    }

    /**
     * Puts a tile into a cell, replacing any tile that is there.
     *
     * @param row The row.
     * @param col The column.
     * @param tile The tile.
     * @throws IllegalStateException if the cell is blocked or outside the grid. Reaching this
     *         indicates a bug in generation or refill.
     */
    public void place(int row, int col, Tile tile) {
        if (tile == null) {
            throw new IllegalArgumentException("Tile must not be null");
        }
        if (isBlocked(row, col)) {
            throw new IllegalStateException("Attempted to place a tile in blocked or out-of-bounds cell (" + row + ", " + col + ")");
        }
        int index = properties.toFlatIndex(row, col);
        tiles[index] = tile;
        states[index] = CellState.OCCUPIED;
    }

    /**
     * Removes the tile from a cell.
     * @param row The row.
     * @param col The column.
     * @return The removed tile, or null if the cell held none.
     */
    public Tile remove(int row, int col) {
        if (cellState(row, col) != CellState.OCCUPIED) {
            return null;
        }
        int index = properties.toFlatIndex(row, col);
        Tile removed = tiles[index];
        tiles[index] = null;
        states[index] = CellState.EMPTY;
        return removed;
    }

    /**
     * Exchanges the contents of two adjacent playable cells. No tiles are created.
     *
     * @param a The first cell.
     * @param b The second cell.
     * @throws IllegalArgumentException if the cells are not 4-adjacent or either is blocked.
     */
    public void swap(CellCoordinate a, CellCoordinate b) {
        if (!a.isAdjacentTo(b)) {
            throw new IllegalArgumentException("Cells " + a + " and " + b + " are not adjacent");
        }
        if (isBlocked(a.row(), a.col()) || isBlocked(b.row(), b.col())) {
            throw new IllegalArgumentException("Cannot swap with a blocked cell: " + a + " <-> " + b);
        }
        int ia = properties.toFlatIndex(a.row(), a.col());
        int ib = properties.toFlatIndex(b.row(), b.col());
        Tile tile = tiles[ia];
        tiles[ia] = tiles[ib];
        tiles[ib] = tile;
        CellState state = states[ia];
        states[ia] = states[ib];
        states[ib] = state;
    }

    /**
     * Lets the tiles of a column fall down. A blocked cell splits the column into independent
     * gravity segments; no tile falls through a blocked cell. Empty cells end up at the top of
     * each segment.
     *
     * @param col The column.
     */
    public void compactColumn(int col) {
        if (col < 0 || col >= size) {
            throw new IndexOutOfBoundsException("Column " + col + " is outside a " + size + "x" + size + " grid");
        }
        int writeRow = size - 1;
        for (int row = size - 1; row >= 0; row--) {
            if (isBlocked(row, col)) {
                writeRow = row - 1;
                continue;
            }
            if (cellState(row, col) == CellState.OCCUPIED) {
                if (row != writeRow) {
                    Tile tile = remove(row, col);
                    place(writeRow, col, tile);
                }
                writeRow--;
            }
        }
    }

    /**
     * Lists the playable cells without a tile in row-major order.
     * @return The empty cells.
     */
    public List<CellCoordinate> emptyCells() {
        List<CellCoordinate> result = new ArrayList<>();
        for (int i = 0; i < states.length; i++) {
            if (states[i] == CellState.EMPTY) {
                result.add(properties.flatIndexToCoordinate(i));
            }
        }
        return result;
    }

    /**
     * Lists the blocked cells in row-major order.
     * @return The blocked cells.
     */
    public List<CellCoordinate> blockedCells() {
        List<CellCoordinate> result = new ArrayList<>();
        for (int i = 0; i < states.length; i++) {
            if (states[i] == CellState.BLOCKED) {
                result.add(properties.flatIndexToCoordinate(i));
            }
        }
        return result;
    }

    /**
     * Counts the cells that hold a tile.
     * @return The number of tiles on the grid.
     */
    public int occupiedCount() {
        int count = 0;
        for (CellState state : states) {
            if (state == CellState.OCCUPIED) {
                count++;
            }
        }
        return count;
    }

    /**
     * Renders the grid as text, one line per row. Blocked cells are {@code #}, empty cells
     * {@code .}, tiles the last character of their type id.
     * @return The text rendering.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                int index = row * size + col;
                switch (states[index]) {
                    case BLOCKED -> sb.append('#');
                    case EMPTY -> sb.append('.');
                    case OCCUPIED -> {
                        String id = tiles[index].typeId();
                        sb.append(id.isEmpty() ? '?' : id.charAt(id.length() - 1));
                    }
                }
            }
            if (row < size - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
