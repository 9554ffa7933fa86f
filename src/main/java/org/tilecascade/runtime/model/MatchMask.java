package org.tilecascade.runtime.model;

import java.util.Arrays;

/**
 * A boolean mark per grid cell, indexed like the grid arena.
 */
public final class MatchMask {
    private final int size;
    private final boolean[] marks;

    public MatchMask(int size) {
        this.size = size;
        this.marks = new boolean[size * size];
    }

    private MatchMask(int size, boolean[] marks) {
        this.size = size;
        this.marks = marks;
    }

    public int getSize() {
        return size;
    }

    public boolean isMarked(int row, int col) {
        return marks[row * size + col];
    }

    public void mark(int row, int col) {
        marks[row * size + col] = true;
    }

    /**
     * Counts the marked cells.
     * @return The number of marked cells.
     */
    public int count() {
        int count = 0;
        for (boolean mark : marks) {
            if (mark) {
                count++;
            }
        }
        return count;
    }

    public MatchMask copy() {
        return new MatchMask(size, marks.clone());
    }

    /**
     * Converts the mask to a row-major two-dimensional array.
     * @return A new {@code boolean[size][size]}.
     */
    public boolean[][] toArray() {
        boolean[][] result = new boolean[size][size];
        for (int row = 0; row < size; row++) {
            System.arraycopy(marks, row * size, result[row], 0, size);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchMask other)) return false;
        return size == other.size && Arrays.equals(marks, other.marks);
    }

    @Override
    public int hashCode() {
        return 31 * size + Arrays.hashCode(marks);
    }
}
