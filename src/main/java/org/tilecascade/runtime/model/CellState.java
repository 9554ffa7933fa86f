package org.tilecascade.runtime.model;

/**
 * The tag of a grid cell.
 */
public enum CellState {
    /** Excluded from play for the whole round by the board modifier. */
    BLOCKED,
    /** Playable but currently without a tile (only observable mid-refill). */
    EMPTY,
    /** Holds a tile. */
    OCCUPIED
}
