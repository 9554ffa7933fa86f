package org.tilecascade.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * Board layout for a round: the cells excluded from play.
 *
 * @param presetName Name of the layout.
 * @param description Optional description, may be null.
 * @param blockedCells Blocked cells as supplied; cells outside the round's grid are ignored by the grid.
 */
public record BoardModifier(String presetName, String description, List<CellCoordinate> blockedCells) {

    public static final String DEFAULT_PRESET_NAME = "Custom Layout";

    public BoardModifier {
        Objects.requireNonNull(presetName, "presetName");
        blockedCells = List.copyOf(blockedCells);
    }

    /**
     * A layout without blocked cells.
     * @return The empty modifier.
     */
    public static BoardModifier none() {
        return new BoardModifier(DEFAULT_PRESET_NAME, null, List.of());
    }
}
