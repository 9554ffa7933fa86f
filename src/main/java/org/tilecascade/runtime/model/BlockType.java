package org.tilecascade.runtime.model;

import java.util.Objects;

/**
 * A kind of tile in the round's catalog.
 *
 * @param id Stable identifier, unique within the catalog.
 * @param name Display name.
 * @param color RGB color as 0xRRGGBB. Matching compares colors, not ids.
 * @param spawnWeight Relative weight for random draws, always positive.
 * @param power Special power of tiles of this type.
 * @param bonusScore Extra score when a tile of this type is destroyed, never negative.
 */
public record BlockType(String id, String name, int color, double spawnWeight, TilePower power, int bonusScore) {

    public BlockType {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(power, "power");
        if (!(spawnWeight > 0)) {
            throw new IllegalArgumentException("Spawn weight must be positive: " + spawnWeight);
        }
        if (bonusScore < 0) {
            throw new IllegalArgumentException("Bonus score must not be negative: " + bonusScore);
        }
        color &= 0xFFFFFF;
    }

    /**
     * Convenience factory for a plain block type without power or bonus.
     * @param id The id.
     * @param color The RGB color.
     * @return A block type with weight 1.
     */
    public static BlockType plain(String id, int color) {
        return new BlockType(id, id, color, 1.0, TilePower.NONE, 0);
    }

    /**
     * Formats the color the way variant data spells it.
     * @return The color as {@code #rrggbb}.
     */
    public String colorHex() {
        return String.format("#%06x", color);
    }
}
