package org.tilecascade.runtime.model;

import java.util.Locale;

/**
 * Special behavior of a tile when it is destroyed as part of a match.
 */
public enum TilePower {
    NONE("none"),
    /** Clears the 3x3 neighborhood. */
    BOMB("bomb"),
    /** Clears the whole row. */
    LINE_HORIZONTAL("lineHorizontal"),
    /** Clears the whole column. */
    LINE_VERTICAL("lineVertical"),
    /** Clears every tile of the same block type. */
    COLOR_CLEAR("colorClear"),
    /** No expansion, extra score on destruction. */
    SCORE_BOOST("scoreBoost");

    private final String wireName;

    TilePower(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Gets the name used for this power in variant JSON.
     * @return The wire name.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name. Matching ignores case; unknown or null names map to {@link #NONE}.
     * @param name The name as found in variant data.
     * @return The matching power, or NONE.
     */
    public static TilePower fromWireName(String name) {
        if (name == null) {
            return NONE;
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (TilePower power : values()) {
            if (power.wireName.toLowerCase(Locale.ROOT).equals(key)) {
                return power;
            }
        }
        return NONE;
    }
}
