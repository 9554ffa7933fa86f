package org.tilecascade.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * What a bonus rule grants when it fires. Zero means "no effect" for the numeric parts and null
 * means no spawn.
 *
 * @param extraMoves Moves added (may be negative).
 * @param score Score added (may be negative).
 * @param spawnSpecialBlockId Block type id of a tile to spawn, or null.
 */
public record BonusReward(int extraMoves, int score, String spawnSpecialBlockId) {

    /**
     * Checks whether applying this reward would change nothing.
     * @return true if all three parts are empty.
     */
    public boolean isNoOp() {
        return extraMoves == 0 && score == 0 && (spawnSpecialBlockId == null || spawnSpecialBlockId.isBlank());
    }

    /**
     * Formats the reward for display, e.g. {@code +2 moves, +100 points, block bomb}.
     * @return The summary text.
     */
    public String summary() {
        List<String> parts = new ArrayList<>();
        if (extraMoves != 0) {
            parts.add(signed(extraMoves) + (Math.abs(extraMoves) == 1 ? " move" : " moves"));
        }
        if (score != 0) {
            parts.add(signed(score) + " points");
        }
        if (spawnSpecialBlockId != null && !spawnSpecialBlockId.isBlank()) {
            parts.add("block " + spawnSpecialBlockId);
        }
        return String.join(", ", parts);
    }

    private static String signed(int value) {
        return value > 0 ? "+" + value : Integer.toString(value);
    }
}
