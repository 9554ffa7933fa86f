package org.tilecascade.variant;

import org.tilecascade.runtime.Config;
import org.tilecascade.runtime.RoundSettings;

/**
 * Explicit round parameters from the host (a level definition or the command line), combined
 * with a normalized variant into {@link RoundSettings}.
 * <p>
 * A value that is not a positive finite number means "derive it". The time scale is the global
 * tempo: a faster tempo leaves fewer moves.
 *
 * @param gridSize Requested grid size, or 0.
 * @param targetMatches Requested match target, or 0.
 * @param moves Requested move budget, or 0.
 * @param timeScale Global tempo, clamped to [0.5,2]; 1 is neutral.
 */
public record RoundParameters(double gridSize, double targetMatches, double moves, double timeScale) {

    static final int MIN_TARGET_MATCHES = 6;
    static final int MIN_DEFAULT_TARGET_MATCHES = 14;
    static final int MIN_MOVES = 6;
    static final int MAX_TARGET_MATCHES = 9999;
    static final int MIN_DEFAULT_MOVES = 16;
    static final int MAX_MOVES = 999;
    static final double MIN_TIME_SCALE = 0.5;
    static final double MAX_TIME_SCALE = 2;

    /**
     * Parameters that derive everything from the variant.
     * @return Parameters with no explicit values and neutral tempo.
     */
    public static RoundParameters derived() {
        return new RoundParameters(0, 0, 0, 1);
    }

    /**
     * Reads the parameters from a {@code tilecascade.round} config block with the keys
     * {@code grid-size}, {@code target-matches}, {@code moves} and {@code time-scale}.
     *
     * @param config The config block.
     * @return The parameters.
     */
    public static RoundParameters fromConfig(com.typesafe.config.Config config) {
        return new RoundParameters(
                config.hasPath("grid-size") ? config.getDouble("grid-size") : 0,
                config.hasPath("target-matches") ? config.getDouble("target-matches") : 0,
                config.hasPath("moves") ? config.getDouble("moves") : 0,
                config.hasPath("time-scale") ? config.getDouble("time-scale") : 1);
    }

    /**
     * Returns a copy with explicit values replaced where an override is given.
     */
    public RoundParameters withOverrides(Integer gridSizeOverride, Integer targetOverride, Integer movesOverride) {
        return new RoundParameters(
                gridSizeOverride != null ? gridSizeOverride : gridSize,
                targetOverride != null ? targetOverride : targetMatches,
                movesOverride != null ? movesOverride : moves,
                timeScale);
    }

    /**
     * Derives the settings of a round.
     *
     * @param variant The normalized variant.
     * @return The round settings.
     */
    public RoundSettings toSettings(NormalizedVariant variant) {
        VariantMeta meta = variant.meta();
        int size = resolveGridSize(meta);
        return new RoundSettings(size, resolveTargetMatches(meta, size), resolveMoveBudget(meta, size),
                variant.catalog(), variant.bonusRules(), variant.boardModifier());
    }

    int resolveGridSize(VariantMeta meta) {
        if (isSet(gridSize)) {
            return (int) Math.round(clamp(gridSize, Config.MIN_GRID_SIZE, Config.MAX_GRID_SIZE));
        }
        if (meta.baseGridSize() != null) {
            return (int) clamp(meta.baseGridSize(), Config.MIN_GRID_SIZE, Config.MAX_GRID_SIZE);
        }
        return Config.DEFAULT_GRID_SIZE;
    }

    int resolveTargetMatches(VariantMeta meta, int size) {
        double target = isSet(targetMatches) ? targetMatches : Math.max(MIN_DEFAULT_TARGET_MATCHES, size * 2);
        if (meta.targetMatchesModifier() != null) {
            target = target * meta.targetMatchesModifier();
        }
        return (int) Math.round(clamp(target, MIN_TARGET_MATCHES, MAX_TARGET_MATCHES));
    }

    int resolveMoveBudget(VariantMeta meta, int size) {
        double budget = isSet(moves) ? moves : Math.max(MIN_DEFAULT_MOVES, size * 2 + 2);
        if (meta.moveBudgetModifier() != null) {
            budget = Math.round(budget * meta.moveBudgetModifier());
        }
        double scale = Double.isFinite(timeScale) && timeScale > 0 ? timeScale : 1;
        scale = Math.min(MAX_TIME_SCALE, Math.max(MIN_TIME_SCALE, scale));
        return (int) Math.round(clamp(budget / scale, MIN_MOVES, MAX_MOVES));
    }

    private static boolean isSet(double value) {
        return Double.isFinite(value) && value > 0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.min(max, Math.max(min, value));
    }
}
