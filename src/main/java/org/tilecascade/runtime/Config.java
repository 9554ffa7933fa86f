package org.tilecascade.runtime;

/**
 * Provides the fixed rules of the match-three engine.
 * This final class contains static constants for grid bounds and scoring. Round-level settings
 * that vary per variant are derived in {@code org.tilecascade.variant.RoundParameters}.
 * It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The smallest supported grid size.
     */
    public static final int MIN_GRID_SIZE = 4;

    /**
     * The largest supported grid size.
     */
    public static final int MAX_GRID_SIZE = 9;

    /**
     * The grid size used when neither the round nor the variant specifies one.
     */
    public static final int DEFAULT_GRID_SIZE = 6;

    /**
     * The minimum length of a run of equal colors that counts as a match.
     */
    public static final int MIN_RUN_LENGTH = 3;

    /**
     * Points per destroyed tile before the cascade bonus.
     */
    public static final int POINTS_PER_TILE = 15;

    /**
     * Growth of the cascade bonus per cascade after the first.
     */
    public static final double CASCADE_BONUS_STEP = 0.25;

    /**
     * Growth of the combo multiplier per cascade after the first.
     */
    public static final double COMBO_STEP = 0.5;

    /**
     * Lower bound of the extra score of a scoreBoost tile.
     */
    public static final int SCORE_BOOST_MIN = 6;

    /**
     * Extra score of a scoreBoost tile whose type carries no bonus score.
     */
    public static final int SCORE_BOOST_DEFAULT = 12;

    /**
     * Score awarded when the match target is reached.
     */
    public static final int VICTORY_BONUS = 200;

    /**
     * Score awarded on a loss if the last move produced a match.
     */
    public static final int CONSOLATION_BONUS = 50;

    /**
     * How often a freshly generated grid is regenerated before its runs are repaired in place.
     */
    public static final int GENERATION_ATTEMPTS = 8;

    /**
     * Upper bound of cascades in a single resolve. Exceeding it means the tile source keeps
     * producing runs, which a catalog with at least three colors and random draws does not do.
     */
    public static final int MAX_CASCADES_PER_RESOLVE = 256;
}
