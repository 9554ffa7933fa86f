package org.tilecascade.variant;

/**
 * Descriptive and round-level settings of a variant.
 *
 * @param codename Variant name.
 * @param flavorText Instruction text shown to the player.
 * @param baseGridSize Preferred grid size within [4,9], or null.
 * @param targetMatchesModifier Factor within [0.5,2] applied to the match target, or null.
 * @param moveBudgetModifier Factor within [0.5,2] applied to the move budget, or null.
 */
public record VariantMeta(String codename, String flavorText, Integer baseGridSize,
                          Double targetMatchesModifier, Double moveBudgetModifier) {

    public static final String DEFAULT_CODENAME = "Crystal Charge";
    public static final String DEFAULT_FLAVOR_TEXT = "Build chains and charge the artifact!";

    public static VariantMeta defaults() {
        return new VariantMeta(DEFAULT_CODENAME, DEFAULT_FLAVOR_TEXT, null, null, null);
    }
}
