package org.tilecascade.variant;

import org.tilecascade.runtime.model.BlockCatalog;
import org.tilecascade.runtime.model.BoardModifier;
import org.tilecascade.runtime.model.BonusRule;

import java.util.List;

/**
 * A variant after sanitizing: every value is within the engine's bounds.
 *
 * @param meta Name, flavour text and round modifiers.
 * @param catalog Block types, never empty.
 * @param bonusRules Bonus rules, each with a known trigger and an effective reward.
 * @param boardModifier Blocked cells.
 * @param comboDecaySeconds How long the presentation layer keeps a combo alive, within [0.8,6].
 * @param fallbackCatalog true if the built-in catalog replaced the supplied block types.
 */
public record NormalizedVariant(VariantMeta meta, BlockCatalog catalog, List<BonusRule> bonusRules,
                                BoardModifier boardModifier, double comboDecaySeconds, boolean fallbackCatalog) {

    public NormalizedVariant {
        bonusRules = List.copyOf(bonusRules);
    }
}
