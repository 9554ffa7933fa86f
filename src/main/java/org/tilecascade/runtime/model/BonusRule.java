package org.tilecascade.runtime.model;

import java.util.Objects;

/**
 * A one-shot reward that fires the first time its metric reaches the threshold in a round.
 *
 * @param id Identifier, used to remember that the rule has fired.
 * @param name Display name.
 * @param description Display description.
 * @param triggerType The metric compared.
 * @param threshold Minimum metric value, at least 1.
 * @param reward The reward; never a no-op.
 */
public record BonusRule(String id, String name, String description, BonusTriggerType triggerType,
                        int threshold, BonusReward reward) {

    public BonusRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(triggerType, "triggerType");
        Objects.requireNonNull(reward, "reward");
        if (reward.isNoOp()) {
            throw new IllegalArgumentException("Bonus rule '" + id + "' has no effect");
        }
    }
}
