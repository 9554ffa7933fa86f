package org.tilecascade.runtime.model;

import java.util.Optional;

/**
 * The metric a bonus rule compares against its threshold.
 */
public enum BonusTriggerType {
    /** Cumulative number of runs matched in the round. */
    TOTAL_MATCHES("totalMatches"),
    /** Combo multiplier reached by the last resolve. */
    COMBO("combo"),
    /** Number of cascades in the last resolve. */
    CASCADE("cascade");

    private final String wireName;

    BonusTriggerType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name exactly.
     * @param name The name from variant data.
     * @return The trigger type, or empty if the name is unknown.
     */
    public static Optional<BonusTriggerType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (BonusTriggerType type : values()) {
            if (type.wireName.equals(name.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
