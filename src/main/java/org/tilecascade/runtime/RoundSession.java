package org.tilecascade.runtime;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable counters of one round. A session is created at round start, passed explicitly into the
 * resolver, the bonus engine and the objective tracker, and dropped when the round ends.
 */
public class RoundSession {
    private final int targetMatches;
    private int matches;
    private int movesLeft;
    private double comboMultiplier = 1.0;
    private long score;
    private final Set<String> triggeredBonuses = new LinkedHashSet<>();
    private RoundOutcome outcome;

    /**
     * Creates a session.
     *
     * @param targetMatches Runs required to win.
     * @param moveBudget Moves available at round start.
     */
    public RoundSession(int targetMatches, int moveBudget) {
        this.targetMatches = targetMatches;
        this.movesLeft = Math.max(0, moveBudget);
    }

    public int getTargetMatches() {
        return targetMatches;
    }

    public int getMatches() {
        return matches;
    }

    public void addMatches(int groups) {
        this.matches += groups;
    }

    public int getMovesLeft() {
        return movesLeft;
    }

    /**
     * Adds (or, for negative values, removes) moves, never going below zero.
     * @param delta The change.
     * @return The moves left afterwards.
     */
    public int adjustMoves(int delta) {
        movesLeft = Math.max(0, movesLeft + delta);
        return movesLeft;
    }

    public double getComboMultiplier() {
        return comboMultiplier;
    }

    public void setComboMultiplier(double comboMultiplier) {
        this.comboMultiplier = comboMultiplier;
    }

    public long getScore() {
        return score;
    }

    public void addScore(long amount) {
        this.score += amount;
    }

    /**
     * Records a bonus rule as fired.
     * @param ruleId The rule id.
     * @return true if the rule had not fired before.
     */
    public boolean markTriggered(String ruleId) {
        return triggeredBonuses.add(ruleId);
    }

    public boolean isTriggered(String ruleId) {
        return triggeredBonuses.contains(ruleId);
    }

    public Set<String> getTriggeredBonuses() {
        return Collections.unmodifiableSet(triggeredBonuses);
    }

    public boolean isEnded() {
        return outcome != null;
    }

    public RoundOutcome getOutcome() {
        return outcome;
    }

    void end(RoundOutcome outcome) {
        if (this.outcome != null) {
            throw new IllegalStateException("Round already ended: " + this.outcome);
        }
        this.outcome = outcome;
    }
}
