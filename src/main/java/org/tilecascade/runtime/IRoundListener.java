package org.tilecascade.runtime;

import org.tilecascade.runtime.model.CellCoordinate;
import org.tilecascade.runtime.model.Swap;

/**
 * Receives the state changes of a round, typically to update a HUD or animate the board.
 * All methods default to doing nothing.
 */
public interface IRoundListener {

    /** The score changed by {@code amount}. */
    default void scoreDelta(long amount) {}

    /** The remaining move budget is now {@code movesLeft}. */
    default void movesLeftChanged(int movesLeft) {}

    /** The number of matched runs changed. */
    default void matchProgress(int matches, int targetMatches) {}

    /** A bonus rule fired. */
    default void bonusTriggered(String ruleId, String rewardSummary) {}

    /** The round is over; no further events follow. */
    default void roundEnded(RoundOutcome outcome) {}

    /**
     * A swap matched nothing and was undone. The core has already restored the grid; a
     * presentation layer may animate the revert after a short delay.
     */
    default void swapReverted(Swap swap) {}

    /** The highlighted cell changed; {@code null} means nothing is selected. */
    default void selectionChanged(CellCoordinate selected) {}
}
