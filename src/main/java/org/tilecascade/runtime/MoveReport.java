package org.tilecascade.runtime;

import org.tilecascade.runtime.model.Swap;

import java.util.List;

/**
 * Everything that happened because of one swap.
 *
 * @param swap The swapped cells.
 * @param cascade The resolve summary.
 * @param bonuses Bonus rules fired by this swap.
 * @param reverted true if the swap matched nothing and was undone.
 * @param movesLeft Moves left afterwards.
 * @param score Round score afterwards.
 * @param outcome The round outcome if this swap ended the round, else null.
 */
public record MoveReport(Swap swap, CascadeResult cascade, List<BonusActivation> bonuses, boolean reverted,
                         int movesLeft, long score, RoundOutcome outcome) {

    public MoveReport {
        bonuses = List.copyOf(bonuses);
    }

    public boolean endedRound() {
        return outcome != null;
    }
}
