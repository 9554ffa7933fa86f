package org.tilecascade.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Tracks the move budget and the match target and decides when a round is won or lost.
 * Win and loss are terminal and exclude each other.
 */
public class ObjectiveTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectiveTracker.class);

    /**
     * Ends the round as won if the match target has been reached.
     *
     * @param session The round's counters.
     * @return The outcome if this call ended the round.
     */
    public Optional<RoundOutcome> checkVictory(RoundSession session) {
        if (session.isEnded() || session.getMatches() < session.getTargetMatches()) {
            return Optional.empty();
        }
        session.addScore(Config.VICTORY_BONUS);
        return Optional.of(end(session, true));
    }

    /**
     * Consumes one move and ends the round if no moves are left.
     *
     * @param session The round's counters.
     * @param moveMatched Whether the swap that used the move produced a match.
     * @return The outcome if this call ended the round.
     */
    public Optional<RoundOutcome> consumeMove(RoundSession session, boolean moveMatched) {
        session.adjustMoves(-1);
        if (session.isEnded() || session.getMovesLeft() > 0) {
            return Optional.empty();
        }
        if (session.getMatches() >= session.getTargetMatches()) {
            return checkVictory(session);
        }
        if (moveMatched) {
            session.addScore(Config.CONSOLATION_BONUS);
        }
        return Optional.of(end(session, false));
    }

    private RoundOutcome end(RoundSession session, boolean success) {
        RoundOutcome outcome = new RoundOutcome(success, session.getScore(), session.getMatches(),
                session.getTargetMatches(), session.getMovesLeft());
        session.end(outcome);
        LOG.info("Round {} with {}/{} matches, score {}", success ? "won" : "lost",
                outcome.matches(), outcome.targetMatches(), outcome.finalScore());
        return outcome;
    }
}
