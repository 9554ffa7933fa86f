package org.tilecascade.runtime;

/**
 * The terminal result of a round.
 *
 * @param success true if the match target was reached.
 * @param finalScore The score including the victory or consolation bonus.
 * @param matches Runs matched in the round.
 * @param targetMatches Runs required to win.
 * @param movesLeft Moves remaining when the round ended.
 */
public record RoundOutcome(boolean success, long finalScore, int matches, int targetMatches, int movesLeft) {
}
