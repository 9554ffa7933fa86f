package org.tilecascade.runtime;

import org.tilecascade.runtime.model.MatchMask;

/**
 * Outcome of a match scan.
 *
 * @param mask Cells that belong to at least one run.
 * @param groups Number of runs found; a cell in a horizontal and a vertical run counts toward both.
 */
public record ScanResult(MatchMask mask, int groups) {

    public boolean hasMatches() {
        return groups > 0;
    }
}
