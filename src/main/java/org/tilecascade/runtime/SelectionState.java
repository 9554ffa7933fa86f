package org.tilecascade.runtime;

/**
 * States of the input state machine of a {@link Round}.
 */
public enum SelectionState {
    IDLE,
    FIRST_SELECTED,
    /** A swap is being resolved; selections are ignored. */
    RESOLVING
}
