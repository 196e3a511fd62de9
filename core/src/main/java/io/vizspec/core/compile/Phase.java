package io.vizspec.core.compile;

/**
 * Compilation phases of a {@link Model}, in their only legal order. A model enters each phase
 * exactly once; assembly is allowed only once the model reached {@link #LAYOUT_SIZE}.
 */
public enum Phase {
    CONSTRUCTED,
    DATA,
    SELECTIONS,
    MARK_GROUP,
    AXES_AND_HEADERS,
    LAYOUT_SIZE;

    /** The phase that must follow this one, or {@code null} after the last. */
    public Phase next() {
        Phase[] phases = values();
        return ordinal() + 1 < phases.length ? phases[ordinal() + 1] : null;
    }
}
