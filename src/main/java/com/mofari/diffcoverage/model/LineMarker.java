package com.mofari.diffcoverage.model;

/**
 * Per-line state used when compacting uncovered lines into spans.
 */
public enum LineMarker {
    /** The line exists but is outside the changeset. */
    NOT_CHANGED,
    /** Not executable: comment, blank line, declaration. */
    IGNORED,
    /** Executable, changed and never executed. */
    ZERO,
    /** Executable, changed and executed at least once. */
    POSITIVE;

    public static LineMarker fromCount(Integer count) {
        if (count == null) {
            return IGNORED;
        }
        return count > 0 ? POSITIVE : ZERO;
    }
}
