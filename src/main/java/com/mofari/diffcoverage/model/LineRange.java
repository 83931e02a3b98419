package com.mofari.diffcoverage.model;

import java.util.Objects;

/**
 * An inclusive, 1-indexed range of lines, e.g. {@code 4-7} or {@code 12}.
 */
public class LineRange {
    private final int start;
    private final int end;

    public LineRange(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean isSingleLine() {
        return start == end;
    }

    public String getLabel() {
        return isSingleLine() ? String.valueOf(start) : start + "-" + end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LineRange)) {
            return false;
        }
        LineRange other = (LineRange) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
