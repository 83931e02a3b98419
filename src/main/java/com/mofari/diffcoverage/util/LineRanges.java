package com.mofari.diffcoverage.util;

import com.mofari.diffcoverage.model.LineMarker;
import com.mofari.diffcoverage.model.LineRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Compacts scattered line numbers into contiguous ranges for display.
 */
public final class LineRanges {

    private enum ScanState {
        SEEKING_START,
        SEEKING_END
    }

    private LineRanges() {
    }

    /**
     * Turns ascending line numbers such as {@code [1, 2, 3, 5, 6]} into the ranges {@code 1-3, 5-6}.
     */
    public static List<LineRange> compactSequence(List<Integer> lineNumbers) {
        List<LineRange> ranges = new ArrayList<>();
        if (lineNumbers.isEmpty()) {
            return ranges;
        }

        int start = lineNumbers.get(0);
        int end = start;
        for (int i = 1; i < lineNumbers.size(); i++) {
            int current = lineNumbers.get(i);
            if (current == end + 1) {
                end = current;
            } else {
                ranges.add(new LineRange(start, end));
                start = current;
                end = current;
            }
        }
        ranges.add(new LineRange(start, end));
        return ranges;
    }

    /**
     * Finds the minimal spans covering every {@link LineMarker#ZERO} entry. A span may run across
     * {@link LineMarker#IGNORED} lines but stops before a {@link LineMarker#POSITIVE} or
     * {@link LineMarker#NOT_CHANGED} line, and always starts and ends on a {@code ZERO} line.
     * Index 0 of {@code markers} is reported as line 1.
     */
    public static List<LineRange> compactMarkedSpans(LineMarker[] markers) {
        List<LineRange> ranges = new ArrayList<>();
        ScanState state = ScanState.SEEKING_START;
        int start = 0;
        int index = 0;

        while (index < markers.length) {
            switch (state) {
                case SEEKING_START:
                    if (markers[index] == LineMarker.ZERO) {
                        start = index;
                        state = ScanState.SEEKING_END;
                    }
                    index++;
                    break;
                case SEEKING_END:
                    int boundary = index;
                    while (boundary < markers.length && !isSpanBoundary(markers[boundary])) {
                        boundary++;
                    }
                    // never passes start, which is ZERO
                    int end = boundary - 1;
                    while (markers[end] != LineMarker.ZERO) {
                        end--;
                    }
                    ranges.add(new LineRange(start + 1, end + 1));
                    // the boundary itself is examined again as a potential start
                    index = boundary;
                    state = ScanState.SEEKING_START;
                    break;
                default:
                    throw new IllegalStateException("Unknown scan state " + state);
            }
        }

        // start was the last entry
        if (state == ScanState.SEEKING_END) {
            ranges.add(new LineRange(start + 1, start + 1));
        }
        return ranges;
    }

    private static boolean isSpanBoundary(LineMarker marker) {
        return marker == LineMarker.POSITIVE || marker == LineMarker.NOT_CHANGED;
    }

    /**
     * Formats ranges as {@code "1-3, 5, 7-9"}.
     */
    public static String format(List<LineRange> ranges) {
        StringBuilder sb = new StringBuilder();
        for (LineRange range : ranges) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(range.getLabel());
        }
        return sb.toString();
    }
}
