package com.mofari.diffcoverage.util;

import com.mofari.diffcoverage.model.LineMarker;
import com.mofari.diffcoverage.model.LineRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.mofari.diffcoverage.model.LineMarker.IGNORED;
import static com.mofari.diffcoverage.model.LineMarker.NOT_CHANGED;
import static com.mofari.diffcoverage.model.LineMarker.POSITIVE;
import static com.mofari.diffcoverage.model.LineMarker.ZERO;
import static org.assertj.core.api.Assertions.assertThat;

class LineRangesTest {

    @Test
    void compactsConsecutiveNumbers() {
        List<LineRange> ranges = LineRanges.compactSequence(Arrays.asList(1, 2, 3, 4, 8, 10, 11, 12, 14, 15));

        assertThat(ranges).containsExactly(
                new LineRange(1, 4), new LineRange(8, 8), new LineRange(10, 12), new LineRange(14, 15));
        assertThat(LineRanges.format(ranges)).isEqualTo("1-4, 8, 10-12, 14-15");
    }

    @Test
    void compactSequenceOfNothingIsEmpty() {
        assertThat(LineRanges.compactSequence(Collections.emptyList())).isEmpty();
    }

    @Test
    void compactedSequencesAreDisjointAndCoverTheInput() {
        Random random = new Random(42);
        for (int round = 0; round < 200; round++) {
            List<Integer> input = new ArrayList<>();
            int line = 1 + random.nextInt(5);
            int size = 1 + random.nextInt(30);
            for (int i = 0; i < size; i++) {
                input.add(line);
                line += 1 + (random.nextInt(3) == 0 ? random.nextInt(4) : 0);
            }

            List<LineRange> ranges = LineRanges.compactSequence(input);

            List<Integer> covered = new ArrayList<>();
            for (int i = 0; i < ranges.size(); i++) {
                LineRange range = ranges.get(i);
                for (int n = range.getStart(); n <= range.getEnd(); n++) {
                    covered.add(n);
                }
                if (i > 0) {
                    assertThat(range.getStart() - ranges.get(i - 1).getEnd()).isGreaterThanOrEqualTo(2);
                }
            }
            assertThat(covered).isEqualTo(input);
        }
    }

    @Test
    void markedSpansOfNothingAreEmpty() {
        assertThat(LineRanges.compactMarkedSpans(new LineMarker[0])).isEmpty();
        assertThat(LineRanges.compactMarkedSpans(markers(NOT_CHANGED, IGNORED, NOT_CHANGED, IGNORED))).isEmpty();
    }

    @Test
    void spansRunAcrossIgnoredLines() {
        List<LineRange> ranges = LineRanges.compactMarkedSpans(
                markers(POSITIVE, POSITIVE, POSITIVE, IGNORED, ZERO, ZERO, IGNORED, ZERO, POSITIVE));

        assertThat(ranges).containsExactly(new LineRange(5, 8));
    }

    @Test
    void positiveLinesSplitSpans() {
        List<LineRange> ranges = LineRanges.compactMarkedSpans(
                markers(POSITIVE, ZERO, IGNORED, ZERO, POSITIVE, ZERO, IGNORED, ZERO, POSITIVE));

        assertThat(ranges).containsExactly(new LineRange(2, 4), new LineRange(6, 8));
    }

    @Test
    void spanMayStartOnFirstLine() {
        assertThat(LineRanges.compactMarkedSpans(markers(ZERO, IGNORED, ZERO, IGNORED, POSITIVE)))
                .containsExactly(new LineRange(1, 3));
    }

    @Test
    void trailingIgnoredLinesAreTrimmed() {
        assertThat(LineRanges.compactMarkedSpans(markers(ZERO, IGNORED, ZERO, IGNORED)))
                .containsExactly(new LineRange(1, 3));
    }

    @Test
    void spanMayRunToEndOfFile() {
        assertThat(LineRanges.compactMarkedSpans(markers(POSITIVE, ZERO, IGNORED, ZERO)))
                .containsExactly(new LineRange(2, 4));
    }

    @Test
    void unexecutedLastLineClosesAtLastLine() {
        assertThat(LineRanges.compactMarkedSpans(markers(POSITIVE, ZERO)))
                .containsExactly(new LineRange(2, 2));
    }

    @Test
    void unchangedLinesSplitSpans() {
        List<LineRange> ranges = LineRanges.compactMarkedSpans(
                markers(ZERO, IGNORED, ZERO, IGNORED, NOT_CHANGED, NOT_CHANGED, ZERO, IGNORED, POSITIVE));

        assertThat(ranges).containsExactly(new LineRange(1, 3), new LineRange(7, 7));
    }

    @Test
    void markedSpansStartAndEndOnUnexecutedLinesAndCoverEachOnce() {
        Random random = new Random(7);
        LineMarker[] values = LineMarker.values();
        for (int round = 0; round < 500; round++) {
            LineMarker[] markers = new LineMarker[random.nextInt(40)];
            for (int i = 0; i < markers.length; i++) {
                markers[i] = values[random.nextInt(values.length)];
            }

            List<LineRange> ranges = LineRanges.compactMarkedSpans(markers);

            int[] hits = new int[markers.length];
            int previousEnd = 0;
            for (LineRange range : ranges) {
                assertThat(range.getStart()).isGreaterThan(previousEnd);
                assertThat(markers[range.getStart() - 1]).isEqualTo(ZERO);
                assertThat(markers[range.getEnd() - 1]).isEqualTo(ZERO);
                for (int line = range.getStart(); line <= range.getEnd(); line++) {
                    assertThat(markers[line - 1]).isIn(ZERO, IGNORED);
                    hits[line - 1]++;
                }
                previousEnd = range.getEnd();
            }
            for (int i = 0; i < markers.length; i++) {
                if (markers[i] == ZERO) {
                    assertThat(hits[i]).as("hits of line %d in %s", i + 1, Arrays.toString(markers)).isEqualTo(1);
                }
            }
        }
    }

    private static LineMarker[] markers(LineMarker... markers) {
        return markers;
    }
}
