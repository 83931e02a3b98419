package com.mofari.diffcoverage.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-line execution counts of one source file as reported by the test suite.
 * Index 0 holds line 1. A null entry marks a line that is not executable.
 */
public class ExecutionCounts {
    private final List<Integer> counts;

    public ExecutionCounts(List<Integer> counts) {
        List<Integer> copy = new ArrayList<>(counts.size());
        for (int i = 0; i < counts.size(); i++) {
            Integer count = counts.get(i);
            if (count != null && count < 0) {
                throw new IllegalArgumentException("Negative execution count " + count + " at line " + (i + 1));
            }
            copy.add(count);
        }
        this.counts = Collections.unmodifiableList(copy);
    }

    public static ExecutionCounts of(Integer... counts) {
        List<Integer> list = new ArrayList<>(counts.length);
        Collections.addAll(list, counts);
        return new ExecutionCounts(list);
    }

    public int getLineCount() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Count for a 1-indexed line, or null if the line is not executable or past the end of the data.
     */
    public Integer countAt(int lineNumber) {
        if (lineNumber < 1 || lineNumber > counts.size()) {
            return null;
        }
        return counts.get(lineNumber - 1);
    }

    public List<Integer> asList() {
        return counts;
    }
}
