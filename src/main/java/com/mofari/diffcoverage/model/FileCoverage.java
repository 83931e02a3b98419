package com.mofari.diffcoverage.model;

import com.mofari.diffcoverage.util.LineRanges;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Coverage of the changed lines of one file. All line sets are derived from the execution counts
 * and the changed lines on request; nothing here is mutable.
 */
public class FileCoverage {
    static final String WHOLE_FILE_MESSAGE = "File has no coverage";

    private final String path;
    private final FileStatus status;
    private final List<Integer> changedLines;
    private final Set<Integer> changedLineSet;
    private final ExecutionCounts executionCounts;

    public FileCoverage(String path, FileStatus status, List<Integer> changedLines, ExecutionCounts executionCounts) {
        this.path = path;
        this.status = status;
        this.changedLineSet = Collections.unmodifiableSet(new TreeSet<>(changedLines));
        this.changedLines = Collections.unmodifiableList(new ArrayList<>(changedLineSet));
        this.executionCounts = executionCounts != null ? executionCounts : new ExecutionCounts(Collections.emptyList());
    }

    /**
     * Combines a changed file with its coverage data; {@code executionCounts} is null when the
     * suite does not track the file.
     */
    public static FileCoverage from(ChangedFile changedFile, ExecutionCounts executionCounts) {
        FileStatus status;
        if (changedFile.isPureRename()) {
            status = FileStatus.RENAMED;
        } else if (executionCounts == null || executionCounts.isEmpty()) {
            status = FileStatus.NOT_TRACKED;
        } else {
            status = FileStatus.ANALYZED;
        }
        return new FileCoverage(changedFile.getPath(), status, changedFile.resolveChangedLines(), executionCounts);
    }

    public String getPath() {
        return path;
    }

    public FileStatus getStatus() {
        return status;
    }

    public boolean isSkipped() {
        return status.isSkipped();
    }

    public boolean isPartOfTestSuite() {
        return !executionCounts.isEmpty();
    }

    public int getLineCount() {
        return executionCounts.getLineCount();
    }

    public List<Integer> getChangedLines() {
        return changedLines;
    }

    public int getChangedLinesCount() {
        return changedLines.size();
    }

    public List<Integer> getExecutableLines() {
        List<Integer> lines = new ArrayList<>();
        for (int line = 1; line <= getLineCount(); line++) {
            if (executionCounts.countAt(line) != null) {
                lines.add(line);
            }
        }
        return lines;
    }

    public List<Integer> getExecutedLines() {
        List<Integer> lines = new ArrayList<>();
        for (int line = 1; line <= getLineCount(); line++) {
            Integer count = executionCounts.countAt(line);
            if (count != null && count > 0) {
                lines.add(line);
            }
        }
        return lines;
    }

    public List<Integer> getMissedLines() {
        List<Integer> lines = new ArrayList<>();
        for (int line = 1; line <= getLineCount(); line++) {
            Integer count = executionCounts.countAt(line);
            if (count != null && count == 0) {
                lines.add(line);
            }
        }
        return lines;
    }

    /**
     * Changed lines that are executable.
     */
    public List<Integer> getRelevantLines() {
        List<Integer> lines = new ArrayList<>();
        for (Integer line : changedLines) {
            if (executionCounts.countAt(line) != null) {
                lines.add(line);
            }
        }
        return lines;
    }

    public int getRelevantLinesCount() {
        return getRelevantLines().size();
    }

    /**
     * Changed lines that are executable and were never executed.
     */
    public List<Integer> getRelevantMissedLines() {
        List<Integer> lines = new ArrayList<>();
        for (Integer line : changedLines) {
            Integer count = executionCounts.countAt(line);
            if (count != null && count == 0) {
                lines.add(line);
            }
        }
        return lines;
    }

    public int getRelevantMissedLinesCount() {
        return getRelevantMissedLines().size();
    }

    public int getRelevantExecutedLinesCount() {
        int executed = 0;
        for (Integer line : changedLines) {
            Integer count = executionCounts.countAt(line);
            if (count != null && count > 0) {
                executed++;
            }
        }
        return executed;
    }

    /**
     * Percentage of relevant lines that were executed, 100 when no changed line is executable.
     */
    public double getCoveragePercent() {
        int relevant = getRelevantLinesCount();
        if (relevant == 0) {
            return 100.0;
        }
        return (double) getRelevantExecutedLinesCount() / relevant * 100.0;
    }

    /**
     * True when the suite loads this file but never executes a single line of it.
     */
    public boolean isWholeFileUnexecuted() {
        return isPartOfTestSuite() && getExecutedLines().isEmpty();
    }

    /**
     * One marker per line of the file; lines outside the changeset become {@link LineMarker#NOT_CHANGED}
     * whatever their real count is.
     */
    public LineMarker[] getChangedLineMarkers() {
        LineMarker[] markers = new LineMarker[getLineCount()];
        for (int index = 0; index < markers.length; index++) {
            int line = index + 1;
            markers[index] = changedLineSet.contains(line)
                    ? LineMarker.fromCount(executionCounts.countAt(line))
                    : LineMarker.NOT_CHANGED;
        }
        return markers;
    }

    public List<LineRange> getUncoveredRanges() {
        return LineRanges.compactMarkedSpans(getChangedLineMarkers());
    }

    /**
     * Spans start and end on unexecuted lines but may run across non-executable lines in between,
     * so a closing brace does not split one block into several annotations.
     */
    public List<Annotation> getAnnotations() {
        if (isSkipped() || getRelevantMissedLinesCount() == 0) {
            return Collections.emptyList();
        }

        if (isWholeFileUnexecuted()) {
            return Collections.singletonList(Annotation.warning(path, 1, getLineCount(), WHOLE_FILE_MESSAGE));
        }

        List<Annotation> annotations = new ArrayList<>();
        for (LineRange range : getUncoveredRanges()) {
            String message = range.isSingleLine()
                    ? "Line " + range.getLabel() + " has no coverage"
                    : "Lines " + range.getLabel() + " have no coverage";
            annotations.add(Annotation.warning(path, range.getStart(), range.getEnd(), message));
        }
        return annotations;
    }
}
