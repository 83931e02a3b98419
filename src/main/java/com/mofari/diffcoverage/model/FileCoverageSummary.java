package com.mofari.diffcoverage.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One row of the per-file breakdown. Missed lines and coverage are null for skipped files.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FileCoverageSummary {
    private final String path;
    private final boolean skipped;
    private final String skipReason;
    private final int changedLines;
    private final Integer missedLines;
    private final Double coveragePercent;

    public FileCoverageSummary(String path, boolean skipped, String skipReason, int changedLines,
                               Integer missedLines, Double coveragePercent) {
        this.path = path;
        this.skipped = skipped;
        this.skipReason = skipReason;
        this.changedLines = changedLines;
        this.missedLines = missedLines;
        this.coveragePercent = coveragePercent;
    }

    public static FileCoverageSummary of(FileCoverage file) {
        if (file.isSkipped()) {
            return new FileCoverageSummary(file.getPath(), true, file.getStatus().getSkipReason(),
                    file.getChangedLinesCount(), null, null);
        }
        return new FileCoverageSummary(file.getPath(), false, null, file.getChangedLinesCount(),
                file.getRelevantMissedLinesCount(), file.getCoveragePercent());
    }

    public String getPath() {
        return path;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public String getSkipReason() {
        return skipReason;
    }

    public int getChangedLines() {
        return changedLines;
    }

    public Integer getMissedLines() {
        return missedLines;
    }

    public Double getCoveragePercent() {
        return coveragePercent;
    }
}
