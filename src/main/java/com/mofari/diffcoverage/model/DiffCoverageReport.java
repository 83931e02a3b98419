package com.mofari.diffcoverage.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one coverage run over a changeset. Built once by the aggregator and never modified.
 */
public class DiffCoverageReport {
    private final long coveragePercent;
    private final int totalChangedLines;
    private final int relevantLines;
    private final int coveredLines;
    private final int threshold;
    private final boolean passed;
    private final List<FileCoverageSummary> perFileBreakdown;
    private final List<String> skippedFiles;
    private final List<Annotation> annotations;
    private final String title;
    private final String summary;
    private final String details;

    public DiffCoverageReport(long coveragePercent, int totalChangedLines, int relevantLines, int coveredLines,
                              int threshold, boolean passed, List<FileCoverageSummary> perFileBreakdown,
                              List<String> skippedFiles, List<Annotation> annotations,
                              String title, String summary, String details) {
        this.coveragePercent = coveragePercent;
        this.totalChangedLines = totalChangedLines;
        this.relevantLines = relevantLines;
        this.coveredLines = coveredLines;
        this.threshold = threshold;
        this.passed = passed;
        this.perFileBreakdown = Collections.unmodifiableList(new ArrayList<>(perFileBreakdown));
        this.skippedFiles = Collections.unmodifiableList(new ArrayList<>(skippedFiles));
        this.annotations = Collections.unmodifiableList(new ArrayList<>(annotations));
        this.title = title;
        this.summary = summary;
        this.details = details;
    }

    public long getCoveragePercent() {
        return coveragePercent;
    }

    public int getTotalChangedLines() {
        return totalChangedLines;
    }

    public int getRelevantLines() {
        return relevantLines;
    }

    public int getCoveredLines() {
        return coveredLines;
    }

    public int getThreshold() {
        return threshold;
    }

    public boolean isPassed() {
        return passed;
    }

    public List<FileCoverageSummary> getPerFileBreakdown() {
        return perFileBreakdown;
    }

    public List<String> getSkippedFiles() {
        return skippedFiles;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    /** Short line shown next to the check. */
    public String getTitle() {
        return title;
    }

    public String getSummary() {
        return summary;
    }

    /** Markdown table with one row per changed file. */
    public String getDetails() {
        return details;
    }
}
