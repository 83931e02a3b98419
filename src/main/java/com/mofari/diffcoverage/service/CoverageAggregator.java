package com.mofari.diffcoverage.service;

import com.mofari.diffcoverage.model.Annotation;
import com.mofari.diffcoverage.model.DiffCoverageReport;
import com.mofari.diffcoverage.model.FileCoverage;
import com.mofari.diffcoverage.model.FileCoverageSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.mofari.diffcoverage.util.PercentFormatter.formatPercent;

/**
 * Combines per-file results of a changeset into totals, a verdict and the check-run texts.
 */
@Service
public class CoverageAggregator {

    private static final Logger logger = LoggerFactory.getLogger(CoverageAggregator.class);

    /**
     * Skipped files count towards nothing but the skipped list and the table. Coverage is weighted by
     * line (covered / relevant over all analyzed files) and rounded to a whole percent. A changeset
     * without a single executable changed line passes with 100%.
     */
    public DiffCoverageReport aggregate(List<FileCoverage> files, int threshold) {
        List<FileCoverage> relevantFiles = new ArrayList<>();
        List<String> skippedFiles = new ArrayList<>();
        List<FileCoverageSummary> breakdown = new ArrayList<>();
        List<Annotation> annotations = new ArrayList<>();

        int totalChangedLines = 0;
        int relevantLines = 0;
        int coveredLines = 0;

        for (FileCoverage file : files) {
            breakdown.add(FileCoverageSummary.of(file));
            if (file.isSkipped()) {
                skippedFiles.add(file.getPath());
                logger.debug("Skipping {} ({})", file.getPath(), file.getStatus().getSkipReason());
                continue;
            }
            relevantFiles.add(file);
            totalChangedLines += file.getChangedLinesCount();
            relevantLines += file.getRelevantLinesCount();
            coveredLines += file.getRelevantExecutedLinesCount();
            annotations.addAll(file.getAnnotations());
        }

        long coveragePercent = calculateCoveragePercent(coveredLines, relevantLines);
        boolean passed = coveragePercent >= threshold;

        String title = "Coverage for changed lines: " + formatPercent(coveragePercent);
        String summary = String.format("Based on %d lines changed in %d files.", relevantLines, relevantFiles.size());
        String details = renderDetails(files);

        logger.info("Aggregated {} files ({} skipped): {}/{} relevant lines covered, {}% against threshold {}%",
                files.size(), skippedFiles.size(), coveredLines, relevantLines, coveragePercent, threshold);

        return new DiffCoverageReport(coveragePercent, totalChangedLines, relevantLines, coveredLines, threshold, passed,
                breakdown, skippedFiles, annotations, title, summary, details);
    }

    static long calculateCoveragePercent(int coveredLines, int relevantLines) {
        if (relevantLines == 0) {
            return 100;
        }
        return Math.round((double) coveredLines / relevantLines * 100.0);
    }

    private String renderDetails(List<FileCoverage> files) {
        StringBuilder sb = new StringBuilder();
        sb.append("| File | Skipped | Changed Lines | Missed Lines | Coverage |\n");
        sb.append("|------|---------|---------------|--------------|----------|");
        for (FileCoverage file : files) {
            sb.append('\n');
            if (file.isSkipped()) {
                sb.append(String.format("| %s | ✓ | %d | - | - |", file.getPath(), file.getChangedLinesCount()));
            } else {
                sb.append(String.format("| %s | - | %d | %d | %s |", file.getPath(), file.getChangedLinesCount(),
                        file.getRelevantMissedLinesCount(), formatPercent(file.getCoveragePercent())));
            }
        }
        return sb.toString();
    }
}
