package com.mofari.diffcoverage.service;

import com.mofari.diffcoverage.config.DiffCoverageConfig;
import com.mofari.diffcoverage.model.DiffCoverageReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Runs one coverage check at start-up, as a CI step would. Exit code 1 means the coverage is below
 * the threshold or the run failed.
 */
@Component
@ConditionalOnProperty(prefix = "diff-coverage.check", name = "enabled", havingValue = "true")
public class CoverageCheckRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CoverageCheckRunner.class);

    static final String PULL_REQUEST_EVENT = "pull_request";

    @Autowired
    private DiffCoverageConfig diffCoverageConfig;

    @Autowired
    private DiffCoverageService diffCoverageService;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        DiffCoverageConfig.CheckConfig check = diffCoverageConfig.getCheck();
        try {
            DiffCoverageReport report;
            if (PULL_REQUEST_EVENT.equals(check.getEventName())) {
                if (check.getPullNumber() == null) {
                    throw new IllegalStateException("diff-coverage.check.pull-number is required for pull_request events");
                }
                report = diffCoverageService.analyzePullRequest(null, null, check.getPullNumber(), null, diffCoverageConfig.isAnnotate());
            } else {
                if (!StringUtils.hasText(check.getHeadSha())) {
                    throw new IllegalStateException("diff-coverage.check.head-sha is required for " + check.getEventName() + " events");
                }
                report = diffCoverageService.analyzeCommits(null, null, check.getBaseSha(), check.getHeadSha(), null, diffCoverageConfig.isAnnotate());
            }
            diffCoverageService.writeReport(report);

            if (!report.isPassed()) {
                logger.error("Code coverage ({}%) is below the required threshold ({}%)", report.getCoveragePercent(), report.getThreshold());
                exitCode = 1;
            }
        } catch (Exception e) {
            logger.error("Coverage check failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
