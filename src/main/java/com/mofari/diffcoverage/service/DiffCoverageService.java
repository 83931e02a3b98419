package com.mofari.diffcoverage.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mofari.diffcoverage.config.DiffCoverageConfig;
import com.mofari.diffcoverage.model.Annotation;
import com.mofari.diffcoverage.model.ChangedFile;
import com.mofari.diffcoverage.model.DiffCoverageReport;
import com.mofari.diffcoverage.model.ExecutionCounts;
import com.mofari.diffcoverage.model.FileCoverage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a coverage check over a changeset: changed files and coverage data in, report (and
 * optionally a check run) out.
 */
@Service
public class DiffCoverageService {

    private static final Logger logger = LoggerFactory.getLogger(DiffCoverageService.class);
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmssSSS").withZone(ZoneId.systemDefault());

    @Autowired
    private DiffCoverageConfig diffCoverageConfig;

    @Autowired
    private CoverageDataReader coverageDataReader;

    @Autowired
    private JacocoCoverageDataLoader jacocoCoverageDataLoader;

    @Autowired
    private CoverageAggregator coverageAggregator;

    @Autowired
    private GitHubClient gitHubClient;

    @Autowired
    private GitDiffService gitDiffService;

    @Autowired
    private ObjectMapper objectMapper;

    public DiffCoverageReport analyze(List<ChangedFile> changedFiles, Map<String, ExecutionCounts> coverageData, int threshold) {
        List<FileCoverage> files = mapToFiles(changedFiles, coverageData);
        DiffCoverageReport report = coverageAggregator.aggregate(files, threshold);

        logger.info("{}\n\n{}\n\n{}", report.getTitle(), report.getSummary(), report.getDetails());
        if (logger.isDebugEnabled()) {
            for (Annotation annotation : report.getAnnotations()) {
                logger.debug("Annotation: {}", annotation);
            }
        }
        if (!report.isPassed()) {
            logger.warn("Code coverage ({}%) is below the required threshold ({}%)", report.getCoveragePercent(), threshold);
        }
        return report;
    }

    public List<FileCoverage> mapToFiles(List<ChangedFile> changedFiles, Map<String, ExecutionCounts> coverageData) {
        List<FileCoverage> files = new ArrayList<>(changedFiles.size());
        for (ChangedFile changedFile : changedFiles) {
            FileCoverage file = FileCoverage.from(changedFile, coverageData.get(changedFile.getPath()));
            switch (file.getStatus()) {
                case RENAMED:
                    logger.debug("{} was only renamed from {}", file.getPath(), changedFile.getPreviousPath());
                    break;
                case NOT_TRACKED:
                    logger.warn("{} is not tracked by the test suite, it will not count towards coverage", file.getPath());
                    break;
                default:
                    logger.debug("{}: {} changed lines, {} relevant, {} missed", file.getPath(),
                            file.getChangedLinesCount(), file.getRelevantLinesCount(), file.getRelevantMissedLinesCount());
                    break;
            }
            files.add(file);
        }
        return files;
    }

    /**
     * Coverage data from the configured JaCoCo execution file when one is set, else from the JSON coverage file.
     */
    public Map<String, ExecutionCounts> loadCoverageData() throws IOException {
        DiffCoverageConfig.JacocoConfig jacoco = diffCoverageConfig.getJacoco();
        if (StringUtils.hasText(jacoco.getExecFile())) {
            return jacocoCoverageDataLoader.load(new File(jacoco.getExecFile()), jacoco.getClassDirectories(), jacoco.getSourceRoot());
        }
        return coverageDataReader.read(Paths.get(diffCoverageConfig.getCoverageFile()));
    }

    public DiffCoverageReport analyzePullRequest(String owner, String repo, int pullNumber, Integer threshold, boolean annotate) throws IOException {
        String resolvedOwner = resolveOwner(owner);
        String resolvedRepo = resolveRepo(repo);
        int resolvedThreshold = diffCoverageConfig.resolveThreshold(threshold);
        logger.info("Checking coverage of pull request {}/{}#{} against {}%", resolvedOwner, resolvedRepo, pullNumber, resolvedThreshold);

        Map<String, ExecutionCounts> coverageData = loadCoverageData();
        List<ChangedFile> changedFiles = gitHubClient.listPullRequestFiles(resolvedOwner, resolvedRepo, pullNumber);
        DiffCoverageReport report = analyze(changedFiles, coverageData, resolvedThreshold);

        if (annotate) {
            String headSha = gitHubClient.getPullRequestHeadSha(resolvedOwner, resolvedRepo, pullNumber);
            gitHubClient.createCheckRun(resolvedOwner, resolvedRepo, headSha, report);
        }
        return report;
    }

    /**
     * Push flavour: compares {@code headSha} with {@code base} and attaches the check to {@code headSha}.
     * Without a base the repository's default branch is used.
     */
    public DiffCoverageReport analyzeCommits(String owner, String repo, String base, String headSha, Integer threshold, boolean annotate) throws IOException {
        if (!StringUtils.hasText(headSha)) {
            throw new IllegalArgumentException("Head commit SHA is required to compare commits");
        }
        String resolvedOwner = resolveOwner(owner);
        String resolvedRepo = resolveRepo(repo);
        int resolvedThreshold = diffCoverageConfig.resolveThreshold(threshold);
        String resolvedBase = StringUtils.hasText(base) ? base : gitHubClient.getDefaultBranch(resolvedOwner, resolvedRepo);
        logger.info("Checking coverage of {}...{} in {}/{} against {}%", resolvedBase, headSha, resolvedOwner, resolvedRepo, resolvedThreshold);

        Map<String, ExecutionCounts> coverageData = loadCoverageData();
        List<ChangedFile> changedFiles = gitHubClient.compareCommits(resolvedOwner, resolvedRepo, resolvedBase, headSha);
        DiffCoverageReport report = analyze(changedFiles, coverageData, resolvedThreshold);

        if (annotate) {
            gitHubClient.createCheckRun(resolvedOwner, resolvedRepo, headSha, report);
        }
        return report;
    }

    public DiffCoverageReport analyzeLocal(String projectPath, String baseRef, String newRef, Integer threshold) throws IOException, InterruptedException {
        int resolvedThreshold = diffCoverageConfig.resolveThreshold(threshold);
        logger.info("Checking coverage of local changes {}..{} in {} against {}%", baseRef, newRef, projectPath, resolvedThreshold);

        Map<String, ExecutionCounts> coverageData = loadCoverageData();
        List<ChangedFile> changedFiles = gitDiffService.getChangedFiles(projectPath, baseRef, newRef);
        return analyze(changedFiles, coverageData, resolvedThreshold);
    }

    /**
     * Writes the report as JSON into a new timestamped directory under the report output directory.
     */
    public Path writeReport(DiffCoverageReport report) throws IOException {
        String timestampForPath = TIMESTAMP_FORMATTER.format(Instant.now());
        Path reportOutputDirPath = Paths.get(diffCoverageConfig.getReportOutputDirectory(), "diff_" + timestampForPath);
        Files.createDirectories(reportOutputDirPath);

        Path jsonReportFile = reportOutputDirPath.resolve("diff_coverage.json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(jsonReportFile.toFile(), report);
        logger.info("Diff coverage report (JSON) saved to: {}", jsonReportFile.toAbsolutePath());
        return jsonReportFile;
    }

    private String resolveOwner(String owner) {
        String resolved = StringUtils.hasText(owner) ? owner : diffCoverageConfig.getGithub().getOwner();
        if (!StringUtils.hasText(resolved)) {
            throw new IllegalStateException("Repository owner is neither given nor configured (diff-coverage.github.owner)");
        }
        return resolved;
    }

    private String resolveRepo(String repo) {
        String resolved = StringUtils.hasText(repo) ? repo : diffCoverageConfig.getGithub().getRepo();
        if (!StringUtils.hasText(resolved)) {
            throw new IllegalStateException("Repository name is neither given nor configured (diff-coverage.github.repo)");
        }
        return resolved;
    }
}
