package com.mofari.diffcoverage.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mofari.diffcoverage.config.DiffCoverageConfig;
import com.mofari.diffcoverage.model.ChangedFile;
import com.mofari.diffcoverage.model.DiffCoverageReport;
import com.mofari.diffcoverage.model.ExecutionCounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiffCoverageServiceTest {

    @Mock private CoverageDataReader coverageDataReader;
    @Mock private JacocoCoverageDataLoader jacocoCoverageDataLoader;
    @Mock private GitHubClient gitHubClient;
    @Mock private GitDiffService gitDiffService;
    @Spy private CoverageAggregator coverageAggregator = new CoverageAggregator();
    @Spy private DiffCoverageConfig diffCoverageConfig = new DiffCoverageConfig();
    @Spy private ObjectMapper objectMapper = new ObjectMapper();

    @InjectMocks
    private DiffCoverageService service;

    @TempDir
    Path tempDir;

    private Map<String, ExecutionCounts> coverage;

    @BeforeEach
    void setUp() {
        diffCoverageConfig.getGithub().setOwner("acme");
        diffCoverageConfig.getGithub().setRepo("shop");
        diffCoverageConfig.setReportOutputDirectory(tempDir.toString());

        coverage = new HashMap<>();
        coverage.put("src/app.js", ExecutionCounts.of(1, 0, null, 1));
    }

    @Test
    void checksPullRequestAndPublishesCheckRun() throws IOException {
        List<ChangedFile> changed = Arrays.asList(
                new ChangedFile("src/app.js", null, "@@ -1,2 +1,4 @@\n+a\n+b\n+c\n+d"),
                new ChangedFile("README.md", null, "@@ -1 +1 @@\n-x\n+y"));
        when(coverageDataReader.read(Paths.get("coverage.json"))).thenReturn(coverage);
        when(gitHubClient.listPullRequestFiles("acme", "shop", 12)).thenReturn(changed);
        when(gitHubClient.getPullRequestHeadSha("acme", "shop", 12)).thenReturn("cafe");

        DiffCoverageReport report = service.analyzePullRequest(null, null, 12, 60, true);

        assertThat(report.getRelevantLines()).isEqualTo(3);
        assertThat(report.getCoveredLines()).isEqualTo(2);
        assertThat(report.getCoveragePercent()).isEqualTo(67);
        assertThat(report.isPassed()).isTrue();
        assertThat(report.getSkippedFiles()).containsExactly("README.md");
        assertThat(report.getAnnotations()).singleElement()
                .satisfies(annotation -> assertThat(annotation.getMessage()).isEqualTo("Line 2 has no coverage"));
        verify(gitHubClient).createCheckRun(eq("acme"), eq("shop"), eq("cafe"), any(DiffCoverageReport.class));
    }

    @Test
    void checksCommitRangeWithoutPublishing() throws IOException {
        when(coverageDataReader.read(any(Path.class))).thenReturn(coverage);
        when(gitHubClient.compareCommits("other", "repo", "main", "f00d"))
                .thenReturn(Collections.singletonList(ChangedFile.withLines("src/app.js", Arrays.asList(1, 2))));

        DiffCoverageReport report = service.analyzeCommits("other", "repo", "main", "f00d", null, false);

        assertThat(report.getCoveragePercent()).isEqualTo(50);
        assertThat(report.getThreshold()).isEqualTo(90);
        assertThat(report.isPassed()).isFalse();
        verify(gitHubClient, never()).createCheckRun(anyString(), anyString(), anyString(), any(DiffCoverageReport.class));
    }

    @Test
    void commitRangeWithoutBaseComparesAgainstDefaultBranch() throws IOException {
        when(coverageDataReader.read(any(Path.class))).thenReturn(coverage);
        when(gitHubClient.getDefaultBranch("acme", "shop")).thenReturn("develop");
        when(gitHubClient.compareCommits("acme", "shop", "develop", "f00d"))
                .thenReturn(Collections.singletonList(ChangedFile.withLines("src/app.js", Arrays.asList(1, 2))));

        DiffCoverageReport report = service.analyzeCommits(null, null, null, "f00d", null, false);

        assertThat(report.getRelevantLines()).isEqualTo(2);
        verify(gitHubClient).compareCommits("acme", "shop", "develop", "f00d");
    }

    @Test
    void commitRangeWithoutHeadIsFatal() {
        assertThatThrownBy(() -> service.analyzeCommits(null, null, "main", " ", null, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Head commit SHA");
        verifyNoInteractions(gitHubClient, coverageDataReader);
    }

    @Test
    void checksLocalChanges() throws Exception {
        when(coverageDataReader.read(any(Path.class))).thenReturn(coverage);
        when(gitDiffService.getChangedFiles("/work/shop", "main", "HEAD"))
                .thenReturn(Collections.singletonList(ChangedFile.withLines("src/app.js", Arrays.asList(1, 4))));

        DiffCoverageReport report = service.analyzeLocal("/work/shop", "main", "HEAD", 100);

        assertThat(report.getCoveragePercent()).isEqualTo(100);
        assertThat(report.isPassed()).isTrue();
        verifyNoInteractions(gitHubClient);
    }

    @Test
    void prefersJacocoDataWhenConfigured() throws IOException {
        diffCoverageConfig.getJacoco().setExecFile("build/jacoco.exec");
        diffCoverageConfig.getJacoco().setClassDirectories(Collections.singletonList("build/classes"));
        when(jacocoCoverageDataLoader.load(new File("build/jacoco.exec"), Collections.singletonList("build/classes"), "src/main/java/"))
                .thenReturn(coverage);

        assertThat(service.loadCoverageData()).isSameAs(coverage);
        verifyNoInteractions(coverageDataReader);
    }

    @Test
    void invalidThresholdIsFatal() {
        assertThatThrownBy(() -> service.analyzePullRequest(null, null, 1, 101, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Coverage threshold must be between 0 and 100, got 101");
        verifyNoInteractions(gitHubClient, coverageDataReader);
    }

    @Test
    void coverageReadFailurePropagates() throws IOException {
        when(coverageDataReader.read(any(Path.class))).thenThrow(new NoSuchFileException("coverage.json"));

        assertThatThrownBy(() -> service.analyzePullRequest(null, null, 1, null, true))
                .isInstanceOf(NoSuchFileException.class)
                .hasMessage("coverage.json");
        verifyNoInteractions(gitHubClient);
    }

    @Test
    void missingRepositoryIsFatal() {
        diffCoverageConfig.getGithub().setRepo(null);

        assertThatThrownBy(() -> service.analyzePullRequest(null, null, 1, null, false))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("diff-coverage.github.repo");
    }

    @Test
    void writesReportAsJson() throws IOException {
        DiffCoverageReport report = service.analyze(
                Collections.singletonList(ChangedFile.withLines("src/app.js", Arrays.asList(1, 2))), coverage, 80);

        Path written = service.writeReport(report);

        assertThat(written.getFileName().toString()).isEqualTo("diff_coverage.json");
        assertThat(written.getParent().getParent()).isEqualTo(tempDir);
        JsonNode json = new ObjectMapper().readTree(Files.readAllBytes(written));
        assertThat(json.get("coveragePercent").asInt()).isEqualTo(50);
        assertThat(json.get("passed").asBoolean()).isFalse();
        assertThat(json.get("annotations").get(0).get("start_line").asInt()).isEqualTo(2);
        assertThat(json.get("perFileBreakdown").get(0).get("missedLines").asInt()).isEqualTo(1);
    }
}
