package com.mofari.diffcoverage.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mofari.diffcoverage.config.DiffCoverageConfig;
import com.mofari.diffcoverage.model.Annotation;
import com.mofari.diffcoverage.model.ChangedFile;
import com.mofari.diffcoverage.model.DiffCoverageReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Talks to the GitHub REST API: changed files of a pull request or commit range, and check runs.
 * Failures are not retried; they surface as {@link IOException} carrying the original message.
 */
@Service
public class GitHubClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubClient.class);

    static final int FILES_PAGE_SIZE = 100;
    // GitHub rejects more than 50 annotations in a single check run request
    static final int MAX_ANNOTATIONS_PER_REQUEST = 50;

    @Autowired
    private DiffCoverageConfig diffCoverageConfig;

    @Autowired
    private RestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    public List<ChangedFile> listPullRequestFiles(String owner, String repo, int pullNumber) throws IOException {
        List<ChangedFile> changedFiles = new ArrayList<>();
        int page = 1;
        while (true) {
            String url = UriComponentsBuilder.fromHttpUrl(apiUrl())
                    .pathSegment("repos", owner, repo, "pulls", String.valueOf(pullNumber), "files")
                    .queryParam("per_page", FILES_PAGE_SIZE)
                    .queryParam("page", page)
                    .toUriString();
            List<GitHubFile> files = objectMapper.readValue(get(url), new TypeReference<List<GitHubFile>>() {});
            for (GitHubFile file : files) {
                changedFiles.add(file.toChangedFile());
            }
            if (files.size() < FILES_PAGE_SIZE) {
                break;
            }
            page++;
        }
        logger.info("Pull request {}/{}#{} changes {} files", owner, repo, pullNumber, changedFiles.size());
        return changedFiles;
    }

    public List<ChangedFile> compareCommits(String owner, String repo, String base, String head) throws IOException {
        String url = UriComponentsBuilder.fromHttpUrl(apiUrl())
                .pathSegment("repos", owner, repo, "compare", base + "..." + head)
                .toUriString();
        CompareResponse compare = objectMapper.readValue(get(url), CompareResponse.class);
        List<ChangedFile> changedFiles = new ArrayList<>();
        if (compare.getFiles() != null) {
            for (GitHubFile file : compare.getFiles()) {
                changedFiles.add(file.toChangedFile());
            }
        }
        logger.info("Comparison {}...{} in {}/{} changes {} files", base, head, owner, repo, changedFiles.size());
        return changedFiles;
    }

    /**
     * Default branch of the repository, the base for push events that do not name one.
     */
    public String getDefaultBranch(String owner, String repo) throws IOException {
        String url = UriComponentsBuilder.fromHttpUrl(apiUrl())
                .pathSegment("repos", owner, repo)
                .toUriString();
        Repository repository = objectMapper.readValue(get(url), Repository.class);
        if (!StringUtils.hasText(repository.getDefaultBranch())) {
            throw new IOException("Repository " + owner + "/" + repo + " has no default branch");
        }
        return repository.getDefaultBranch();
    }

    /**
     * SHA of the last commit on the pull request branch, which is where the check belongs.
     */
    public String getPullRequestHeadSha(String owner, String repo, int pullNumber) throws IOException {
        String url = UriComponentsBuilder.fromHttpUrl(apiUrl())
                .pathSegment("repos", owner, repo, "pulls", String.valueOf(pullNumber))
                .toUriString();
        PullRequest pullRequest = objectMapper.readValue(get(url), PullRequest.class);
        if (pullRequest.getHead() == null || !StringUtils.hasText(pullRequest.getHead().getSha())) {
            throw new IOException("Pull request " + pullNumber + " has no head commit");
        }
        return pullRequest.getHead().getSha();
    }

    /**
     * Creates a completed check run for {@code headSha}. The first batch of annotations goes with the
     * create request, the remaining batches are appended by updating the same check run.
     *
     * @return id of the created check run
     */
    public long createCheckRun(String owner, String repo, String headSha, DiffCoverageReport report) throws IOException {
        List<Annotation> annotations = report.getAnnotations();
        List<List<Annotation>> batches = partition(annotations);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", diffCoverageConfig.getGithub().getCheckName());
        body.put("head_sha", headSha);
        body.put("status", "completed");
        body.put("conclusion", report.isPassed() ? "success" : "failure");
        body.put("output", output(report, batches.isEmpty() ? new ArrayList<>() : batches.get(0)));

        logger.info("Adding check status to {} with {} annotations", headSha, annotations.size());
        String url = UriComponentsBuilder.fromHttpUrl(apiUrl())
                .pathSegment("repos", owner, repo, "check-runs")
                .toUriString();
        CheckRun checkRun = objectMapper.readValue(send(url, HttpMethod.POST, body), CheckRun.class);

        for (int i = 1; i < batches.size(); i++) {
            Map<String, Object> update = new LinkedHashMap<>();
            update.put("output", output(report, batches.get(i)));
            String updateUrl = UriComponentsBuilder.fromHttpUrl(apiUrl())
                    .pathSegment("repos", owner, repo, "check-runs", String.valueOf(checkRun.getId()))
                    .toUriString();
            send(updateUrl, HttpMethod.PATCH, update);
            logger.debug("Appended annotation batch {}/{} to check run {}", i + 1, batches.size(), checkRun.getId());
        }
        return checkRun.getId();
    }

    private Map<String, Object> output(DiffCoverageReport report, List<Annotation> annotations) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("title", report.getTitle());
        output.put("summary", report.getSummary());
        output.put("text", report.getDetails());
        output.put("annotations", annotations);
        return output;
    }

    private static List<List<Annotation>> partition(List<Annotation> annotations) {
        List<List<Annotation>> batches = new ArrayList<>();
        for (int from = 0; from < annotations.size(); from += MAX_ANNOTATIONS_PER_REQUEST) {
            int to = Math.min(from + MAX_ANNOTATIONS_PER_REQUEST, annotations.size());
            batches.add(new ArrayList<>(annotations.subList(from, to)));
        }
        return batches;
    }

    private String get(String url) throws IOException {
        logger.debug("GET {}", url);
        try {
            ResponseEntity<String> responseEntity = restTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers()), String.class);
            return responseEntity.getBody();
        } catch (RestClientException e) {
            logger.error("GitHub API request failed: GET {}", url, e);
            throw new IOException(e.getMessage(), e);
        }
    }

    private String send(String url, HttpMethod method, Map<String, Object> body) throws IOException {
        logger.debug("{} {}", method, url);
        try {
            HttpHeaders headers = headers();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<String> entity = new HttpEntity<>(objectMapper.writeValueAsString(body), headers);
            ResponseEntity<String> responseEntity = restTemplate.exchange(url, method, entity, String.class);
            return responseEntity.getBody();
        } catch (RestClientException e) {
            logger.error("GitHub API request failed: {} {}", method, url, e);
            throw new IOException(e.getMessage(), e);
        }
    }

    private HttpHeaders headers() {
        String token = diffCoverageConfig.getGithub().getToken();
        if (!StringUtils.hasText(token)) {
            throw new IllegalStateException("GitHub token (diff-coverage.github.token) is missing in application.yml");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.set(HttpHeaders.ACCEPT, "application/vnd.github+json");
        return headers;
    }

    private String apiUrl() {
        return diffCoverageConfig.getGithub().getApiUrl();
    }

    // --- DTOs for parsing GitHub API JSON responses ---
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GitHubFile {
        private String filename;
        @JsonProperty("previous_filename")
        private String previousFilename;
        private String patch;

        ChangedFile toChangedFile() {
            return new ChangedFile(filename, previousFilename, patch);
        }

        public String getFilename() { return filename; }
        public void setFilename(String filename) { this.filename = filename; }
        public String getPreviousFilename() { return previousFilename; }
        public void setPreviousFilename(String previousFilename) { this.previousFilename = previousFilename; }
        public String getPatch() { return patch; }
        public void setPatch(String patch) { this.patch = patch; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CompareResponse {
        private List<GitHubFile> files;
        public List<GitHubFile> getFiles() { return files; }
        public void setFiles(List<GitHubFile> files) { this.files = files; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Repository {
        @JsonProperty("default_branch")
        private String defaultBranch;
        public String getDefaultBranch() { return defaultBranch; }
        public void setDefaultBranch(String defaultBranch) { this.defaultBranch = defaultBranch; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PullRequest {
        private Ref head;
        public Ref getHead() { return head; }
        public void setHead(Ref head) { this.head = head; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Ref {
        private String sha;
        public String getSha() { return sha; }
        public void setSha(String sha) { this.sha = sha; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CheckRun {
        private long id;
        public long getId() { return id; }
        public void setId(long id) { this.id = id; }
    }
}
