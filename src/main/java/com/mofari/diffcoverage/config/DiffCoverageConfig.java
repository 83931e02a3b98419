package com.mofari.diffcoverage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "diff-coverage")
public class DiffCoverageConfig {

    /**
     * JSON覆盖率文件路径 (文件路径 -> 每行执行次数)
     */
    private String coverageFile = "coverage.json";

    /**
     * 变更行覆盖率阈值 (0-100)
     */
    private int coverageThreshold = 90;

    /**
     * 是否发布带注释的check run
     */
    private boolean annotate = true;

    /**
     * 报告输出目录根路径
     */
    private String reportOutputDirectory = "./coverage-reports";

    private GitHubConfig github = new GitHubConfig();

    private JacocoConfig jacoco = new JacocoConfig();

    private CheckConfig check = new CheckConfig();

    /**
     * 获取本次检查使用的阈值，优先使用传入值，否则使用配置值
     * 超出0-100范围时抛出异常
     */
    public int resolveThreshold(Integer override) {
        int threshold = override != null ? override : coverageThreshold;
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("Coverage threshold must be between 0 and 100, got " + threshold);
        }
        return threshold;
    }

    /**
     * GitHub API配置
     */
    public static class GitHubConfig {
        private String apiUrl = "https://api.github.com";
        private String token;
        private String owner;
        private String repo;
        /**
         * check run名称
         */
        private String checkName = "Code coverage";

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public String getRepo() {
            return repo;
        }

        public void setRepo(String repo) {
            this.repo = repo;
        }

        public String getCheckName() {
            return checkName;
        }

        public void setCheckName(String checkName) {
            this.checkName = checkName;
        }
    }

    /**
     * JaCoCo配置 (设置exec文件时代替JSON覆盖率文件)
     */
    public static class JacocoConfig {
        private String execFile;
        private List<String> classDirectories = new ArrayList<>();
        /**
         * 源码根路径前缀，将 "com/acme/Foo.java" 转换为仓库路径，例如 "src/main/java/"
         */
        private String sourceRoot = "src/main/java/";

        public String getExecFile() {
            return execFile;
        }

        public void setExecFile(String execFile) {
            this.execFile = execFile;
        }

        public List<String> getClassDirectories() {
            return classDirectories;
        }

        public void setClassDirectories(List<String> classDirectories) {
            this.classDirectories = classDirectories;
        }

        public String getSourceRoot() {
            return sourceRoot;
        }

        public void setSourceRoot(String sourceRoot) {
            this.sourceRoot = sourceRoot;
        }
    }

    /**
     * 单次检查模式：启动时执行一次检查后退出
     */
    public static class CheckConfig {
        private boolean enabled = false;
        private String eventName = "pull_request";
        private Integer pullNumber;
        private String baseSha;
        private String headSha;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getEventName() {
            return eventName;
        }

        public void setEventName(String eventName) {
            this.eventName = eventName;
        }

        public Integer getPullNumber() {
            return pullNumber;
        }

        public void setPullNumber(Integer pullNumber) {
            this.pullNumber = pullNumber;
        }

        public String getBaseSha() {
            return baseSha;
        }

        public void setBaseSha(String baseSha) {
            this.baseSha = baseSha;
        }

        public String getHeadSha() {
            return headSha;
        }

        public void setHeadSha(String headSha) {
            this.headSha = headSha;
        }
    }

    // Getters and Setters
    public String getCoverageFile() {
        return coverageFile;
    }

    public void setCoverageFile(String coverageFile) {
        this.coverageFile = coverageFile;
    }

    public int getCoverageThreshold() {
        return coverageThreshold;
    }

    public void setCoverageThreshold(int coverageThreshold) {
        this.coverageThreshold = coverageThreshold;
    }

    public boolean isAnnotate() {
        return annotate;
    }

    public void setAnnotate(boolean annotate) {
        this.annotate = annotate;
    }

    public String getReportOutputDirectory() {
        return reportOutputDirectory;
    }

    public void setReportOutputDirectory(String reportOutputDirectory) {
        this.reportOutputDirectory = reportOutputDirectory;
    }

    public GitHubConfig getGithub() {
        return github;
    }

    public void setGithub(GitHubConfig github) {
        this.github = github;
    }

    public JacocoConfig getJacoco() {
        return jacoco;
    }

    public void setJacoco(JacocoConfig jacoco) {
        this.jacoco = jacoco;
    }

    public CheckConfig getCheck() {
        return check;
    }

    public void setCheck(CheckConfig check) {
        this.check = check;
    }
}
