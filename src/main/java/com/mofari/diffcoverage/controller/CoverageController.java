package com.mofari.diffcoverage.controller;

import com.mofari.diffcoverage.config.DiffCoverageConfig;
import com.mofari.diffcoverage.model.AnalyzeRequest;
import com.mofari.diffcoverage.model.DiffCoverageReport;
import com.mofari.diffcoverage.service.DiffCoverageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/coverage")
public class CoverageController {

    private static final Logger logger = LoggerFactory.getLogger(CoverageController.class);

    @Autowired
    private DiffCoverageService diffCoverageService;

    @Autowired
    private DiffCoverageConfig diffCoverageConfig;

    /**
     * 分析请求体中给出的变更文件和覆盖率数据
     * @param request 变更文件、覆盖率数据和可选阈值
     * @return 覆盖率报告
     */
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestBody AnalyzeRequest request) {
        try {
            int threshold = diffCoverageConfig.resolveThreshold(request.getThreshold());
            logger.info("Received analyze request for {} changed files, threshold {}%", request.getChangedFiles().size(), threshold);

            DiffCoverageReport report = diffCoverageService.analyze(
                    request.getChangedFiles(), request.toExecutionCounts(), threshold);
            return ResponseEntity.ok(report);

        } catch (Exception e) {
            logger.error("Failed to analyze coverage of changed lines. Error: {}", e.getMessage(), e);
            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("success", false);
            errorResponse.put("message", e.getMessage());
            return ResponseEntity.status(500).body(errorResponse);
        }
    }

    /**
     * 检查Pull Request变更行的覆盖率，并可选地发布check run
     * @param owner 仓库所有者（可选，默认使用配置）
     * @param repo 仓库名（可选，默认使用配置）
     * @param number Pull Request编号
     * @param threshold 覆盖率阈值（可选）
     * @param annotate 是否发布带注释的check run（可选）
     * @return 响应结果
     */
    @PostMapping("/pull-request")
    public ResponseEntity<Map<String, Object>> checkPullRequest(
            @RequestParam(required = false) String owner,
            @RequestParam(required = false) String repo,
            @RequestParam int number,
            @RequestParam(required = false) Integer threshold,
            @RequestParam(required = false) Boolean annotate) {

        Map<String, Object> response = new HashMap<>();

        try {
            boolean publish = annotate != null ? annotate : diffCoverageConfig.isAnnotate();
            logger.info("Received pull request coverage check. Repo: {}/{}, PR: {}, annotate: {}", owner, repo, number, publish);

            DiffCoverageReport report = diffCoverageService.analyzePullRequest(owner, repo, number, threshold, publish);
            Path reportPath = diffCoverageService.writeReport(report);

            response.put("success", true);
            response.put("message", report.getTitle());
            response.put("passed", report.isPassed());
            response.put("reportPath", reportPath.toAbsolutePath().toString());
            response.put("report", report);

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Failed to check coverage of pull request {}", number, e);

            response.put("success", false);
            response.put("message", e.getMessage());
            response.put("number", number);

            return ResponseEntity.status(500).body(response);
        }
    }

    /**
     * 检查本地git仓库两个引用之间变更行的覆盖率
     * @param projectPath 本地git仓库路径
     * @param baseRef Git基础引用
     * @param newRef Git新引用
     * @param threshold 覆盖率阈值（可选）
     * @return 响应结果
     */
    @PostMapping("/local")
    public ResponseEntity<Map<String, Object>> checkLocalChanges(
            @RequestParam String projectPath,
            @RequestParam String baseRef,
            @RequestParam String newRef,
            @RequestParam(required = false) Integer threshold) {

        Map<String, Object> response = new HashMap<>();

        try {
            logger.info("Received local coverage check. Path: {}, BaseRef: {}, NewRef: {}", projectPath, baseRef, newRef);

            DiffCoverageReport report = diffCoverageService.analyzeLocal(projectPath, baseRef, newRef, threshold);
            Path reportPath = diffCoverageService.writeReport(report);

            response.put("success", true);
            response.put("message", report.getTitle());
            response.put("passed", report.isPassed());
            response.put("reportPath", reportPath.toAbsolutePath().toString());
            response.put("report", report);

            return ResponseEntity.ok(response);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while diffing {} against {}", newRef, baseRef, e);
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        } catch (Exception e) {
            logger.error("Failed to check coverage of local changes. Path: {}, base: {}, new: {}", projectPath, baseRef, newRef, e);

            response.put("success", false);
            response.put("message", e.getMessage());
            response.put("baseRef", baseRef);
            response.put("newRef", newRef);

            return ResponseEntity.status(500).body(response);
        }
    }
}
