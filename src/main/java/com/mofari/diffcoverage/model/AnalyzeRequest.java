package com.mofari.diffcoverage.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body of an analysis request that carries both the changeset and the coverage data.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzeRequest {
    private List<ChangedFile> changedFiles = new ArrayList<>();
    private Map<String, List<Integer>> coverage = new LinkedHashMap<>();
    private Integer threshold;

    public Map<String, ExecutionCounts> toExecutionCounts() {
        Map<String, ExecutionCounts> counts = new LinkedHashMap<>();
        for (Map.Entry<String, List<Integer>> entry : coverage.entrySet()) {
            if (entry.getValue() != null) {
                counts.put(entry.getKey(), new ExecutionCounts(entry.getValue()));
            }
        }
        return counts;
    }

    // Getters and Setters
    public List<ChangedFile> getChangedFiles() {
        return changedFiles;
    }

    public void setChangedFiles(List<ChangedFile> changedFiles) {
        this.changedFiles = changedFiles;
    }

    public Map<String, List<Integer>> getCoverage() {
        return coverage;
    }

    public void setCoverage(Map<String, List<Integer>> coverage) {
        this.coverage = coverage;
    }

    public Integer getThreshold() {
        return threshold;
    }

    public void setThreshold(Integer threshold) {
        this.threshold = threshold;
    }
}
