package com.mofari.diffcoverage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.mofari.diffcoverage.util.PatchParser;

import java.util.ArrayList;
import java.util.List;

/**
 * A file touched by a changeset. Either carries the raw patch or the already extracted changed lines.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChangedFile {
    private String path;
    private String previousPath;
    private String patch;
    private List<Integer> changedLines;

    public ChangedFile() {
    }

    public ChangedFile(String path, String previousPath, String patch) {
        this.path = path;
        this.previousPath = previousPath;
        this.patch = patch;
    }

    public static ChangedFile withLines(String path, List<Integer> changedLines) {
        ChangedFile file = new ChangedFile(path, null, null);
        file.setChangedLines(changedLines);
        return file;
    }

    /**
     * A pure rename has a previous name and no patch; nothing in it can be annotated.
     */
    @JsonIgnore
    public boolean isPureRename() {
        return previousPath != null && !previousPath.isEmpty() && (patch == null || patch.isEmpty());
    }

    /**
     * Changed lines in new-file numbering, parsed from the patch unless given explicitly.
     */
    @JsonIgnore
    public List<Integer> resolveChangedLines() {
        if (changedLines != null) {
            return changedLines;
        }
        return PatchParser.parsePatch(patch);
    }

    // Getters and Setters
    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getPreviousPath() {
        return previousPath;
    }

    public void setPreviousPath(String previousPath) {
        this.previousPath = previousPath;
    }

    public String getPatch() {
        return patch;
    }

    public void setPatch(String patch) {
        this.patch = patch;
    }

    public List<Integer> getChangedLines() {
        return changedLines;
    }

    public void setChangedLines(List<Integer> changedLines) {
        this.changedLines = changedLines == null ? null : new ArrayList<>(changedLines);
    }
}
