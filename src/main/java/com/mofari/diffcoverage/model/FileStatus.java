package com.mofari.diffcoverage.model;

public enum FileStatus {
    ANALYZED(null),
    NOT_TRACKED("not tracked by suite"),
    RENAMED("rename");

    private final String skipReason;

    FileStatus(String skipReason) {
        this.skipReason = skipReason;
    }

    public boolean isSkipped() {
        return this != ANALYZED;
    }

    /**
     * Human readable reason the file was left out of the totals, or null when it was analyzed.
     */
    public String getSkipReason() {
        return skipReason;
    }
}
