package com.mofari.diffcoverage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A check-run annotation pointing at uncovered lines. Serialized with the field names the
 * GitHub checks API expects.
 */
public class Annotation {
    public static final String LEVEL_WARNING = "warning";

    private final String path;
    private final int startLine;
    private final int endLine;
    private final String annotationLevel;
    private final String message;

    @JsonCreator
    public Annotation(@JsonProperty("path") String path,
                      @JsonProperty("start_line") int startLine,
                      @JsonProperty("end_line") int endLine,
                      @JsonProperty("annotation_level") String annotationLevel,
                      @JsonProperty("message") String message) {
        this.path = path;
        this.startLine = startLine;
        this.endLine = endLine;
        this.annotationLevel = annotationLevel;
        this.message = message;
    }

    public static Annotation warning(String path, int startLine, int endLine, String message) {
        return new Annotation(path, startLine, endLine, LEVEL_WARNING, message);
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    @JsonProperty("start_line")
    public int getStartLine() {
        return startLine;
    }

    @JsonProperty("end_line")
    public int getEndLine() {
        return endLine;
    }

    @JsonProperty("annotation_level")
    public String getAnnotationLevel() {
        return annotationLevel;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return path + ":" + startLine + "-" + endLine + " " + message;
    }
}
