package com.mofari.diffcoverage.service;

import com.mofari.diffcoverage.model.ChangedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the files changed between two refs of a local git checkout, with one patch per file.
 */
@Service
public class GitDiffService {

    private static final Logger logger = LoggerFactory.getLogger(GitDiffService.class);

    private static final Pattern DIFF_HEADER_PATTERN = Pattern.compile("^diff --git a/(.*) b/(.*)$");
    // Regex to find "+++ b/path/to/file"
    private static final Pattern NEW_FILE_PATTERN = Pattern.compile("^\\+\\+\\+\\s+b/(.*)$");
    private static final String DEV_NULL = "/dev/null";

    public List<ChangedFile> getChangedFiles(String projectPath, String baseRef, String newRef) throws IOException, InterruptedException {
        File workingDir = new File(projectPath);
        if (!workingDir.exists() || !workingDir.isDirectory()) {
            logger.error("Project path for git diff does not exist or is not a directory: {}", projectPath);
            throw new IOException("Invalid project path: " + projectPath);
        }

        // --unified=0 shows only changed lines without context
        ProcessBuilder processBuilder = new ProcessBuilder(
                "git", "diff", "--unified=0", "--find-renames", "--no-color", baseRef + ".." + newRef
        );
        processBuilder.directory(workingDir);
        processBuilder.redirectErrorStream(true);

        logger.info("Executing git diff command in {}: {}", projectPath, String.join(" ", processBuilder.command()));

        Process process = processBuilder.start();
        List<String> output = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.trace("Git diff output: {}", line);
                output.add(line);
            }
        }

        int exitCode = process.waitFor();
        // exit code 1 from plain "git diff" only means differences were found
        if (exitCode != 0 && exitCode != 1) {
            String lastOutput = output.isEmpty() ? "" : output.get(output.size() - 1);
            logger.error("Git diff command failed with exit code {}. Path: {}. Output: {}", exitCode, projectPath, lastOutput);
            throw new IOException("Git diff command failed with exit code " + exitCode + ": " + lastOutput);
        }

        List<ChangedFile> changedFiles = parseDiffOutput(output);
        logger.info("Found changes in {} files between {} and {}", changedFiles.size(), baseRef, newRef);
        return changedFiles;
    }

    /**
     * Splits multi-file diff output into one entry per file. Deleted files are dropped, a rename
     * without content changes keeps its previous path and no patch.
     */
    List<ChangedFile> parseDiffOutput(List<String> lines) {
        List<ChangedFile> changedFiles = new ArrayList<>();
        FileSection current = null;

        for (String line : lines) {
            Matcher headerMatcher = DIFF_HEADER_PATTERN.matcher(line);
            if (headerMatcher.matches()) {
                addIfPresent(changedFiles, current);
                current = new FileSection(headerMatcher.group(2));
                continue;
            }
            if (current == null) {
                continue;
            }
            if (current.inHunks) {
                current.patch.append(line).append('\n');
                continue;
            }

            if (line.startsWith("@@")) {
                current.inHunks = true;
                current.patch.append(line).append('\n');
            } else if (line.startsWith("rename from ")) {
                current.previousPath = line.substring("rename from ".length());
            } else if (line.startsWith("rename to ")) {
                current.path = line.substring("rename to ".length());
            } else if (line.startsWith("deleted file mode")) {
                current.deleted = true;
            } else if (line.startsWith("+++ ")) {
                Matcher newFileMatcher = NEW_FILE_PATTERN.matcher(line);
                if (newFileMatcher.matches()) {
                    current.path = newFileMatcher.group(1);
                } else if (line.endsWith(DEV_NULL)) {
                    current.deleted = true;
                }
            }
        }
        addIfPresent(changedFiles, current);
        return changedFiles;
    }

    private void addIfPresent(List<ChangedFile> changedFiles, FileSection section) {
        if (section == null) {
            return;
        }
        if (section.deleted) {
            logger.debug("Ignoring deleted file: {}", section.path);
            return;
        }
        String patch = section.patch.length() == 0 ? null : section.patch.toString();
        changedFiles.add(new ChangedFile(section.path.replace('\\', '/'), section.previousPath, patch));
    }

    private static class FileSection {
        private String path;
        private String previousPath;
        private boolean deleted;
        private boolean inHunks;
        private final StringBuilder patch = new StringBuilder();

        FileSection(String path) {
            this.path = path;
        }
    }
}
