package com.mofari.diffcoverage.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts added line numbers (new-file numbering) from unified diff text.
 */
public final class PatchParser {

    private static final Logger logger = LoggerFactory.getLogger(PatchParser.class);

    // "@@ -old_start,old_lines +new_start,new_lines @@ optional context"; the lengths may be omitted
    private static final Pattern HUNK_HEADER_PATTERN = Pattern.compile("^@@\\s+-[0-9]+(?:,[0-9]+)?\\s+\\+([0-9]+)(?:,[0-9]+)?\\s+@@.*");

    private static final int NO_HUNK = -1;

    private PatchParser() {
    }

    /**
     * Returns the changed lines of a patch in the order they appear, an empty list for a missing or
     * empty patch (renames, binary files). Additions under a hunk header that cannot be parsed are
     * dropped; the next valid header resumes tracking.
     */
    public static List<Integer> parsePatch(String patch) {
        if (patch == null || patch.isEmpty()) {
            return Collections.emptyList();
        }

        List<Integer> changedLines = new ArrayList<>();
        int lineNumber = NO_HUNK;

        for (String line : patch.split("\r?\n", -1)) {
            if (line.startsWith("@@")) {
                lineNumber = parseHunkStart(line);
                continue;
            }

            if (lineNumber == NO_HUNK) {
                continue;
            }

            if (line.startsWith("+") && !line.startsWith("+++")) {
                changedLines.add(lineNumber);
            }

            // deletions are not in the new file, "\ No newline at end of file" is not a line at all
            if (!line.startsWith("-") && !line.startsWith("\\")) {
                lineNumber++;
            }
        }

        return changedLines;
    }

    private static int parseHunkStart(String header) {
        Matcher hunkMatcher = HUNK_HEADER_PATTERN.matcher(header);
        if (hunkMatcher.matches()) {
            try {
                return Integer.parseInt(hunkMatcher.group(1));
            } catch (NumberFormatException e) {
                // start line out of int range
                logger.warn("Ignoring additions under hunk header with invalid start line: {}", header);
                return NO_HUNK;
            }
        }
        logger.warn("Ignoring additions under malformed hunk header: {}", header);
        return NO_HUNK;
    }
}
