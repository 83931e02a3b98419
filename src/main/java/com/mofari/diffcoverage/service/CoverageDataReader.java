package com.mofari.diffcoverage.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mofari.diffcoverage.model.ExecutionCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON coverage file: an object mapping each source path to an array of
 * {@code null} (not executable) or non-negative execution counts, index 0 being line 1.
 */
@Service
public class CoverageDataReader {

    private static final Logger logger = LoggerFactory.getLogger(CoverageDataReader.class);

    @Autowired
    private ObjectMapper objectMapper;

    public Map<String, ExecutionCounts> read(Path coverageFile) throws IOException {
        logger.info("Reading coverage data from {}", coverageFile.toAbsolutePath());
        if (!Files.isRegularFile(coverageFile)) {
            throw new NoSuchFileException(coverageFile.toString(), null, "Coverage file does not exist");
        }
        byte[] content = Files.readAllBytes(coverageFile);
        Map<String, ExecutionCounts> coverage = parse(content);
        logger.info("Loaded coverage for {} files", coverage.size());
        return coverage;
    }

    public Map<String, ExecutionCounts> parse(byte[] json) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IOException("Unable to parse coverage data: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IOException("Coverage data must be a JSON object keyed by file path");
        }

        Map<String, ExecutionCounts> coverage = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            coverage.put(field.getKey(), toExecutionCounts(field.getKey(), field.getValue()));
        }
        return coverage;
    }

    private ExecutionCounts toExecutionCounts(String path, JsonNode lines) throws IOException {
        if (!lines.isArray()) {
            throw new IOException("Coverage entry for " + path + " is not an array");
        }
        List<Integer> counts = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            JsonNode count = lines.get(i);
            if (count.isNull()) {
                counts.add(null);
            } else if (count.isIntegralNumber() && count.canConvertToInt() && count.intValue() >= 0) {
                counts.add(count.intValue());
            } else {
                throw new IOException("Invalid execution count '" + count + "' for " + path + " line " + (i + 1));
            }
        }
        return new ExecutionCounts(counts);
    }
}
