package com.mofari.diffcoverage.service;

import com.mofari.diffcoverage.model.ExecutionCounts;
import org.jacoco.core.analysis.Analyzer;
import org.jacoco.core.analysis.CoverageBuilder;
import org.jacoco.core.analysis.ICounter;
import org.jacoco.core.analysis.ILine;
import org.jacoco.core.analysis.ISourceFileCoverage;
import org.jacoco.core.data.ExecutionDataReader;
import org.jacoco.core.data.ExecutionDataStore;
import org.jacoco.core.data.SessionInfoStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a JaCoCo execution data file into per-line execution counts keyed by repository path.
 * Lines without bytecode are not executable; covered lines count their covered instructions.
 */
@Service
public class JacocoCoverageDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(JacocoCoverageDataLoader.class);

    public Map<String, ExecutionCounts> load(File execFile, List<String> classDirectories, String sourceRoot) throws IOException {
        if (!execFile.isFile()) {
            throw new FileNotFoundException("JaCoCo execution data file does not exist: " + execFile.getAbsolutePath());
        }

        ExecutionDataStore executionDataStore = new ExecutionDataStore();
        SessionInfoStore sessionInfoStore = new SessionInfoStore();
        try (FileInputStream fis = new FileInputStream(execFile)) {
            ExecutionDataReader reader = new ExecutionDataReader(fis);
            reader.setSessionInfoVisitor(sessionInfoStore);
            reader.setExecutionDataVisitor(executionDataStore);
            reader.read();
        }
        logger.info("Read {} sessions and {} class entries from {}",
                sessionInfoStore.getInfos().size(), executionDataStore.getContents().size(), execFile.getAbsolutePath());

        CoverageBuilder coverageBuilder = new CoverageBuilder();
        Analyzer analyzer = new Analyzer(executionDataStore, coverageBuilder);
        for (String classDirStr : classDirectories) {
            File classDir = new File(classDirStr);
            if (classDir.exists()) {
                analyzer.analyzeAll(classDir);
                logger.info("Analyzed class directory: {}", classDirStr);
            } else {
                logger.warn("Class directory not found, skipping: {}", classDirStr);
            }
        }

        String prefix = sourceRoot == null ? "" : sourceRoot;
        if (!prefix.isEmpty() && !prefix.endsWith("/")) {
            prefix = prefix + "/";
        }

        Map<String, ExecutionCounts> coverage = new TreeMap<>();
        for (ISourceFileCoverage sourceFile : coverageBuilder.getSourceFiles()) {
            String packageName = sourceFile.getPackageName();
            String path = prefix + (packageName.isEmpty() ? sourceFile.getName() : packageName + "/" + sourceFile.getName());
            coverage.put(path, toExecutionCounts(sourceFile));
        }
        logger.info("Converted JaCoCo coverage for {} source files", coverage.size());
        return coverage;
    }

    private ExecutionCounts toExecutionCounts(ISourceFileCoverage sourceFile) {
        int lastLine = sourceFile.getLastLine();
        List<Integer> counts = new ArrayList<>(Math.max(lastLine, 0));
        for (int nr = 1; nr <= lastLine; nr++) {
            ILine line = sourceFile.getLine(nr);
            switch (line.getStatus()) {
                case ICounter.EMPTY:
                    counts.add(null);
                    break;
                case ICounter.NOT_COVERED:
                    counts.add(0);
                    break;
                default:
                    counts.add(line.getInstructionCounter().getCoveredCount());
                    break;
            }
        }
        return new ExecutionCounts(counts);
    }
}
