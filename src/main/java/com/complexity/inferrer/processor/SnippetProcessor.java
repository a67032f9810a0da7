package com.complexity.inferrer.processor;

import com.complexity.inferrer.analysis.ComplexityAnalyzer;
import com.complexity.inferrer.analysis.IdiomCatalog;
import com.complexity.inferrer.evaluation.MetricsCollector;
import com.complexity.inferrer.model.ClassificationResult;
import com.complexity.inferrer.model.ComplexityExpectation;
import com.complexity.inferrer.parser.ExpectationReader;
import com.complexity.inferrer.parser.JavaSnippet;
import com.complexity.inferrer.parser.JavaSnippetParser;
import com.complexity.inferrer.parser.JavaSyntaxLowering;
import com.complexity.inferrer.parser.ParseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the complexity engine over Java sources. Every {@code .java} file is
 * analyzed as one snippet; a {@code @Complexity} annotation in the file is
 * compared against the inferred labels.
 */
public class SnippetProcessor {

    private static final Logger logger = LoggerFactory.getLogger(SnippetProcessor.class);

    public static final String DEFAULT_REPORT_FILE = "complexity-inference-metrics.json";

    private final JavaSnippetParser snippetParser;
    private final JavaSyntaxLowering lowering;
    private final ExpectationReader expectationReader;
    private final ComplexityAnalyzer analyzer;
    private final MetricsCollector metricsCollector;
    private final boolean collectMetrics;
    private final Path reportPath;
    private final Map<Path, ClassificationResult> results = new LinkedHashMap<>();

    public SnippetProcessor() {
        this(true); // Enable metrics by default
    }

    public SnippetProcessor(boolean collectMetrics) {
        this(collectMetrics, Paths.get(DEFAULT_REPORT_FILE));
    }

    public SnippetProcessor(boolean collectMetrics, Path reportPath) {
        this.snippetParser = new JavaSnippetParser();
        this.lowering = new JavaSyntaxLowering();
        this.expectationReader = new ExpectationReader();
        this.analyzer = new ComplexityAnalyzer(IdiomCatalog.java());
        this.collectMetrics = collectMetrics;
        this.metricsCollector = collectMetrics ? new MetricsCollector() : null;
        this.reportPath = reportPath;
    }

    /**
     * Analyzes a single {@code .java} file or every {@code .java} file below a directory.
     *
     * @param sourcePath file or directory to analyze
     * @return number of files analyzed
     * @throws IOException if the path does not exist or cannot be walked
     */
    public int processPath(Path sourcePath) throws IOException {
        if (!Files.exists(sourcePath)) {
            throw new IOException("Path does not exist: " + sourcePath);
        }

        if (collectMetrics) {
            metricsCollector.startAnalysis();
        }

        List<Path> javaFiles;
        try (Stream<Path> paths = Files.walk(sourcePath)) {
            javaFiles = paths.filter(Files::isRegularFile)
                    .filter(path -> path.toString().endsWith(".java"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        logger.info("Found {} Java files", javaFiles.size());

        int processed = 0;
        for (Path javaFile : javaFiles) {
            try {
                String source = Files.readString(javaFile);
                processFile(javaFile, source);
                processed++;
            } catch (Exception e) {
                logger.error("Error analyzing file: {}", javaFile, e);
            }
        }

        if (collectMetrics) {
            metricsCollector.endAnalysis();
            metricsCollector.printReport();
            try {
                metricsCollector.exportJSON(reportPath);
            } catch (IOException e) {
                logger.warn("Failed to export metrics to {}", reportPath, e);
            }
        }

        return processed;
    }

    private void processFile(Path javaFile, String source) {
        JavaSnippet snippet = snippetParser.parseJava(source);
        Optional<ComplexityExpectation> expectation = snippet.getRoot().flatMap(expectationReader::read);
        ParseOutcome outcome = snippet.isParsed()
                ? ParseOutcome.success(lowering.lower(snippet.getRoot().get()))
                : ParseOutcome.failure(snippet.getDiagnostic());

        ClassificationResult result = analyzer.analyze(outcome);
        results.put(javaFile, result);
        logResult(javaFile, result);

        if (collectMetrics) {
            metricsCollector.recordSnippet(javaFile.getFileName().toString(), result, expectation);
        }
    }

    private static void logResult(Path javaFile, ClassificationResult result) {
        if (!result.isSuccess()) {
            logger.warn("{}: parse failure: {}", javaFile, ((ClassificationResult.ParseFailure) result).getMessage());
            return;
        }
        ClassificationResult.Success success = (ClassificationResult.Success) result;
        logger.info("{}: time {} space {}", javaFile, success.getTimeLabel(), success.getSpaceLabel());
        success.getTimeNotes().forEach(note -> logger.debug("  time: {}", note));
        success.getSpaceNotes().forEach(note -> logger.debug("  space: {}", note));
    }

    /**
     * Analyzes one snippet of Java source without touching the file system or metrics.
     */
    public ClassificationResult processSource(String source) {
        return analyzer.analyze(snippetParser.parse(source));
    }

    public Map<Path, ClassificationResult> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public List<Path> getParseFailures() {
        List<Path> failures = new ArrayList<>();
        results.forEach((path, result) -> {
            if (!result.isSuccess()) {
                failures.add(path);
            }
        });
        return failures;
    }

    public Optional<MetricsCollector> getMetricsCollector() {
        return Optional.ofNullable(metricsCollector);
    }
}
