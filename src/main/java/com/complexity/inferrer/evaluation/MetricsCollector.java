package com.complexity.inferrer.evaluation;

import com.complexity.inferrer.model.ClassificationResult;
import com.complexity.inferrer.model.ComplexityExpectation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Collects metrics over a batch of analyzed snippets: label distributions,
 * parse failures and agreement with declared expectations.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    // Timing metrics
    private Instant startTime;
    private Instant endTime;
    private long totalAnalysisTimeMs = 0;

    // Snippet counts
    private int totalSnippets = 0;
    private int parseFailures = 0;
    private int exoticLabels = 0;

    // Label distributions
    private final Map<String, Integer> timeDistribution = new TreeMap<>();
    private final Map<String, Integer> spaceDistribution = new TreeMap<>();

    // Expectation agreement
    private int expectationsChecked = 0;
    private int timeMatches = 0;
    private int spaceMatches = 0;
    private final List<String> mismatches = new ArrayList<>();

    /**
     * Start timing the analysis.
     */
    public void startAnalysis() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    /**
     * End timing the analysis.
     */
    public void endAnalysis() {
        this.endTime = Instant.now();
        if (startTime != null) {
            this.totalAnalysisTimeMs = Duration.between(startTime, endTime).toMillis();
        }
        logger.info("Metrics collection completed in {}ms", totalAnalysisTimeMs);
    }

    /**
     * Record the outcome of one snippet.
     *
     * @param snippetName name used in mismatch reports, usually the file name
     * @param result the classification
     * @param expectation declared labels, if the snippet has any
     */
    public void recordSnippet(String snippetName, ClassificationResult result,
                              Optional<ComplexityExpectation> expectation) {
        totalSnippets++;

        if (!result.isSuccess()) {
            parseFailures++;
            return;
        }

        ClassificationResult.Success success = (ClassificationResult.Success) result;
        timeDistribution.merge(success.getTimeLabel().getText(), 1, Integer::sum);
        spaceDistribution.merge(success.getSpaceLabel().getText(), 1, Integer::sum);
        if (success.getTimeLabel().isExotic()) exoticLabels++;
        if (success.getSpaceLabel().isExotic()) exoticLabels++;

        expectation.ifPresent(expected -> recordExpectation(snippetName, success, expected));
    }

    private void recordExpectation(String snippetName, ClassificationResult.Success result,
                                   ComplexityExpectation expected) {
        expectationsChecked++;
        boolean timeOk = expected.matchesTime(result);
        boolean spaceOk = expected.matchesSpace(result);
        if (timeOk) timeMatches++;
        if (spaceOk) spaceMatches++;

        if (!timeOk || !spaceOk) {
            String mismatch = String.format("%s#%s: expected time=%s space=%s, inferred time=%s space=%s",
                    snippetName, expected.getDeclaredOn(),
                    expected.getTime().map(Object::toString).orElse("-"),
                    expected.getSpace().map(Object::toString).orElse("-"),
                    result.getTimeLabel(), result.getSpaceLabel());
            mismatches.add(mismatch);
            logger.warn("Expectation mismatch: {}", mismatch);
        }
    }

    public int getTotalSnippets() {
        return totalSnippets;
    }

    public int getParseFailures() {
        return parseFailures;
    }

    public List<String> getMismatches() {
        return Collections.unmodifiableList(mismatches);
    }

    /**
     * Generate a metrics report.
     */
    public MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        report.totalAnalysisTimeMs = totalAnalysisTimeMs;
        report.averageTimePerSnippet = totalSnippets > 0 ? (double) totalAnalysisTimeMs / totalSnippets : 0;

        report.totalSnippets = totalSnippets;
        report.parseFailures = parseFailures;
        report.exoticLabels = exoticLabels;

        report.timeDistribution = new TreeMap<>(timeDistribution);
        report.spaceDistribution = new TreeMap<>(spaceDistribution);

        report.expectationsChecked = expectationsChecked;
        report.timeAccuracy = calculatePercentage(timeMatches, expectationsChecked);
        report.spaceAccuracy = calculatePercentage(spaceMatches, expectationsChecked);
        report.mismatches = new ArrayList<>(mismatches);

        return report;
    }

    /**
     * Export metrics to JSON for further analysis.
     */
    public void exportJSON(Path outputPath) throws IOException {
        MetricsReport report = generateReport();

        try (FileWriter writer = new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8)) {
            writer.write("{\n");
            writer.write("  \"timing\": {\n");
            writer.write(String.format(Locale.ROOT, "    \"totalAnalysisTimeMs\": %d,\n", report.totalAnalysisTimeMs));
            writer.write(String.format(Locale.ROOT, "    \"averageTimePerSnippet\": %.2f\n", report.averageTimePerSnippet));
            writer.write("  },\n");

            writer.write("  \"snippets\": {\n");
            writer.write(String.format(Locale.ROOT, "    \"total\": %d,\n", report.totalSnippets));
            writer.write(String.format(Locale.ROOT, "    \"parseFailures\": %d,\n", report.parseFailures));
            writer.write(String.format(Locale.ROOT, "    \"exoticLabels\": %d\n", report.exoticLabels));
            writer.write("  },\n");

            writeDistribution(writer, "timeDistribution", report.timeDistribution);
            writer.write(",\n");
            writeDistribution(writer, "spaceDistribution", report.spaceDistribution);
            writer.write(",\n");

            writer.write("  \"expectations\": {\n");
            writer.write(String.format(Locale.ROOT, "    \"checked\": %d,\n", report.expectationsChecked));
            writer.write(String.format(Locale.ROOT, "    \"timeAccuracy\": %.2f,\n", report.timeAccuracy));
            writer.write(String.format(Locale.ROOT, "    \"spaceAccuracy\": %.2f,\n", report.spaceAccuracy));
            writer.write("    \"mismatches\": [");
            for (int i = 0; i < report.mismatches.size(); i++) {
                writer.write(i == 0 ? "\n" : ",\n");
                writer.write("      \"" + escape(report.mismatches.get(i)) + "\"");
            }
            writer.write(report.mismatches.isEmpty() ? "]\n" : "\n    ]\n");
            writer.write("  }\n");

            writer.write("}\n");
        }

        logger.info("Metrics exported to: {}", outputPath);
    }

    private static void writeDistribution(FileWriter writer, String name, Map<String, Integer> distribution)
            throws IOException {
        writer.write("  \"" + name + "\": {");
        int count = 0;
        for (Map.Entry<String, Integer> entry : distribution.entrySet()) {
            writer.write(count == 0 ? "\n" : ",\n");
            writer.write(String.format(Locale.ROOT, "    \"%s\": %d", escape(entry.getKey()), entry.getValue()));
            count++;
        }
        writer.write(count == 0 ? "}" : "\n  }");
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Print a human-readable report to console.
     */
    public void printReport() {
        MetricsReport report = generateReport();

        System.out.println("\n" + "=".repeat(80));
        System.out.println("COMPLEXITY INFERENCE - METRICS REPORT");
        System.out.println("=".repeat(80));

        System.out.println("\n[TIMING]");
        System.out.printf("  Total Analysis Time: %.2f seconds\n", report.totalAnalysisTimeMs / 1000.0);
        System.out.printf("  Average Time per Snippet: %.2f ms\n", report.averageTimePerSnippet);

        System.out.println("\n[SNIPPETS]");
        System.out.printf("  Snippets Analyzed: %d\n", report.totalSnippets);
        System.out.printf("  Parse Failures:    %d\n", report.parseFailures);
        System.out.printf("  Exotic Labels:     %d\n", report.exoticLabels);

        System.out.println("\n[TIME COMPLEXITY]");
        report.timeDistribution.forEach((label, count) ->
                System.out.printf("  %-15s: %,6d snippets\n", label, count));

        System.out.println("\n[SPACE COMPLEXITY]");
        report.spaceDistribution.forEach((label, count) ->
                System.out.printf("  %-15s: %,6d snippets\n", label, count));

        if (report.expectationsChecked > 0) {
            System.out.println("\n[DECLARED EXPECTATIONS]");
            System.out.printf("  Checked:        %d\n", report.expectationsChecked);
            System.out.printf("  Time Accuracy:  %.1f%%\n", report.timeAccuracy);
            System.out.printf("  Space Accuracy: %.1f%%\n", report.spaceAccuracy);
            report.mismatches.forEach(mismatch -> System.out.println("  MISMATCH " + mismatch));
        }

        System.out.println("=".repeat(80) + "\n");
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        // Timing
        public long totalAnalysisTimeMs;
        public double averageTimePerSnippet;

        // Snippets
        public int totalSnippets;
        public int parseFailures;
        public int exoticLabels;

        // Distributions
        public Map<String, Integer> timeDistribution;
        public Map<String, Integer> spaceDistribution;

        // Expectations (accuracy as percentages)
        public int expectationsChecked;
        public double timeAccuracy;
        public double spaceAccuracy;
        public List<String> mismatches;
    }
}
