package com.complexity.inferrer;

import com.complexity.inferrer.processor.SnippetProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main application entry point for the Complexity Inferrer.
 * Estimates the Big-O time and space complexity of Java snippets.
 */
public class ComplexityInferrerApp {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityInferrerApp.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            printUsage();
            System.exit(1);
        }

        String sourcePath = args[0];
        boolean collectMetrics = true;
        Path reportPath = Paths.get(SnippetProcessor.DEFAULT_REPORT_FILE);

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--no-metrics":
                    collectMetrics = false;
                    break;
                case "--report":
                    if (i + 1 >= args.length) {
                        printUsage();
                        System.exit(1);
                    }
                    reportPath = Paths.get(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
                    printUsage();
                    System.exit(1);
            }
        }

        logger.info("Starting Complexity Inferrer");
        logger.info("Target sources: {}", sourcePath);

        try {
            Path path = Paths.get(sourcePath);
            SnippetProcessor processor = new SnippetProcessor(collectMetrics, reportPath);

            int processedFiles = processor.processPath(path);

            logger.info("Processing complete!");
            logger.info("Total files analyzed: {}", processedFiles);
            if (!processor.getParseFailures().isEmpty()) {
                logger.warn("Files that did not parse: {}", processor.getParseFailures());
            }

        } catch (Exception e) {
            logger.error("Error analyzing sources", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar complexity-inferrer.jar <path-to-java-sources> [--no-metrics] [--report <file>]");
        System.err.println("Example: java -jar complexity-inferrer.jar experiment/sample_code");
    }
}
