package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.SyntaxNode;
import com.complexity.inferrer.model.ClassificationResult;
import com.complexity.inferrer.parser.ParseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the complexity engine: walks a parsed snippet and classifies
 * the collected signals. A parse failure is passed through as a
 * {@link ClassificationResult.ParseFailure} without walking anything.
 *
 * Each call uses its own {@link AnalysisRecord}, so a single analyzer may be
 * shared between threads.
 */
public class ComplexityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final ComplexityWalker walker;
    private final ComplexityClassifier classifier;

    public ComplexityAnalyzer() {
        this(IdiomCatalog.standard(), ScanScope.WHOLE_SUBTREE);
    }

    public ComplexityAnalyzer(IdiomCatalog catalog) {
        this(catalog, ScanScope.WHOLE_SUBTREE);
    }

    public ComplexityAnalyzer(IdiomCatalog catalog, ScanScope scanScope) {
        this.walker = new ComplexityWalker(catalog, scanScope);
        this.classifier = new ComplexityClassifier();
    }

    public ClassificationResult analyze(ParseOutcome outcome) {
        if (!outcome.isSuccessful()) {
            logger.debug("Skipping analysis, snippet did not parse: {}", outcome.getDiagnostic());
            return ClassificationResult.parseFailure(outcome.getDiagnostic());
        }
        return analyze(outcome.getTree());
    }

    public ClassificationResult.Success analyze(SyntaxNode tree) {
        AnalysisRecord record = walker.walk(tree);
        ClassificationResult.Success result = classifier.classify(record);
        logger.debug("Classified snippet: {} ({})", result, result.getSignals());
        return result;
    }
}
