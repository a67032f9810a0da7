package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Comprehension;
import com.complexity.inferrer.ast.Operator;
import com.complexity.inferrer.ast.Parameter;
import com.complexity.inferrer.ast.Snippet;
import com.complexity.inferrer.model.ClassificationResult;
import com.complexity.inferrer.model.ComplexityLabel;
import com.complexity.inferrer.parser.ParseOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.complexity.inferrer.ast.SyntaxTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class ComplexityAnalyzerTest {

    private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();

    @Test
    void straightLineCodeIsConstant() {
        Snippet tree = snippet(def("add", params("a", "b"), ret(other(name("a"), name("b")))));

        ClassificationResult.Success result = analyzer.analyze(tree);

        assertEquals(ComplexityLabel.CONSTANT, result.getTimeLabel());
        assertEquals(ComplexityLabel.CONSTANT, result.getSpaceLabel());
        assertEquals(List.of("No loops or recursion → constant time"), result.getTimeNotes());
        assertEquals(List.of("Only scalar / fixed-size variables → constant space"), result.getSpaceNotes());
    }

    @ParameterizedTest
    @CsvSource({
            "1, O(n)",
            "2, O(n²)",
            "3, O(n³)",
            "4, O(n^4)",
            "5, O(n^5)"
    })
    void nestedLoopsGivePolynomialTime(int depth, String expected) {
        ClassificationResult.Success result = analyzer.analyze(snippet(nestedLoops(depth)));

        assertEquals(expected, result.getTimeLabel().getText());
        assertEquals(ComplexityLabel.CONSTANT, result.getSpaceLabel());
        assertEquals(depth, result.getSignals().getLoopDepth());
    }

    @Test
    void constantRangeNeverAddsDepth() {
        Snippet tree = snippet(
                forIn(range(lit(1), lit(11)),
                        forIn(range("n"), stmt(name("x")))),
                forIn(range(lit(5)), stmt(name("y"))));

        ClassificationResult.Success result = analyzer.analyze(tree);

        assertEquals(ComplexityLabel.LINEAR, result.getTimeLabel());
        assertEquals(1, result.getSignals().getLoopDepth());
        assertEquals(List.of("range(1, 11)", "range(5)"), result.getSignals().getConstantLoops());
    }

    @Test
    void onlyConstantRangesAreConstantTime() {
        Snippet tree = snippet(forIn(range(lit(1), lit(11)), forIn(range(lit(3)), stmt(name("x")))));

        ClassificationResult.Success result = analyzer.analyze(tree);

        assertEquals(ComplexityLabel.CONSTANT, result.getTimeLabel());
        assertEquals(List.of("Loop(s) over fixed range (range(1, 11), range(3)) → constant time"),
                result.getTimeNotes());
    }

    @Test
    @DisplayName("def f(n, i=1): if i > 10: return; f(n, i + 1) is constant")
    void constantBoundedRecursion() {
        Snippet tree = snippet(def("f", List.of(new Parameter("n"), param("i", 1)),
                ifThen(other(name("i"), lit(10)), bareReturn()),
                forIn(range("n"), stmt(name("x"))),
                stmt(call("f", name("n"), other(name("i"), lit(1))))));

        ClassificationResult.Success result = analyzer.analyze(tree);

        assertEquals(ComplexityLabel.CONSTANT, result.getTimeLabel());
        assertEquals(ComplexityLabel.CONSTANT, result.getSpaceLabel());
        assertTrue(result.getSignals().isConstantRecursion());
        assertFalse(result.getTimeNotes().contains("Recursive function call(s) present"));
    }

    @Test
    @DisplayName("def f(n): if n == 0: return 1; return n * f(n - 1) is linear")
    void linearRecursion() {
        Snippet tree = snippet(def("f", params("n"),
                ifThen(other(name("n"), lit(0)), ret(lit(1))),
                ret(other(name("n"), call("f", other(name("n"), lit(1)))))));

        ClassificationResult.Success result = analyzer.analyze(tree);

        assertEquals(ComplexityLabel.LINEAR, result.getTimeLabel());
        assertEquals(ComplexityLabel.LINEAR, result.getSpaceLabel());
        assertEquals(List.of("Linear recursion (single path, no branching)", "Recursive function call(s) present"),
                result.getTimeNotes());
        assertEquals(List.of("Recursive call stack → O(n) depth"), result.getSpaceNotes());
    }

    @Test
    void halvingRecursionIsLogarithmic() {
        Snippet tree = snippet(def("f", params("n"),
                ifThen(other(name("n"), lit(0)), ret(lit(0))),
                ret(other(call("f", op(Operator.FLOOR_DIV, name("n"), lit(2))), lit(1)))));

        ClassificationResult.Success result = analyzer.analyze(tree);

        assertEquals(ComplexityLabel.LOGARITHMIC, result.getTimeLabel());
        assertEquals(ComplexityLabel.LOGARITHMIC, result.getSpaceLabel());
        assertEquals("Recursive call divides its input by 2 → log₂ n calls", result.getTimeNotes().get(0));
        assertEquals(List.of("Recursive call stack shrinks by 2 per call → O(log n) depth"), result.getSpaceNotes());
    }

    @Test
    void whileLoopWithMidpointIsLogarithmic() {
        Snippet tree = snippet(def("search", params("xs", "t"),
                whileLoop(other(name("lo"), name("hi")),
                        stmt(op(Operator.FLOOR_DIV, other(name("lo"), name("hi")), lit(2))))));

        ClassificationResult.Success result = analyzer.analyze(tree);

        assertEquals(ComplexityLabel.LOGARITHMIC, result.getTimeLabel());
        assertEquals(ComplexityLabel.CONSTANT, result.getSpaceLabel());
        assertTrue(result.getSignals().hasHalving());
        assertEquals(List.of("Halving pattern in loop → binary search (log₂ n)"), result.getTimeNotes());
    }

    @Test
    @DisplayName("sum(x for x in [y for y in a]) is linear: the source is built before the loop")
    void generatorOverListComprehensionIsLinear() {
        Snippet tree = snippet(stmt(call("sum", comprehension(Comprehension.Kind.GENERATOR, name("x"),
                comprehension(Comprehension.Kind.LIST, name("y"), name("a"))))));

        ClassificationResult.Success result = analyzer.analyze(tree);

        assertEquals(ComplexityLabel.LINEAR, result.getTimeLabel());
        assertEquals(1, result.getSignals().getLoopDepth());
        assertEquals(ComplexityLabel.LINEAR, result.getSpaceLabel());
    }

    @Test
    @DisplayName("return sorted([x for x in range(n)]) is n log n time, linear space")
    void sortedListComprehension() {
        Snippet tree = snippet(ret(call("sorted",
                comprehension(Comprehension.Kind.LIST, name("x"), range("n")))));

        ClassificationResult.Success result = analyzer.analyze(tree);

        assertEquals(ComplexityLabel.LINEARITHMIC, result.getTimeLabel());
        assertEquals(ComplexityLabel.LINEAR, result.getSpaceLabel());
        assertEquals("Built-in sort / sorted → O(n log n)", result.getTimeNotes().get(0));
        assertTrue(result.getTimeNotes().contains("Sorting operation detected"));
        assertEquals(List.of("Dynamic structure(s) allocated: list"), result.getSpaceNotes());
    }

    @Test
    void repeatedAnalysisIsIdentical() {
        Snippet tree = snippet(
                def("f", params("n"), ret(call("f", op(Operator.RIGHT_SHIFT, name("n"), lit(1))))),
                forIn(range("n"), forIn(range("m"), stmt(list(name("x"))))));

        ClassificationResult.Success first = analyzer.analyze(tree);
        ClassificationResult.Success second = analyzer.analyze(tree);

        assertEquals(first, second);
        assertEquals(first.toString(), second.toString());
    }

    @Test
    void parseFailureSkipsTheWalkAndKeepsTheMessage() {
        String diagnostic = "invalid syntax (<unknown>, line 1)";

        ClassificationResult result = analyzer.analyze(ParseOutcome.failure(diagnostic));

        assertFalse(result.isSuccess());
        assertInstanceOf(ClassificationResult.ParseFailure.class, result);
        assertEquals(diagnostic, ((ClassificationResult.ParseFailure) result).getMessage());
    }

    @Test
    void successfulOutcomeIsAnalyzed() {
        ClassificationResult result = analyzer.analyze(ParseOutcome.success(snippet(nestedLoops(2))));

        assertTrue(result.isSuccess());
        assertEquals(ComplexityLabel.QUADRATIC, ((ClassificationResult.Success) result).getTimeLabel());
    }
}
