package com.complexity.inferrer.analysis;

import com.complexity.inferrer.model.ClassificationResult;
import com.complexity.inferrer.model.ComplexityLabel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityClassifierTest {

    private ComplexityClassifier classifier;
    private AnalysisRecord record;

    @BeforeEach
    void setUp() {
        classifier = new ComplexityClassifier();
        record = new AnalysisRecord();
    }

    private void loops(int depth) {
        record.enterLoops(depth);
        record.exitLoops(depth);
    }

    @Test
    void constantRecursionBeatsEverything() {
        record.markRecursion();
        record.markConstantRecursion();
        record.markSort();
        record.addDynamicStructure("list");
        loops(3);

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(ComplexityLabel.CONSTANT, result.getTimeLabel());
        assertEquals(ComplexityLabel.CONSTANT, result.getSpaceLabel());
        assertEquals(List.of(
                "Recursion bounded by a constant counter → fixed call depth",
                "Recursive calls always run the same number of times",
                "Sorting operation detected"), result.getTimeNotes());
        assertEquals(List.of("Call stack depth is fixed by a constant → constant space"), result.getSpaceNotes());
    }

    @Test
    void logRecursionWithCustomDivisor() {
        record.markRecursion();
        record.markLogRecursion(3);

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(ComplexityLabel.LOGARITHMIC, result.getTimeLabel());
        assertEquals("Recursive call divides its input by 3 → log base 3 of n calls", result.getTimeNotes().get(0));
        assertEquals(List.of("Recursive call stack shrinks by 3 per call → O(log n) depth"), result.getSpaceNotes());
    }

    @Test
    void recursionWithHalvingLoopIsDivideAndConquer() {
        record.markRecursion();
        record.markHalving();
        loops(1);

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(ComplexityLabel.LOGARITHMIC, result.getTimeLabel());
        assertEquals("Recursive halving → divide & conquer", result.getTimeNotes().get(0));
        assertEquals(ComplexityLabel.LINEAR, result.getSpaceLabel());
    }

    @Test
    void recursionWithLoopsIsLinearithmic() {
        record.markRecursion();
        loops(1);

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(ComplexityLabel.LINEARITHMIC, result.getTimeLabel());
        assertEquals(List.of("Recursion + 1 loop level(s)", "Recursive function call(s) present"),
                result.getTimeNotes());
    }

    @Test
    void sortInsideLoopsStaysLinearithmic() {
        record.markSort();
        loops(2);

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(ComplexityLabel.LINEARITHMIC, result.getTimeLabel());
        assertEquals(List.of(
                "Built-in sort / sorted → O(n log n)",
                "Sort called inside 2 loop(s)",
                "Sorting operation detected"), result.getTimeNotes());
    }

    @Test
    void stringConversionWithoutLoopsIsLogarithmic() {
        record.markStrConversion();
        record.markImplicitIteration();

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(ComplexityLabel.LOGARITHMIC, result.getTimeLabel());
        assertEquals(ComplexityLabel.LOGARITHMIC, result.getSpaceLabel());
        assertEquals(List.of("String of the number's digits → O(log n) characters"), result.getSpaceNotes());
    }

    @Test
    void implicitIterationWithoutLoopsIsLinear() {
        record.markImplicitIteration();

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(ComplexityLabel.LINEAR, result.getTimeLabel());
        assertEquals(List.of("Built-in call iterates its input implicitly → linear time"), result.getTimeNotes());
        assertEquals(ComplexityLabel.CONSTANT, result.getSpaceLabel());
    }

    @Test
    void sqrtLoopBeatsLogLoop() {
        record.markSqrtLoop();
        record.markLogLoop(2);
        loops(1);

        assertEquals(ComplexityLabel.SQUARE_ROOT, classifier.classify(record).getTimeLabel());
    }

    @Test
    void digitLoopNote() {
        record.markStrLoop();
        record.markLogLoop(10);
        loops(1);

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(ComplexityLabel.LOGARITHMIC, result.getTimeLabel());
        assertEquals(List.of("Loop over the digits of a number → log₁₀ n iterations"), result.getTimeNotes());
        assertEquals(ComplexityLabel.LOGARITHMIC, result.getSpaceLabel());
    }

    @Test
    void divisionByTenWithoutStringLoop() {
        record.markLogLoop(10);
        loops(1);

        assertEquals(List.of("Loop divides by 10 each step → log₁₀ n"), classifier.classify(record).getTimeNotes());
    }

    @Test
    void logLoopIgnoredAtDepthTwo() {
        record.markLogLoop(2);
        loops(2);

        assertEquals(ComplexityLabel.QUADRATIC, classifier.classify(record).getTimeLabel());
    }

    @Test
    void deepNestingIsPolynomial() {
        loops(6);

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals("O(n^6)", result.getTimeLabel().getText());
        assertEquals(List.of("6 nested loops → polynomial time"), result.getTimeNotes());
    }

    @Test
    void dynamicStructuresAreListedOnceEach() {
        record.addDynamicStructure("set");
        record.addDynamicStructure("list");
        record.addDynamicStructure("set");

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(ComplexityLabel.LINEAR, result.getSpaceLabel());
        assertEquals(List.of("Dynamic structure(s) allocated: list, set"), result.getSpaceNotes());
    }

    @Test
    void dynamicStructuresBeatStringSpace() {
        record.markStrLoop();
        record.addDynamicStructure("dict");

        assertEquals(ComplexityLabel.LINEAR, classifier.classify(record).getSpaceLabel());
    }

    @Test
    void signalsMirrorTheRecord() {
        record.markRecursion();
        record.markSort();
        record.addConstantLoop("range(10)");
        loops(2);

        ClassificationResult.Success result = classifier.classify(record);

        assertEquals(2, result.getSignals().getLoopDepth());
        assertTrue(result.getSignals().hasRecursion());
        assertTrue(result.getSignals().hasSort());
        assertFalse(result.getSignals().hasHalving());
        assertEquals(List.of("range(10)"), result.getSignals().getConstantLoops());
    }
}
