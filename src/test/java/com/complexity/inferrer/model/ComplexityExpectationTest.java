package com.complexity.inferrer.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityExpectationTest {

    private static ClassificationResult.Success result(ComplexityLabel time, ComplexityLabel space) {
        return ClassificationResult.success(time, space, List.of(), List.of(),
                new SignalSummary(0, false, false, false, false, List.of()));
    }

    @Test
    void matchesWhenBothLabelsAgree() {
        ComplexityExpectation expectation =
                new ComplexityExpectation("search", ComplexityLabel.LOGARITHMIC, ComplexityLabel.CONSTANT);

        assertTrue(expectation.matches(result(ComplexityLabel.LOGARITHMIC, ComplexityLabel.CONSTANT)));
        assertFalse(expectation.matches(result(ComplexityLabel.LINEAR, ComplexityLabel.CONSTANT)));
    }

    @Test
    void missingLabelMatchesAnything() {
        ComplexityExpectation expectation = new ComplexityExpectation("sum", ComplexityLabel.LINEAR, null);

        assertTrue(expectation.getSpace().isEmpty());
        assertTrue(expectation.matchesSpace(result(ComplexityLabel.LINEAR, ComplexityLabel.QUADRATIC)));
        assertFalse(expectation.matchesTime(result(ComplexityLabel.CONSTANT, ComplexityLabel.CONSTANT)));
    }

    @Test
    void parseFailureEqualityIsByMessage() {
        assertEquals(ClassificationResult.parseFailure("bad"), ClassificationResult.parseFailure("bad"));
        assertNotEquals(ClassificationResult.parseFailure("bad"), ClassificationResult.parseFailure("worse"));
    }
}
