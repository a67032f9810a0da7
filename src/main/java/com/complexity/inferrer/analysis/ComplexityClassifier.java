package com.complexity.inferrer.analysis;

import com.complexity.inferrer.model.ClassificationResult;
import com.complexity.inferrer.model.ComplexityLabel;
import com.complexity.inferrer.model.SignalSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a finished {@link AnalysisRecord} into time and space labels with
 * notes. Both rule chains are priority ordered and the first matching rule
 * wins; the order is significant for snippets that match several patterns.
 */
public class ComplexityClassifier {

    public ClassificationResult.Success classify(AnalysisRecord record) {
        List<String> timeNotes = new ArrayList<>();
        List<String> spaceNotes = new ArrayList<>();

        ComplexityLabel time = classifyTime(record, timeNotes);
        ComplexityLabel space = classifySpace(record, spaceNotes);

        SignalSummary signals = new SignalSummary(
                record.getLoopDepthMax(),
                record.hasRecursion(),
                record.isConstantRecursion(),
                record.hasSort(),
                record.hasHalving(),
                record.getConstantLoopDescriptions());

        return ClassificationResult.success(time, space, timeNotes, spaceNotes, signals);
    }

    private ComplexityLabel classifyTime(AnalysisRecord record, List<String> notes) {
        int depth = record.getLoopDepthMax();
        ComplexityLabel label;

        if (record.hasRecursion() && record.isConstantRecursion()) {
            label = ComplexityLabel.CONSTANT;
            notes.add("Recursion bounded by a constant counter → fixed call depth");
            notes.add("Recursive calls always run the same number of times");
        } else if (record.hasRecursion()) {
            if (record.hasLogRecursion()) {
                label = ComplexityLabel.LOGARITHMIC;
                notes.add("Recursive call divides its input by " + record.getLogRecursionDivisor()
                        + " → " + logOf(record.getLogRecursionDivisor()) + " calls");
            } else if (record.hasHalving()) {
                label = ComplexityLabel.LOGARITHMIC;
                notes.add("Recursive halving → divide & conquer");
            } else if (depth == 0) {
                label = ComplexityLabel.LINEAR;
                notes.add("Linear recursion (single path, no branching)");
            } else {
                label = ComplexityLabel.LINEARITHMIC;
                notes.add("Recursion + " + depth + " loop level(s)");
            }
        } else if (record.hasSort()) {
            label = ComplexityLabel.LINEARITHMIC;
            notes.add("Built-in sort / sorted → O(n log n)");
            if (depth >= 1) {
                notes.add("Sort called inside " + depth + " loop(s)");
            }
        } else if (depth == 0) {
            if (record.hasStrConversion()) {
                label = ComplexityLabel.LOGARITHMIC;
                notes.add("Number converted to string → work grows with its digit count (log₁₀ n)");
            } else if (record.hasImplicitIteration()) {
                label = ComplexityLabel.LINEAR;
                notes.add("Built-in call iterates its input implicitly → linear time");
            } else {
                label = ComplexityLabel.CONSTANT;
                if (record.getConstantLoopDescriptions().isEmpty()) {
                    notes.add("No loops or recursion → constant time");
                } else {
                    notes.add("Loop(s) over fixed range (" + String.join(", ", record.getConstantLoopDescriptions())
                            + ") → constant time");
                }
            }
        } else if (depth == 1) {
            if (record.hasSqrtLoop()) {
                label = ComplexityLabel.SQUARE_ROOT;
                notes.add("Loop bound is √n → square-root time");
            } else if (record.hasLogLoop()) {
                label = ComplexityLabel.LOGARITHMIC;
                notes.add(logLoopNote(record));
            } else {
                label = ComplexityLabel.LINEAR;
                notes.add("Single loop → linear time");
            }
        } else if (depth == 2) {
            label = ComplexityLabel.QUADRATIC;
            notes.add("2 nested loops → quadratic time");
        } else if (depth == 3) {
            label = ComplexityLabel.CUBIC;
            notes.add("3 nested loops → cubic time");
        } else {
            label = ComplexityLabel.polynomial(depth);
            notes.add(depth + " nested loops → polynomial time");
        }

        if (record.hasRecursion() && !record.isConstantRecursion()) {
            notes.add("Recursive function call(s) present");
        }
        if (record.hasSort()) {
            notes.add("Sorting operation detected");
        }
        return label;
    }

    private ComplexityLabel classifySpace(AnalysisRecord record, List<String> notes) {
        if (record.hasRecursion() && record.isConstantRecursion()) {
            notes.add("Call stack depth is fixed by a constant → constant space");
            return ComplexityLabel.CONSTANT;
        }
        if (record.hasRecursion() && record.hasLogRecursion()) {
            notes.add("Recursive call stack shrinks by " + record.getLogRecursionDivisor()
                    + " per call → O(log n) depth");
            return ComplexityLabel.LOGARITHMIC;
        }
        if (record.hasRecursion()) {
            notes.add("Recursive call stack → O(n) depth");
            return ComplexityLabel.LINEAR;
        }
        if (!record.getDynamicStructureKinds().isEmpty()) {
            notes.add("Dynamic structure(s) allocated: " + String.join(", ", record.getDistinctStructureKinds()));
            return ComplexityLabel.LINEAR;
        }
        if (record.hasStrLoop() || record.hasStrConversion()) {
            notes.add("String of the number's digits → O(log n) characters");
            return ComplexityLabel.LOGARITHMIC;
        }
        notes.add("Only scalar / fixed-size variables → constant space");
        return ComplexityLabel.CONSTANT;
    }

    private static String logLoopNote(AnalysisRecord record) {
        int divisor = record.getLogDivisor();
        if (record.hasStrLoop() && divisor == 10) {
            return "Loop over the digits of a number → log₁₀ n iterations";
        }
        if (divisor == 2) {
            return "Halving pattern in loop → binary search (log₂ n)";
        }
        return "Loop divides by " + divisor + " each step → " + logOf(divisor);
    }

    private static String logOf(int divisor) {
        return switch (divisor) {
            case 2 -> "log₂ n";
            case 10 -> "log₁₀ n";
            default -> "log base " + divisor + " of n";
        };
    }
}
