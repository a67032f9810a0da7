package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Comprehension;
import com.complexity.inferrer.ast.ComprehensionClause;
import com.complexity.inferrer.ast.ContainerLiteral;
import com.complexity.inferrer.ast.Operator;
import com.complexity.inferrer.ast.Parameter;
import com.complexity.inferrer.ast.SyntaxNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.complexity.inferrer.ast.SyntaxTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class ComplexityWalkerTest {

    private final ComplexityWalker walker = new ComplexityWalker();

    private AnalysisRecord walk(SyntaxNode... body) {
        return walker.walk(snippet(body));
    }

    @Nested
    @DisplayName("for loops")
    class ForLoops {

        @Test
        void variableRangeEntersOneLevel() {
            AnalysisRecord record = walk(forIn(range("n"), stmt(name("x"))));

            assertEquals(1, record.getLoopDepthMax());
            assertEquals(0, record.getLoopDepthCurrent());
            assertTrue(record.getConstantLoopDescriptions().isEmpty());
        }

        @Test
        void siblingLoopsDoNotNest() {
            AnalysisRecord record = walk(
                    forIn(range("n"), stmt(name("x"))),
                    forIn(name("xs"), stmt(name("y"))));

            assertEquals(1, record.getLoopDepthMax());
        }

        @Test
        void constantRangeIsDescribedWithoutDepth() {
            AnalysisRecord record = walk(forIn(range(lit(0), lit(10), lit(2)), stmt(name("x"))));

            assertEquals(0, record.getLoopDepthMax());
            assertEquals(List.of("range(0, 10, 2)"), record.getConstantLoopDescriptions());
        }

        @Test
        void loopsInsideConstantRangeStillCount() {
            AnalysisRecord record = walk(forIn(range(lit(3)), forIn(range("n"), forIn(range("m"), stmt(name("x"))))));

            assertEquals(2, record.getLoopDepthMax());
            assertEquals(List.of("range(3)"), record.getConstantLoopDescriptions());
        }

        @Test
        void rangeWithTooManyArgumentsIsNotRangeLike() {
            AnalysisRecord record = walk(forIn(range(lit(0), lit(1), lit(2), lit(3)), stmt(name("x"))));

            assertEquals(1, record.getLoopDepthMax());
            assertTrue(record.getConstantLoopDescriptions().isEmpty());
        }

        @Test
        void stringOfVariableIsDigitLoop() {
            AnalysisRecord record = walk(forIn(call("str", name("n")), stmt(name("d"))));

            assertTrue(record.hasStrLoop());
            assertTrue(record.hasLogLoop());
            assertEquals(10, record.getLogDivisor());
            assertEquals(1, record.getLoopDepthMax());
        }

        @Test
        void stringOfLiteralIsPlainLoop() {
            AnalysisRecord record = walk(forIn(call("str", lit(12345)), stmt(name("d"))));

            assertFalse(record.hasStrLoop());
            assertFalse(record.hasLogLoop());
            assertEquals(1, record.getLoopDepthMax());
        }

        @Test
        void sqrtBoundIsSquareRootLoop() {
            AnalysisRecord record = walk(
                    forIn(range(lit(2), call("isqrt", name("n"))), stmt(name("x"))));

            assertTrue(record.hasSqrtLoop());
            assertEquals(1, record.getLoopDepthMax());
        }

        @Test
        void halfPowerBoundIsSquareRootLoop() {
            AnalysisRecord record = walk(
                    forIn(range(lit(1), other(op(Operator.POWER, name("n"), lit(0.5)), lit(1))), stmt(name("x"))));

            assertTrue(record.hasSqrtLoop());
        }

        @Test
        void oneOverTwoPowerBoundIsSquareRootLoop() {
            AnalysisRecord record = walk(forIn(
                    range(op(Operator.POWER, name("n"), op(Operator.DIVIDE, lit(1), lit(2)))),
                    stmt(name("x"))));

            assertTrue(record.hasSqrtLoop());
        }
    }

    @Nested
    @DisplayName("while loops")
    class WhileLoops {

        @Test
        void floorDivisionInBodyIsLogLoop() {
            AnalysisRecord record = walk(whileLoop(other(name("n"), lit(0)),
                    augAssign(Operator.FLOOR_DIV, "n", lit(3))));

            assertEquals(1, record.getLoopDepthMax());
            assertTrue(record.hasLogLoop());
            assertTrue(record.hasHalving());
            assertEquals(3, record.getLogDivisor());
        }

        @Test
        void rightShiftAlwaysCountsAsTwo() {
            AnalysisRecord record = walk(whileLoop(name("n"), augAssign(Operator.RIGHT_SHIFT, "n", lit(3))));

            assertEquals(2, record.getLogDivisor());
        }

        @Test
        void nonLiteralDivisorDefaultsToTwo() {
            AnalysisRecord record = walk(whileLoop(name("n"), augAssign(Operator.FLOOR_DIV, "n", name("k"))));

            assertEquals(2, record.getLogDivisor());
        }

        @Test
        void firstLogLoopDivisorWins() {
            AnalysisRecord record = walk(
                    whileLoop(name("n"), augAssign(Operator.FLOOR_DIV, "n", lit(10))),
                    whileLoop(name("m"), augAssign(Operator.FLOOR_DIV, "m", lit(2))));

            assertEquals(10, record.getLogDivisor());
        }

        @Test
        void plainWhileLoopIsLinear() {
            AnalysisRecord record = walk(whileLoop(name("running"), augAssign(Operator.OTHER, "i", lit(1))));

            assertEquals(1, record.getLoopDepthMax());
            assertFalse(record.hasLogLoop());
            assertFalse(record.hasHalving());
        }
    }

    @Nested
    @DisplayName("recursion")
    class Recursion {

        @Test
        void selfCallMarksRecursion() {
            AnalysisRecord record = walk(def("walk", params("node"), stmt(call("walk", name("node")))));

            assertTrue(record.hasRecursion());
            assertFalse(record.isConstantRecursion());
            assertFalse(record.hasLogRecursion());
        }

        @Test
        void callToOtherFunctionIsNotRecursion() {
            AnalysisRecord record = walk(def("outer", params("n"), stmt(call("inner", name("n")))));

            assertFalse(record.hasRecursion());
        }

        @Test
        void guardOnNonCounterDisqualifiesConstantRecursion() {
            AnalysisRecord record = walk(def("f", List.of(new Parameter("n"), param("i", 0)),
                    ifThen(other(name("i"), name("n")), bareReturn()),
                    stmt(call("f", name("n"), other(name("i"), lit(1))))));

            assertTrue(record.hasRecursion());
            assertFalse(record.isConstantRecursion());
        }

        @Test
        void rightShiftArgumentIsLogRecursion() {
            AnalysisRecord record = walk(def("f", params("n"),
                    ret(call("f", op(Operator.RIGHT_SHIFT, name("n"), lit(1))))));

            assertTrue(record.hasLogRecursion());
            assertEquals(2, record.getLogRecursionDivisor());
        }
    }

    @Nested
    @DisplayName("comprehensions")
    class Comprehensions {

        @Test
        void listComprehensionRegistersListInsideItsLoop() {
            AnalysisRecord record = walk(stmt(comprehension(Comprehension.Kind.LIST, name("x"), name("xs"))));

            assertEquals(1, record.getLoopDepthMax());
            assertEquals(0, record.getLoopDepthCurrent());
            assertEquals(List.of("list"), record.getDynamicStructureKinds());
        }

        @Test
        void generatorNeverRegistersAContainer() {
            AnalysisRecord record = walk(stmt(call("sum",
                    comprehension(Comprehension.Kind.GENERATOR, name("x"), name("xs")))));

            assertEquals(1, record.getLoopDepthMax());
            assertTrue(record.getDynamicStructureKinds().isEmpty());
        }

        @Test
        void twoClausesAddTwoLevels() {
            AnalysisRecord record = walk(stmt(comprehension(Comprehension.Kind.SET, name("x"), name("xs"), name("ys"))));

            assertEquals(2, record.getLoopDepthMax());
            assertEquals(List.of("set"), record.getDynamicStructureKinds());
        }

        @Test
        void constantClauseIsDescribedAndAddsNoContainer() {
            AnalysisRecord record = walk(stmt(comprehension(Comprehension.Kind.DICT, name("x"), range(lit(10)))));

            assertEquals(0, record.getLoopDepthMax());
            assertEquals(List.of("dict:range(10)"), record.getConstantLoopDescriptions());
            assertTrue(record.getDynamicStructureKinds().isEmpty());
        }

        @Test
        void comprehensionIterableIsWalkedAtTheEnclosingDepth() {
            AnalysisRecord record = walk(stmt(call("sum", comprehension(Comprehension.Kind.GENERATOR, name("x"),
                    comprehension(Comprehension.Kind.LIST, name("y"), name("a"))))));

            assertEquals(1, record.getLoopDepthMax());
            assertEquals(0, record.getLoopDepthCurrent());
            assertEquals(List.of("list"), record.getDynamicStructureKinds());
        }

        @Test
        void comprehensionInElementNestsDeeper() {
            AnalysisRecord record = walk(stmt(comprehension(Comprehension.Kind.LIST,
                    comprehension(Comprehension.Kind.LIST, name("y"), name("row")), name("grid"))));

            assertEquals(2, record.getLoopDepthMax());
            assertEquals(0, record.getLoopDepthCurrent());
            assertEquals(List.of("list", "list"), record.getDynamicStructureKinds());
        }

        @Test
        void clauseConditionIsWalkedInsideTheLoop() {
            Comprehension filtered = new Comprehension(Comprehension.Kind.GENERATOR,
                    List.of(new ComprehensionClause(name("xs"),
                            List.of(call("any", comprehension(Comprehension.Kind.GENERATOR, name("y"), name("ys")))))),
                    name("x"));

            AnalysisRecord record = walk(stmt(call("sum", filtered)));

            assertEquals(2, record.getLoopDepthMax());
        }

        @Test
        void comprehensionInsideLoopNestsDeeper() {
            AnalysisRecord record = walk(forIn(range("n"),
                    stmt(comprehension(Comprehension.Kind.LIST, name("x"), name("xs")))));

            assertEquals(2, record.getLoopDepthMax());
        }
    }

    @Nested
    @DisplayName("calls and containers")
    class CallsAndContainers {

        @Test
        void sortMethodAndSortedBuiltinAreSorts() {
            assertTrue(walk(stmt(method(name("xs"), "sort"))).hasSort());
            assertTrue(walk(stmt(call("sorted", name("xs")))).hasSort());
            assertFalse(walk(stmt(call("sort", name("xs")))).hasSort());
        }

        @Test
        void stringConversionOfVariable() {
            assertTrue(walk(stmt(call("str", name("n")))).hasStrConversion());
            assertFalse(walk(stmt(call("str", lit(5)))).hasStrConversion());
        }

        @Test
        void reductionOverVariableIteratesImplicitly() {
            assertTrue(walk(stmt(call("sum", name("xs")))).hasImplicitIteration());
            assertTrue(walk(stmt(call("list", name("xs")))).hasImplicitIteration());
        }

        @Test
        void reductionOverConstantsDoesNotIterate() {
            assertFalse(walk(stmt(call("max", lit(1), lit(2)))).hasImplicitIteration());
            assertFalse(walk(stmt(call("sum", list(lit(1), lit(2), lit(3))))).hasImplicitIteration());
            assertFalse(walk(stmt(call("sum", range(lit(10))))).hasImplicitIteration());
        }

        @Test
        void linearMethodIteratesImplicitly() {
            assertTrue(walk(stmt(method(name("s"), "split", lit(",")))).hasImplicitIteration());
            assertTrue(walk(stmt(method(lit(", "), "join", name("parts")))).hasImplicitIteration());
        }

        @Test
        void emptyListIsNotAllocation() {
            assertTrue(walk(stmt(list())).getDynamicStructureKinds().isEmpty());
        }

        @Test
        void containerKindsAreRecorded() {
            AnalysisRecord record = walk(
                    stmt(list(lit(1))),
                    stmt(dict()),
                    stmt(new ContainerLiteral(ContainerLiteral.Kind.SET, List.of())),
                    stmt(new ContainerLiteral(ContainerLiteral.Kind.LIST, List.of(), true)));

            assertEquals(List.of("list", "dict", "set", "list"), record.getDynamicStructureKinds());
            assertEquals(List.of("dict", "list", "set"), List.copyOf(record.getDistinctStructureKinds()));
        }
    }

    @Test
    void eachWalkUsesAFreshRecord() {
        SyntaxNode tree = snippet(nestedLoops(2));

        AnalysisRecord first = walker.walk(tree);
        AnalysisRecord second = walker.walk(tree);

        assertNotSame(first, second);
        assertEquals(2, second.getLoopDepthMax());
    }
}
