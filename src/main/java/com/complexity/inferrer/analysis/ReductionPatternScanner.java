package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.AugmentedAssign;
import com.complexity.inferrer.ast.BinaryOp;
import com.complexity.inferrer.ast.Comprehension;
import com.complexity.inferrer.ast.Constant;
import com.complexity.inferrer.ast.ForLoop;
import com.complexity.inferrer.ast.FunctionDef;
import com.complexity.inferrer.ast.IfStmt;
import com.complexity.inferrer.ast.Operator;
import com.complexity.inferrer.ast.SyntaxNode;
import com.complexity.inferrer.ast.WhileLoop;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Finds the first logarithmic reduction pattern under a node: a compound
 * assignment {@code x //= k} / {@code x >>= k}, or any {@code a // k} /
 * {@code a >> k} expression.
 *
 * Right shifts always report divisor 2 whatever the shift amount. Floor
 * divisions report their literal divisor, or 2 when the divisor is not a
 * literal.
 */
public class ReductionPatternScanner {

    /**
     * A detected reduction.
     */
    public static class ReductionMatch {
        private final SyntaxNode node;
        private final Operator operator;
        private final int divisor;

        public ReductionMatch(SyntaxNode node, Operator operator, int divisor) {
            this.node = node;
            this.operator = operator;
            this.divisor = divisor;
        }

        public SyntaxNode getNode() {
            return node;
        }

        public Operator getOperator() {
            return operator;
        }

        public int getDivisor() {
            return divisor;
        }
    }

    private final ScanScope scope;

    public ReductionPatternScanner() {
        this(ScanScope.WHOLE_SUBTREE);
    }

    public ReductionPatternScanner(ScanScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public ScanScope getScope() {
        return scope;
    }

    /**
     * Scans {@code root} and its descendants in pre-order.
     */
    public Optional<ReductionMatch> findFirst(SyntaxNode root) {
        return scan(root, true);
    }

    private Optional<ReductionMatch> scan(SyntaxNode node, boolean isRoot) {
        Optional<ReductionMatch> match = matchNode(node);
        if (match.isPresent()) {
            return match;
        }
        if (!isRoot && scope == ScanScope.DIRECT_CHILDREN && isCompound(node)) {
            return Optional.empty();
        }
        for (SyntaxNode child : node.getChildNodes()) {
            Optional<ReductionMatch> found = scan(child, false);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static Optional<ReductionMatch> matchNode(SyntaxNode node) {
        if (node instanceof AugmentedAssign) {
            AugmentedAssign assign = (AugmentedAssign) node;
            if (assign.getOperator().isReduction()) {
                return Optional.of(new ReductionMatch(node, assign.getOperator(),
                        divisorOf(assign.getOperator(), assign.getValue())));
            }
        } else if (node instanceof BinaryOp) {
            BinaryOp binaryOp = (BinaryOp) node;
            if (binaryOp.getOperator().isReduction()) {
                return Optional.of(new ReductionMatch(node, binaryOp.getOperator(),
                        divisorOf(binaryOp.getOperator(), binaryOp.getRight())));
            }
        }
        return Optional.empty();
    }

    private static int divisorOf(Operator operator, SyntaxNode operand) {
        if (operator == Operator.RIGHT_SHIFT) {
            return 2;
        }
        OptionalInt literal = literalDivisor(operand);
        return literal.isPresent() ? literal.getAsInt() : AnalysisRecord.DEFAULT_DIVISOR;
    }

    /**
     * The integer value of a literal operand, if it is one.
     */
    static OptionalInt literalDivisor(SyntaxNode operand) {
        if (operand instanceof Constant && ((Constant) operand).isIntegral()) {
            long value = ((Constant) operand).asLong().getAsLong();
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return OptionalInt.of((int) value);
            }
        }
        return OptionalInt.empty();
    }

    private static boolean isCompound(SyntaxNode node) {
        return node instanceof ForLoop || node instanceof WhileLoop || node instanceof IfStmt
                || node instanceof FunctionDef || node instanceof Comprehension;
    }
}
