package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.BinaryOp;
import com.complexity.inferrer.ast.Call;
import com.complexity.inferrer.ast.Comprehension;
import com.complexity.inferrer.ast.ComprehensionClause;
import com.complexity.inferrer.ast.Constant;
import com.complexity.inferrer.ast.ContainerLiteral;
import com.complexity.inferrer.ast.ForLoop;
import com.complexity.inferrer.ast.FunctionDef;
import com.complexity.inferrer.ast.Operator;
import com.complexity.inferrer.ast.SyntaxNode;
import com.complexity.inferrer.ast.SyntaxVisitorAdapter;
import com.complexity.inferrer.ast.WhileLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Depth-first walk over a snippet tree that records the complexity signals
 * of every construct it recognizes into the {@link AnalysisRecord} passed
 * along the traversal. Unrecognized nodes are descended into without effect.
 *
 * The walker keeps no state of its own; one instance can serve any number of
 * concurrent walks as long as each uses its own record.
 */
public class ComplexityWalker extends SyntaxVisitorAdapter<AnalysisRecord> {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityWalker.class);

    private static final int DIGIT_DIVISOR = 10;

    private final IdiomCatalog catalog;
    private final ReductionPatternScanner reductionScanner;
    private final RecursionAnalyzer recursionAnalyzer;

    public ComplexityWalker() {
        this(IdiomCatalog.standard(), ScanScope.WHOLE_SUBTREE);
    }

    public ComplexityWalker(IdiomCatalog catalog, ScanScope scanScope) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.reductionScanner = new ReductionPatternScanner(scanScope);
        this.recursionAnalyzer = new RecursionAnalyzer();
    }

    /**
     * Walks the whole tree once with a fresh record.
     */
    public AnalysisRecord walk(SyntaxNode root) {
        AnalysisRecord record = new AnalysisRecord();
        root.accept(this, record);
        return record;
    }

    @Override
    public void visit(FunctionDef function, AnalysisRecord record) {
        recursionAnalyzer.findFirstSelfCall(function).ifPresent(selfCall -> {
            record.markRecursion();
            if (recursionAnalyzer.hasConstantBaseCase(function)) {
                logger.debug("Recursion in {} is bounded by a constant counter", function.getName());
                record.markConstantRecursion();
            }
            recursionAnalyzer.findReductionDivisor(selfCall).ifPresent(divisor -> {
                logger.debug("Recursive call in {} divides its input by {}", function.getName(), divisor);
                record.markLogRecursion(divisor);
            });
        });
        visitChildren(function, record);
    }

    @Override
    public void visit(ForLoop loop, AnalysisRecord record) {
        SyntaxNode iterable = loop.getIterable();

        Optional<String> constantRange = describeConstantRange(iterable);
        if (constantRange.isPresent()) {
            // Fixed trip count: body still visited for nested loops, depth unchanged
            record.addConstantLoop(constantRange.get());
            visitChildren(loop, record);
            return;
        }

        if (isStringConversionOfVariable(iterable)) {
            record.markStrLoop();
            record.markLogLoop(DIGIT_DIVISOR);
        } else if (isSqrtBoundedRange(iterable)) {
            record.markSqrtLoop();
        }

        iterable.accept(this, record);
        record.enterLoops(1);
        for (SyntaxNode statement : loop.getBody()) {
            statement.accept(this, record);
        }
        record.exitLoops(1);
    }

    @Override
    public void visit(WhileLoop loop, AnalysisRecord record) {
        record.enterLoops(1);
        reductionScanner.findFirst(loop).ifPresent(match -> {
            logger.debug("Reduction pattern {} by {} inside while loop",
                    match.getOperator().getSymbol(), match.getDivisor());
            record.markLogLoop(match.getDivisor());
            record.markHalving();
        });
        visitChildren(loop, record);
        record.exitLoops(1);
    }

    @Override
    public void visit(Comprehension comprehension, AnalysisRecord record) {
        int depth = 0;
        for (ComprehensionClause clause : comprehension.getClauses()) {
            Optional<String> constantRange = describeConstantRange(clause.getIterable());
            if (constantRange.isPresent()) {
                record.addConstantLoop(comprehension.getKind().getLabel() + ":" + constantRange.get());
            } else {
                depth++;
            }
        }

        // Iterables are evaluated before the loop starts
        for (ComprehensionClause clause : comprehension.getClauses()) {
            clause.getIterable().accept(this, record);
        }

        if (depth > 0) {
            record.enterLoops(depth);
            comprehension.getKind().getMaterializedKind()
                    .ifPresent(kind -> record.addDynamicStructure(kind.getLabel()));
        }
        for (ComprehensionClause clause : comprehension.getClauses()) {
            for (SyntaxNode condition : clause.getConditions()) {
                condition.accept(this, record);
            }
        }
        comprehension.getElement().accept(this, record);
        if (depth > 0) {
            record.exitLoops(depth);
        }
    }

    @Override
    public void visit(Call call, AnalysisRecord record) {
        if (catalog.isSortCall(call)) {
            record.markSort();
        }
        if (catalog.isStringConversion(call) && hasVariableFirstArgument(call)) {
            record.markStrConversion();
        }
        if ((catalog.isReductionBuiltin(call) || catalog.isSequenceConstructor(call)) && hasVariableFirstArgument(call)) {
            record.markImplicitIteration();
        }
        if (catalog.isLinearMethod(call)) {
            record.markImplicitIteration();
        }
        visitChildren(call, record);
    }

    @Override
    public void visit(ContainerLiteral literal, AnalysisRecord record) {
        boolean allocates = literal.getKind() != ContainerLiteral.Kind.LIST
                || literal.getElementCount() > 0
                || literal.isGrowable();
        if (allocates) {
            record.addDynamicStructure(literal.getKind().getLabel());
        }
        visitChildren(literal, record);
    }

    /**
     * {@code range(...)} with only literal arguments, rendered as e.g.
     * {@code range(1, 11)}.
     */
    private Optional<String> describeConstantRange(SyntaxNode iterable) {
        if (!(iterable instanceof Call)) {
            return Optional.empty();
        }
        Call call = (Call) iterable;
        if (!catalog.isRangeCall(call)) {
            return Optional.empty();
        }
        if (!call.getArguments().stream().allMatch(argument -> argument instanceof Constant)) {
            return Optional.empty();
        }
        String arguments = call.getArguments().stream()
                .map(argument -> ((Constant) argument).describe())
                .collect(Collectors.joining(", "));
        return Optional.of(call.getCalleeName() + "(" + arguments + ")");
    }

    private boolean isStringConversionOfVariable(SyntaxNode iterable) {
        return iterable instanceof Call
                && catalog.isStringConversion((Call) iterable)
                && hasVariableFirstArgument((Call) iterable);
    }

    private boolean isSqrtBoundedRange(SyntaxNode iterable) {
        if (!(iterable instanceof Call) || !catalog.isRangeCall((Call) iterable)) {
            return false;
        }
        for (SyntaxNode bound : ((Call) iterable).getArguments()) {
            boolean sqrtCall = bound.findAll(Call.class).stream().anyMatch(catalog::isSqrtCall);
            boolean halfPower = bound.findAll(BinaryOp.class).stream().anyMatch(ComplexityWalker::isSquareRootPower);
            if (sqrtCall || halfPower) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@code x ** 0.5} or {@code x ** (1/2)}.
     */
    private static boolean isSquareRootPower(BinaryOp binaryOp) {
        if (binaryOp.getOperator() != Operator.POWER) {
            return false;
        }
        SyntaxNode exponent = binaryOp.getRight();
        if (exponent instanceof Constant) {
            return ((Constant) exponent).asDouble() == 0.5;
        }
        if (exponent instanceof BinaryOp) {
            BinaryOp fraction = (BinaryOp) exponent;
            return fraction.getOperator() == Operator.DIVIDE
                    && fraction.getLeft() instanceof Constant
                    && fraction.getRight() instanceof Constant
                    && ((Constant) fraction.getLeft()).asDouble() == 1.0
                    && ((Constant) fraction.getRight()).asDouble() == 2.0;
        }
        return false;
    }

    private boolean hasVariableFirstArgument(Call call) {
        return call.getFirstArgument().map(argument -> !isConstantArgument(argument)).orElse(false);
    }

    /**
     * A literal, a container literal of literals, or a range with literal
     * bounds.
     */
    private boolean isConstantArgument(SyntaxNode argument) {
        if (argument instanceof Constant) {
            return true;
        }
        if (argument instanceof ContainerLiteral) {
            return ((ContainerLiteral) argument).getElements().stream()
                    .allMatch(element -> element instanceof Constant);
        }
        return describeConstantRange(argument).isPresent();
    }
}
