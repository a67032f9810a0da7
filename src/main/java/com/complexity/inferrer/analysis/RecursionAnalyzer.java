package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.BinaryOp;
import com.complexity.inferrer.ast.Call;
import com.complexity.inferrer.ast.FunctionDef;
import com.complexity.inferrer.ast.IfStmt;
import com.complexity.inferrer.ast.Name;
import com.complexity.inferrer.ast.Operator;
import com.complexity.inferrer.ast.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Recognizes the recursion shapes of a single function definition: direct
 * self-calls, recursion bounded by a constant counter parameter, and calls
 * that shrink their argument by a constant divisor.
 */
public class RecursionAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(RecursionAnalyzer.class);

    /**
     * First call in the function body, in pre-order, whose callee is the
     * function's own name.
     */
    public Optional<Call> findFirstSelfCall(FunctionDef function) {
        String name = function.getName();
        for (SyntaxNode statement : function.getBody()) {
            for (Call call : statement.findAll(Call.class)) {
                if (call.getCallee() instanceof Name && ((Name) call.getCallee()).getId().equals(name)) {
                    return Optional.of(call);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * True when every bare-return guard in the function tests only counter
     * parameters, i.e. parameters with a literal default value. Requires at
     * least one such guard; a single guard that mentions any other identifier
     * rejects the function.
     *
     * <pre>
     * def table(n, i=1):      # i is a counter
     *     if i &gt; 10: return   # bounded by a constant
     *     table(n, i + 1)
     * </pre>
     */
    public boolean hasConstantBaseCase(FunctionDef function) {
        Set<String> counterParameters = function.getConstantDefaultParameters();
        if (counterParameters.isEmpty()) {
            return false;
        }

        boolean foundBase = false;
        for (IfStmt guard : function.findAll(IfStmt.class)) {
            if (!guard.hasBareReturn()) {
                continue;
            }
            foundBase = true;
            for (Name reference : guard.getTest().findAll(Name.class)) {
                if (!counterParameters.contains(reference.getId())) {
                    logger.debug("Base case of {} references non-counter '{}'", function.getName(), reference.getId());
                    return false;
                }
            }
        }
        return foundBase;
    }

    /**
     * Divisor by which the self-call shrinks its input: an argument of the form
     * {@code x // k} with literal {@code k > 1}, or {@code x >> k} with literal
     * {@code k > 0}, which always counts as 2.
     */
    public OptionalInt findReductionDivisor(Call selfCall) {
        for (SyntaxNode argument : selfCall.getArguments()) {
            if (!(argument instanceof BinaryOp)) {
                continue;
            }
            BinaryOp binaryOp = (BinaryOp) argument;
            OptionalInt literal = ReductionPatternScanner.literalDivisor(binaryOp.getRight());
            if (literal.isEmpty()) {
                continue;
            }
            if (binaryOp.getOperator() == Operator.FLOOR_DIV && literal.getAsInt() > 1) {
                return literal;
            }
            if (binaryOp.getOperator() == Operator.RIGHT_SHIFT && literal.getAsInt() > 0) {
                return OptionalInt.of(2);
            }
        }
        return OptionalInt.empty();
    }
}
