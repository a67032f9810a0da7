package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

/**
 * Compound assignment such as {@code n //= 2} or {@code n >>= 1}.
 */
public final class AugmentedAssign extends SyntaxNode {

    private final Operator operator;
    private final SyntaxNode target;
    private final SyntaxNode value;

    public AugmentedAssign(Operator operator, SyntaxNode target, SyntaxNode value) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Operator getOperator() {
        return operator;
    }

    public SyntaxNode getTarget() {
        return target;
    }

    public SyntaxNode getValue() {
        return value;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(target, value);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
