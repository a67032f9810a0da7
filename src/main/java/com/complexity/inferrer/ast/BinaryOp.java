package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

public final class BinaryOp extends SyntaxNode {

    private final Operator operator;
    private final SyntaxNode left;
    private final SyntaxNode right;

    public BinaryOp(Operator operator, SyntaxNode left, SyntaxNode right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Operator getOperator() {
        return operator;
    }

    public SyntaxNode getLeft() {
        return left;
    }

    public SyntaxNode getRight() {
        return right;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(left, right);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
