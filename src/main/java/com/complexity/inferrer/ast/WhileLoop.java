package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

/**
 * A condition-controlled loop. It has no static trip count.
 */
public final class WhileLoop extends SyntaxNode {

    private final SyntaxNode condition;
    private final List<SyntaxNode> body;

    public WhileLoop(SyntaxNode condition, List<? extends SyntaxNode> body) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = List.copyOf(body);
    }

    public SyntaxNode getCondition() {
        return condition;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(condition, body);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
