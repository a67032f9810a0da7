package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

/**
 * A loop over the elements of an iterable expression.
 */
public final class ForLoop extends SyntaxNode {

    private final SyntaxNode iterable;
    private final List<SyntaxNode> body;

    public ForLoop(SyntaxNode iterable, List<? extends SyntaxNode> body) {
        this.iterable = Objects.requireNonNull(iterable, "iterable");
        this.body = List.copyOf(body);
    }

    public SyntaxNode getIterable() {
        return iterable;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(iterable, body);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
