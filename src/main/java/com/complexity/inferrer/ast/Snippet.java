package com.complexity.inferrer.ast;

import java.util.List;

/**
 * Root of a snippet: its top-level statements and definitions.
 */
public final class Snippet extends SyntaxNode {

    private final List<SyntaxNode> body;

    public Snippet(List<? extends SyntaxNode> body) {
        this.body = List.copyOf(body);
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return body;
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
