package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Optional;

public final class Return extends SyntaxNode {

    private final SyntaxNode value;

    public Return() {
        this(null);
    }

    public Return(SyntaxNode value) {
        this.value = value;
    }

    public Optional<SyntaxNode> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isBare() {
        return value == null;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(value);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
