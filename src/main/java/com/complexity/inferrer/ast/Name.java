package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

/**
 * An identifier reference.
 */
public final class Name extends SyntaxNode {

    private final String id;

    public Name(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return List.of();
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
