package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

/**
 * One {@code for x in iterable [if cond]} clause of a comprehension.
 */
public final class ComprehensionClause extends SyntaxNode {

    private final SyntaxNode iterable;
    private final List<SyntaxNode> conditions;

    public ComprehensionClause(SyntaxNode iterable) {
        this(iterable, List.of());
    }

    public ComprehensionClause(SyntaxNode iterable, List<? extends SyntaxNode> conditions) {
        this.iterable = Objects.requireNonNull(iterable, "iterable");
        this.conditions = List.copyOf(conditions);
    }

    public SyntaxNode getIterable() {
        return iterable;
    }

    public List<SyntaxNode> getConditions() {
        return conditions;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(iterable, conditions);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
