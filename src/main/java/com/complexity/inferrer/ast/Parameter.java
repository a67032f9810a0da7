package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A formal parameter, optionally with a default value.
 */
public final class Parameter extends SyntaxNode {

    private final String name;
    private final SyntaxNode defaultValue;

    public Parameter(String name) {
        this(name, null);
    }

    public Parameter(String name, SyntaxNode defaultValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public Optional<SyntaxNode> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public boolean hasConstantDefault() {
        return defaultValue instanceof Constant;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(defaultValue);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
