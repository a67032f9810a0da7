package com.complexity.inferrer.ast;

import java.util.List;
import java.util.OptionalLong;

/**
 * A literal value. The value may be {@code null} for a null/None literal.
 */
public final class Constant extends SyntaxNode {

    private final Object value;

    public Constant(Object value) {
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    public boolean isIntegral() {
        return value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte;
    }

    public boolean isNumeric() {
        return value instanceof Number;
    }

    public OptionalLong asLong() {
        return isIntegral() ? OptionalLong.of(((Number) value).longValue()) : OptionalLong.empty();
    }

    /**
     * Numeric value, or NaN for non-numeric literals.
     */
    public double asDouble() {
        return isNumeric() ? ((Number) value).doubleValue() : Double.NaN;
    }

    /**
     * Source-like rendering used in human-readable notes.
     */
    public String describe() {
        return String.valueOf(value);
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
