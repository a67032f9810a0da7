package com.complexity.inferrer.ast;

/**
 * Binary operators the engine distinguishes. Everything else is {@link #OTHER}.
 */
public enum Operator {
    FLOOR_DIV("//"),
    RIGHT_SHIFT(">>"),
    POWER("**"),
    DIVIDE("/"),
    OTHER("?");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Operators that shrink their left operand by a constant factor.
     */
    public boolean isReduction() {
        return this == FLOOR_DIV || this == RIGHT_SHIFT;
    }
}
