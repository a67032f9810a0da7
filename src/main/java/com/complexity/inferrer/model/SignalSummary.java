package com.complexity.inferrer.model;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of the main structural signals behind a classification, kept
 * alongside the labels for diagnostics.
 */
public final class SignalSummary {

    private final int loopDepth;
    private final boolean recursion;
    private final boolean constantRecursion;
    private final boolean sort;
    private final boolean halving;
    private final List<String> constantLoops;

    public SignalSummary(int loopDepth, boolean recursion, boolean constantRecursion,
                         boolean sort, boolean halving, List<String> constantLoops) {
        this.loopDepth = loopDepth;
        this.recursion = recursion;
        this.constantRecursion = constantRecursion;
        this.sort = sort;
        this.halving = halving;
        this.constantLoops = List.copyOf(constantLoops);
    }

    public int getLoopDepth() {
        return loopDepth;
    }

    public boolean hasRecursion() {
        return recursion;
    }

    public boolean isConstantRecursion() {
        return constantRecursion;
    }

    public boolean hasSort() {
        return sort;
    }

    public boolean hasHalving() {
        return halving;
    }

    public List<String> getConstantLoops() {
        return constantLoops;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalSummary)) return false;
        SignalSummary that = (SignalSummary) o;
        return loopDepth == that.loopDepth && recursion == that.recursion
                && constantRecursion == that.constantRecursion && sort == that.sort
                && halving == that.halving && constantLoops.equals(that.constantLoops);
    }

    @Override
    public int hashCode() {
        return Objects.hash(loopDepth, recursion, constantRecursion, sort, halving, constantLoops);
    }

    @Override
    public String toString() {
        return "loopDepth=" + loopDepth + ", recursion=" + recursion
                + ", constantRecursion=" + constantRecursion + ", sort=" + sort + ", halving=" + halving;
    }
}
