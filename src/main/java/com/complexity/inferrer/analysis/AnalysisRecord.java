package com.complexity.inferrer.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable accumulator of the structural signals found while walking one
 * snippet. A fresh record is created for every analysis and is owned by that
 * analysis alone.
 */
public class AnalysisRecord {

    public static final int DEFAULT_DIVISOR = 2;

    // Loop nesting (constant-bound loops excluded)
    private int loopDepthCurrent = 0;
    private int loopDepthMax = 0;

    // Recursion
    private boolean hasRecursion = false;
    private boolean constantRecursion = false;
    private boolean hasLogRecursion = false;
    private int logRecursionDivisor = DEFAULT_DIVISOR;

    // Loop shapes
    private boolean hasLogLoop = false;
    private boolean hasHalving = false;
    private int logDivisor = DEFAULT_DIVISOR;
    private boolean hasStrLoop = false;
    private boolean hasSqrtLoop = false;

    // Call-site signals
    private boolean hasSort = false;
    private boolean hasStrConversion = false;
    private boolean hasImplicitIteration = false;

    private final List<String> constantLoopDescriptions = new ArrayList<>();
    private final List<String> dynamicStructureKinds = new ArrayList<>();

    /**
     * Enters {@code levels} nested loop levels and updates the maximum depth.
     */
    public void enterLoops(int levels) {
        loopDepthCurrent += levels;
        loopDepthMax = Math.max(loopDepthMax, loopDepthCurrent);
    }

    public void exitLoops(int levels) {
        loopDepthCurrent -= levels;
    }

    public int getLoopDepthCurrent() {
        return loopDepthCurrent;
    }

    public int getLoopDepthMax() {
        return loopDepthMax;
    }

    public boolean hasRecursion() {
        return hasRecursion;
    }

    public void markRecursion() {
        this.hasRecursion = true;
    }

    public boolean isConstantRecursion() {
        return constantRecursion;
    }

    public void markConstantRecursion() {
        this.constantRecursion = true;
    }

    public boolean hasLogRecursion() {
        return hasLogRecursion;
    }

    public int getLogRecursionDivisor() {
        return logRecursionDivisor;
    }

    public void markLogRecursion(int divisor) {
        if (!hasLogRecursion) {
            this.hasLogRecursion = true;
            this.logRecursionDivisor = divisor;
        }
    }

    public boolean hasLogLoop() {
        return hasLogLoop;
    }

    public int getLogDivisor() {
        return logDivisor;
    }

    /**
     * Records a loop that shrinks its control quantity by {@code divisor}. The
     * first recorded divisor is kept.
     */
    public void markLogLoop(int divisor) {
        if (!hasLogLoop) {
            this.hasLogLoop = true;
            this.logDivisor = divisor;
        }
    }

    /**
     * General halving flag, set alongside {@link #markLogLoop(int)} by the
     * while-loop reduction scan.
     */
    public boolean hasHalving() {
        return hasHalving;
    }

    public void markHalving() {
        this.hasHalving = true;
    }

    public boolean hasStrLoop() {
        return hasStrLoop;
    }

    public void markStrLoop() {
        this.hasStrLoop = true;
    }

    public boolean hasSqrtLoop() {
        return hasSqrtLoop;
    }

    public void markSqrtLoop() {
        this.hasSqrtLoop = true;
    }

    public boolean hasSort() {
        return hasSort;
    }

    public void markSort() {
        this.hasSort = true;
    }

    public boolean hasStrConversion() {
        return hasStrConversion;
    }

    public void markStrConversion() {
        this.hasStrConversion = true;
    }

    public boolean hasImplicitIteration() {
        return hasImplicitIteration;
    }

    public void markImplicitIteration() {
        this.hasImplicitIteration = true;
    }

    public void addConstantLoop(String description) {
        constantLoopDescriptions.add(description);
    }

    public List<String> getConstantLoopDescriptions() {
        return Collections.unmodifiableList(constantLoopDescriptions);
    }

    public void addDynamicStructure(String kind) {
        dynamicStructureKinds.add(kind);
    }

    /**
     * Every container kind observed, one entry per occurrence.
     */
    public List<String> getDynamicStructureKinds() {
        return Collections.unmodifiableList(dynamicStructureKinds);
    }

    public SortedSet<String> getDistinctStructureKinds() {
        return new TreeSet<>(dynamicStructureKinds);
    }
}
