package com.complexity.inferrer.analysis;

/**
 * How far a loop-body pattern scan reaches.
 */
public enum ScanScope {
    /**
     * Every node under the loop, nested loops and branches included. First
     * match wins, so an unrelated division deep inside the loop also counts.
     */
    WHOLE_SUBTREE,

    /**
     * The loop's condition and its own statements only; nested compound
     * statements (loops, branches, function definitions, comprehensions) are
     * not entered.
     */
    DIRECT_CHILDREN
}
