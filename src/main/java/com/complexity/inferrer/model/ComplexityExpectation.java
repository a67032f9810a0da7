package com.complexity.inferrer.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Labels a snippet declares it should be classified with.
 */
public final class ComplexityExpectation {

    private final String declaredOn;
    private final ComplexityLabel time;
    private final ComplexityLabel space;

    public ComplexityExpectation(String declaredOn, ComplexityLabel time, ComplexityLabel space) {
        this.declaredOn = Objects.requireNonNull(declaredOn, "declaredOn");
        this.time = time;
        this.space = space;
    }

    /**
     * Name of the method carrying the declaration.
     */
    public String getDeclaredOn() {
        return declaredOn;
    }

    public Optional<ComplexityLabel> getTime() {
        return Optional.ofNullable(time);
    }

    public Optional<ComplexityLabel> getSpace() {
        return Optional.ofNullable(space);
    }

    public boolean matchesTime(ClassificationResult.Success result) {
        return time == null || time.equals(result.getTimeLabel());
    }

    public boolean matchesSpace(ClassificationResult.Success result) {
        return space == null || space.equals(result.getSpaceLabel());
    }

    public boolean matches(ClassificationResult.Success result) {
        return matchesTime(result) && matchesSpace(result);
    }
}
