package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Call;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The fixed catalog of library idioms the engine recognizes: which calls are
 * range-like, which sort, which convert numbers to strings and which iterate
 * their input implicitly.
 *
 * The catalog is language specific. {@link #standard()} holds the built-ins of
 * a dynamically typed scripting language (range, sorted, str, sum...);
 * {@link #java()} extends it with the Java library equivalents the Java front
 * end produces.
 */
public final class IdiomCatalog {

    private static final IdiomCatalog STANDARD = new IdiomCatalog(
            Set.of("range"),
            Set.of("sorted"),
            Set.of("sort", "sorted"),
            Set.of("str"),
            Set.of("sqrt", "isqrt"),
            Set.of("sum", "max", "min", "any", "all"),
            Set.of("list", "tuple"),
            Set.of("reverse", "join", "split", "count", "index", "find", "replace"));

    private static final IdiomCatalog JAVA = STANDARD.extend(
            Set.of("String.valueOf", "Integer.toString", "Long.toString"),
            Set.of("indexOf", "lastIndexOf", "reduce"));

    private final Set<String> rangeFunctions;
    private final Set<String> sortFunctions;
    private final Set<String> sortMethods;
    private final Set<String> stringConversions;
    private final Set<String> sqrtFunctions;
    private final Set<String> reductionFunctions;
    private final Set<String> sequenceConstructors;
    private final Set<String> linearMethods;

    public IdiomCatalog(Set<String> rangeFunctions,
                        Set<String> sortFunctions,
                        Set<String> sortMethods,
                        Set<String> stringConversions,
                        Set<String> sqrtFunctions,
                        Set<String> reductionFunctions,
                        Set<String> sequenceConstructors,
                        Set<String> linearMethods) {
        this.rangeFunctions = Set.copyOf(rangeFunctions);
        this.sortFunctions = Set.copyOf(sortFunctions);
        this.sortMethods = Set.copyOf(sortMethods);
        this.stringConversions = Set.copyOf(stringConversions);
        this.sqrtFunctions = Set.copyOf(sqrtFunctions);
        this.reductionFunctions = Set.copyOf(reductionFunctions);
        this.sequenceConstructors = Set.copyOf(sequenceConstructors);
        this.linearMethods = Set.copyOf(linearMethods);
    }

    public static IdiomCatalog standard() {
        return STANDARD;
    }

    public static IdiomCatalog java() {
        return JAVA;
    }

    /**
     * Returns a copy of this catalog with extra string conversions and linear
     * methods.
     */
    public IdiomCatalog extend(Set<String> extraStringConversions, Set<String> extraLinearMethods) {
        return new IdiomCatalog(rangeFunctions, sortFunctions, sortMethods,
                union(stringConversions, extraStringConversions),
                sqrtFunctions, reductionFunctions, sequenceConstructors,
                union(linearMethods, extraLinearMethods));
    }

    private static Set<String> union(Set<String> base, Set<String> extra) {
        Set<String> merged = new HashSet<>(base);
        merged.addAll(Objects.requireNonNull(extra));
        return merged;
    }

    /**
     * A free call to a range-like function taking one to three arguments.
     */
    public boolean isRangeCall(Call call) {
        int arity = call.getArguments().size();
        return call.isFreeFunctionCall()
                && rangeFunctions.contains(call.getCalleeName())
                && arity >= 1 && arity <= 3;
    }

    public boolean isSortCall(Call call) {
        if (call.isFreeFunctionCall()) {
            return sortFunctions.contains(call.getCalleeName());
        }
        return call.isAttributeCall() && sortMethods.contains(call.getCalleeName());
    }

    public boolean isStringConversion(Call call) {
        return call.getQualifiedCalleeName()
                .map(stringConversions::contains)
                .orElse(false);
    }

    public boolean isSqrtCall(Call call) {
        return sqrtFunctions.contains(call.getCalleeName());
    }

    public boolean isReductionBuiltin(Call call) {
        return call.isFreeFunctionCall() && reductionFunctions.contains(call.getCalleeName());
    }

    public boolean isSequenceConstructor(Call call) {
        return call.isFreeFunctionCall() && sequenceConstructors.contains(call.getCalleeName());
    }

    public boolean isLinearMethod(Call call) {
        return call.isAttributeCall() && linearMethods.contains(call.getCalleeName());
    }
}
