package com.complexity.inferrer.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A Big-O growth label from the closed vocabulary O(1), O(log n), O(√n),
 * O(n), O(n log n), O(n²), O(n³) and O(n^k) for k &ge; 4, plus an exotic
 * fallback for text outside that vocabulary.
 */
public final class ComplexityLabel {

    public enum Family {
        CONSTANT, LOGARITHMIC, SQUARE_ROOT, LINEAR, LINEARITHMIC, POLYNOMIAL, EXOTIC
    }

    public static final ComplexityLabel CONSTANT = new ComplexityLabel(Family.CONSTANT, 0, "O(1)");
    public static final ComplexityLabel LOGARITHMIC = new ComplexityLabel(Family.LOGARITHMIC, 0, "O(log n)");
    public static final ComplexityLabel SQUARE_ROOT = new ComplexityLabel(Family.SQUARE_ROOT, 0, "O(√n)");
    public static final ComplexityLabel LINEAR = new ComplexityLabel(Family.LINEAR, 1, "O(n)");
    public static final ComplexityLabel LINEARITHMIC = new ComplexityLabel(Family.LINEARITHMIC, 1, "O(n log n)");
    public static final ComplexityLabel QUADRATIC = new ComplexityLabel(Family.POLYNOMIAL, 2, "O(n²)");
    public static final ComplexityLabel CUBIC = new ComplexityLabel(Family.POLYNOMIAL, 3, "O(n³)");

    private static final List<ComplexityLabel> KNOWN = List.of(
            CONSTANT, LOGARITHMIC, SQUARE_ROOT, LINEAR, LINEARITHMIC, QUADRATIC, CUBIC);

    // Labels with a dedicated badge color; everything else renders as exotic
    private static final Set<ComplexityLabel> PALETTE = Set.of(
            CONSTANT, LOGARITHMIC, LINEAR, LINEARITHMIC, QUADRATIC, CUBIC);

    private static final Pattern POWER_FORM = Pattern.compile("O\\(n\\^(\\d+)\\)");

    private final Family family;
    private final int degree;
    private final String text;

    private ComplexityLabel(Family family, int degree, String text) {
        this.family = family;
        this.degree = degree;
        this.text = text;
    }

    /**
     * Label for {@code depth} nested linear loops.
     */
    public static ComplexityLabel polynomial(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Negative loop depth: " + depth);
        }
        return switch (depth) {
            case 0 -> CONSTANT;
            case 1 -> LINEAR;
            case 2 -> QUADRATIC;
            case 3 -> CUBIC;
            default -> new ComplexityLabel(Family.POLYNOMIAL, depth, "O(n^" + depth + ")");
        };
    }

    /**
     * Parses label text. Accepts {@code O(n^2)} and {@code O(n^3)} as
     * spellings of O(n²) and O(n³); unknown text becomes an exotic label.
     */
    public static ComplexityLabel of(String text) {
        String trimmed = Objects.requireNonNull(text, "text").trim();
        for (ComplexityLabel label : KNOWN) {
            if (label.text.equals(trimmed)) {
                return label;
            }
        }
        Matcher matcher = POWER_FORM.matcher(trimmed);
        if (matcher.matches()) {
            try {
                return polynomial(Integer.parseInt(matcher.group(1)));
            } catch (NumberFormatException e) {
                return exotic(trimmed);
            }
        }
        return exotic(trimmed);
    }

    public static ComplexityLabel exotic(String text) {
        return new ComplexityLabel(Family.EXOTIC, -1, Objects.requireNonNull(text, "text"));
    }

    public Family getFamily() {
        return family;
    }

    /**
     * Polynomial degree for CONSTANT, LINEAR and POLYNOMIAL labels.
     */
    public int getDegree() {
        return degree;
    }

    public String getText() {
        return text;
    }

    /**
     * True for labels outside the six-entry palette table: O(√n), O(n^k) with
     * k &ge; 4, and unparsed text.
     */
    public boolean isExotic() {
        return !PALETTE.contains(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComplexityLabel)) return false;
        ComplexityLabel that = (ComplexityLabel) o;
        return family == that.family && degree == that.degree && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, degree, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
