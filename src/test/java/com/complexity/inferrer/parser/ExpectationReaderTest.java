package com.complexity.inferrer.parser;

import com.complexity.inferrer.model.ComplexityExpectation;
import com.complexity.inferrer.model.ComplexityLabel;
import com.github.javaparser.ast.Node;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExpectationReaderTest {

    private final JavaSnippetParser parser = new JavaSnippetParser();
    private final ExpectationReader reader = new ExpectationReader();

    private Optional<ComplexityExpectation> read(String source) {
        Node root = parser.parseJava(source).getRoot().orElseThrow();
        return reader.read(root);
    }

    @Test
    void readsTimeAndSpace() {
        Optional<ComplexityExpectation> expectation = read(
                "class A {\n"
                        + "  @Complexity(time = \"O(n log n)\", space = \"O(n)\")\n"
                        + "  int[] sort(int[] a) { return a; }\n"
                        + "}");

        assertTrue(expectation.isPresent());
        assertEquals("sort", expectation.get().getDeclaredOn());
        assertEquals(Optional.of(ComplexityLabel.LINEARITHMIC), expectation.get().getTime());
        assertEquals(Optional.of(ComplexityLabel.LINEAR), expectation.get().getSpace());
    }

    @Test
    void acceptsQualifiedAnnotationName() {
        Optional<ComplexityExpectation> expectation = read(
                "@com.complexity.inferrer.annotations.Complexity(time = \"O(n^2)\")\n"
                        + "void pairs(int[] a) { }");

        assertTrue(expectation.isPresent());
        assertEquals(Optional.of(ComplexityLabel.QUADRATIC), expectation.get().getTime());
        assertTrue(expectation.get().getSpace().isEmpty());
    }

    @Test
    void blankValuesAreIgnored() {
        Optional<ComplexityExpectation> expectation = read(
                "@Complexity(time = \"\", space = \"O(1)\") void f() { }");

        assertTrue(expectation.isPresent());
        assertTrue(expectation.get().getTime().isEmpty());
        assertEquals(Optional.of(ComplexityLabel.CONSTANT), expectation.get().getSpace());
    }

    @Test
    void constructorsCanDeclareExpectations() {
        Optional<ComplexityExpectation> expectation = read(
                "class Grid {\n"
                        + "  @Complexity(time = \"O(1)\")\n"
                        + "  Grid() { }\n"
                        + "}");

        assertEquals("Grid", expectation.orElseThrow().getDeclaredOn());
    }

    @Test
    void otherAnnotationsAreIgnored() {
        assertTrue(read("class A { @Override public String toString() { return \"a\"; } }").isEmpty());
    }

    @Test
    void annotationOnTypeIsIgnored() {
        assertTrue(read("@Complexity(time = \"O(1)\") class A { }").isEmpty());
    }
}
