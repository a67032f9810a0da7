package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

/**
 * An eagerly built container: a list, dict or set literal.
 *
 * A growable container is one created empty with the intent of filling it
 * later (for example {@code new ArrayList<>()}); it counts as allocated even
 * without elements.
 */
public final class ContainerLiteral extends SyntaxNode {

    public enum Kind {
        LIST("list"),
        DICT("dict"),
        SET("set");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Kind kind;
    private final List<SyntaxNode> elements;
    private final boolean growable;

    public ContainerLiteral(Kind kind, List<? extends SyntaxNode> elements) {
        this(kind, elements, false);
    }

    public ContainerLiteral(Kind kind, List<? extends SyntaxNode> elements, boolean growable) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.elements = List.copyOf(elements);
        this.growable = growable;
    }

    public Kind getKind() {
        return kind;
    }

    public List<SyntaxNode> getElements() {
        return elements;
    }

    public int getElementCount() {
        return elements.size();
    }

    public boolean isGrowable() {
        return growable;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return elements;
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
