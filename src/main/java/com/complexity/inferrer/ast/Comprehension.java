package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A comprehension or generator expression: an element expression evaluated
 * over one or more {@link ComprehensionClause}s.
 */
public final class Comprehension extends SyntaxNode {

    public enum Kind {
        LIST(ContainerLiteral.Kind.LIST),
        SET(ContainerLiteral.Kind.SET),
        DICT(ContainerLiteral.Kind.DICT),
        GENERATOR(null);

        private final ContainerLiteral.Kind materializes;

        Kind(ContainerLiteral.Kind materializes) {
            this.materializes = materializes;
        }

        /**
         * The container this comprehension builds eagerly; empty for lazy
         * generators.
         */
        public Optional<ContainerLiteral.Kind> getMaterializedKind() {
            return Optional.ofNullable(materializes);
        }

        public String getLabel() {
            return materializes == null ? "genexpr" : materializes.getLabel();
        }
    }

    private final Kind kind;
    private final List<ComprehensionClause> clauses;
    private final SyntaxNode element;

    public Comprehension(Kind kind, List<ComprehensionClause> clauses, SyntaxNode element) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.clauses = List.copyOf(clauses);
        this.element = Objects.requireNonNull(element, "element");
    }

    public Kind getKind() {
        return kind;
    }

    public List<ComprehensionClause> getClauses() {
        return clauses;
    }

    public SyntaxNode getElement() {
        return element;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(clauses, element);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
