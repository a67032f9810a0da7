package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A call expression. The callee is either a bare {@link Name} (a free
 * function) or an {@link Attribute} access (a method or qualified function).
 */
public final class Call extends SyntaxNode {

    private final SyntaxNode callee;
    private final List<SyntaxNode> arguments;

    public Call(SyntaxNode callee, List<? extends SyntaxNode> arguments) {
        this.callee = Objects.requireNonNull(callee, "callee");
        this.arguments = List.copyOf(arguments);
    }

    public SyntaxNode getCallee() {
        return callee;
    }

    public List<SyntaxNode> getArguments() {
        return arguments;
    }

    public Optional<SyntaxNode> getFirstArgument() {
        return arguments.isEmpty() ? Optional.empty() : Optional.of(arguments.get(0));
    }

    public boolean isFreeFunctionCall() {
        return callee instanceof Name;
    }

    public boolean isAttributeCall() {
        return callee instanceof Attribute;
    }

    /**
     * Last segment of the callee: {@code f} for {@code f(x)}, {@code sort} for
     * {@code xs.sort()}. Empty for computed callees such as {@code fs[0](x)}.
     */
    public String getCalleeName() {
        if (callee instanceof Name) {
            return ((Name) callee).getId();
        }
        if (callee instanceof Attribute) {
            return ((Attribute) callee).getName();
        }
        return "";
    }

    /**
     * Dotted callee path such as {@code math.isqrt}, when the callee is a chain
     * of plain names.
     */
    public Optional<String> getQualifiedCalleeName() {
        if (callee instanceof Name) {
            return Optional.of(((Name) callee).getId());
        }
        if (callee instanceof Attribute) {
            return ((Attribute) callee).getQualifiedName();
        }
        return Optional.empty();
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(callee, arguments);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
