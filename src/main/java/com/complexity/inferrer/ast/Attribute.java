package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Attribute access {@code receiver.name}.
 */
public final class Attribute extends SyntaxNode {

    private final SyntaxNode receiver;
    private final String name;

    public Attribute(SyntaxNode receiver, String name) {
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        this.name = Objects.requireNonNull(name, "name");
    }

    public SyntaxNode getReceiver() {
        return receiver;
    }

    public String getName() {
        return name;
    }

    public Optional<String> getQualifiedName() {
        if (receiver instanceof Name) {
            return Optional.of(((Name) receiver).getId() + "." + name);
        }
        if (receiver instanceof Attribute) {
            return ((Attribute) receiver).getQualifiedName().map(prefix -> prefix + "." + name);
        }
        return Optional.empty();
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(receiver);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
