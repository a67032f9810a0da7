package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

/**
 * Catch-all for constructs the engine has no rule for. It only carries its
 * children so traversal can continue underneath it.
 */
public final class OtherNode extends SyntaxNode {

    private final String kind;
    private final List<SyntaxNode> children;

    public OtherNode(String kind, List<? extends SyntaxNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.children = List.copyOf(children);
    }

    /**
     * Free-form description of the original construct, e.g. {@code "Assign"}.
     */
    public String getKind() {
        return kind;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children;
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
