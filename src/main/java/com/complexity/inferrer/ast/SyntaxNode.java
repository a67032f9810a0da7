package com.complexity.inferrer.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base type of the snippet syntax tree consumed by the complexity engine.
 * The hierarchy is closed: every recognized construct has its own subclass and
 * anything else is represented by {@link OtherNode}.
 *
 * Nodes are immutable. The engine only reads them.
 */
public abstract class SyntaxNode {

    /**
     * Direct children in source order.
     */
    public abstract List<SyntaxNode> getChildNodes();

    public abstract <A> void accept(SyntaxVisitor<A> visitor, A arg);

    /**
     * Finds all nodes of the given type in this subtree, this node included,
     * in depth-first pre-order.
     */
    public <T extends SyntaxNode> List<T> findAll(Class<T> type) {
        List<T> found = new ArrayList<>();
        collect(this, type, found);
        return found;
    }

    private static <T extends SyntaxNode> void collect(SyntaxNode node, Class<T> type, List<T> found) {
        if (type.isInstance(node)) {
            found.add(type.cast(node));
        }
        for (SyntaxNode child : node.getChildNodes()) {
            collect(child, type, found);
        }
    }

    protected static List<SyntaxNode> children(Object... parts) {
        List<SyntaxNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof SyntaxNode) {
                result.add((SyntaxNode) part);
            } else if (part instanceof List) {
                for (Object element : (List<?>) part) {
                    result.add((SyntaxNode) element);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }
}
