package com.complexity.inferrer.parser;

import com.complexity.inferrer.ast.SyntaxNode;

import java.util.Objects;

/**
 * What a front end hands to the engine: a parsed tree, or the diagnostic of
 * a failed parse.
 */
public final class ParseOutcome {

    private final SyntaxNode tree;
    private final String diagnostic;

    private ParseOutcome(SyntaxNode tree, String diagnostic) {
        this.tree = tree;
        this.diagnostic = diagnostic;
    }

    public static ParseOutcome success(SyntaxNode tree) {
        return new ParseOutcome(Objects.requireNonNull(tree, "tree"), null);
    }

    public static ParseOutcome failure(String diagnostic) {
        return new ParseOutcome(null, Objects.requireNonNull(diagnostic, "diagnostic"));
    }

    public boolean isSuccessful() {
        return tree != null;
    }

    /**
     * @throws IllegalStateException if the parse failed
     */
    public SyntaxNode getTree() {
        if (tree == null) {
            throw new IllegalStateException("Parse failed: " + diagnostic);
        }
        return tree;
    }

    /**
     * @throws IllegalStateException if the parse succeeded
     */
    public String getDiagnostic() {
        if (diagnostic == null) {
            throw new IllegalStateException("Parse succeeded, no diagnostic");
        }
        return diagnostic;
    }
}
