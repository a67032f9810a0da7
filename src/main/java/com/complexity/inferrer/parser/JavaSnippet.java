package com.complexity.inferrer.parser;

import com.github.javaparser.ast.Node;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of parsing Java source with JavaParser: the JavaParser tree in the
 * form that parsed (compilation unit, synthetic class or block), or the
 * diagnostic of the failed parse.
 */
public final class JavaSnippet {

    /**
     * Which wrapping made the source parse.
     */
    public enum Form {
        COMPILATION_UNIT, CLASS_MEMBERS, STATEMENTS
    }

    private final Node root;
    private final Form form;
    private final String diagnostic;

    private JavaSnippet(Node root, Form form, String diagnostic) {
        this.root = root;
        this.form = form;
        this.diagnostic = diagnostic;
    }

    static JavaSnippet parsed(Node root, Form form) {
        return new JavaSnippet(Objects.requireNonNull(root), Objects.requireNonNull(form), null);
    }

    static JavaSnippet failed(String diagnostic) {
        return new JavaSnippet(null, null, Objects.requireNonNull(diagnostic));
    }

    public boolean isParsed() {
        return root != null;
    }

    public Optional<Node> getRoot() {
        return Optional.ofNullable(root);
    }

    public Optional<Form> getForm() {
        return Optional.ofNullable(form);
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}
