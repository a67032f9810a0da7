package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

/**
 * A conditional statement.
 */
public final class IfStmt extends SyntaxNode {

    private final SyntaxNode test;
    private final List<SyntaxNode> body;
    private final List<SyntaxNode> elseBody;

    public IfStmt(SyntaxNode test, List<? extends SyntaxNode> body) {
        this(test, body, List.of());
    }

    public IfStmt(SyntaxNode test, List<? extends SyntaxNode> body, List<? extends SyntaxNode> elseBody) {
        this.test = Objects.requireNonNull(test, "test");
        this.body = List.copyOf(body);
        this.elseBody = List.copyOf(elseBody);
    }

    public SyntaxNode getTest() {
        return test;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    public List<SyntaxNode> getElseBody() {
        return elseBody;
    }

    /**
     * True when any statement of the then-branch is a return without a value.
     * The bare return need not be the branch's only statement, so
     * {@code if (i > 10) { log(i); return; }} also counts as a guard.
     */
    public boolean hasBareReturn() {
        return body.stream()
                .anyMatch(statement -> statement instanceof Return && ((Return) statement).isBare());
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(test, body, elseBody);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
