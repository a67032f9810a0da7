package com.complexity.inferrer.ast;

/**
 * Visitor that recurses into the children of every node without side effects.
 * Subclasses override only the node kinds they care about and call
 * {@link #visitChildren(SyntaxNode, Object)} to keep descending.
 */
public abstract class SyntaxVisitorAdapter<A> implements SyntaxVisitor<A> {

    protected void visitChildren(SyntaxNode node, A arg) {
        for (SyntaxNode child : node.getChildNodes()) {
            child.accept(this, arg);
        }
    }

    @Override
    public void visit(Snippet node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(FunctionDef node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(Parameter node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(ForLoop node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(WhileLoop node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(IfStmt node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(Return node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(Call node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(Attribute node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(BinaryOp node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(AugmentedAssign node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(ContainerLiteral node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(Comprehension node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(ComprehensionClause node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(Name node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(Constant node, A arg) {
        visitChildren(node, arg);
    }

    @Override
    public void visit(OtherNode node, A arg) {
        visitChildren(node, arg);
    }
}
