package com.complexity.inferrer.ast;

/**
 * Visitor over the closed {@link SyntaxNode} hierarchy.
 *
 * @param <A> type of the argument threaded through the traversal
 */
public interface SyntaxVisitor<A> {

    void visit(Snippet node, A arg);

    void visit(FunctionDef node, A arg);

    void visit(Parameter node, A arg);

    void visit(ForLoop node, A arg);

    void visit(WhileLoop node, A arg);

    void visit(IfStmt node, A arg);

    void visit(Return node, A arg);

    void visit(Call node, A arg);

    void visit(Attribute node, A arg);

    void visit(BinaryOp node, A arg);

    void visit(AugmentedAssign node, A arg);

    void visit(ContainerLiteral node, A arg);

    void visit(Comprehension node, A arg);

    void visit(ComprehensionClause node, A arg);

    void visit(Name node, A arg);

    void visit(Constant node, A arg);

    void visit(OtherNode node, A arg);
}
