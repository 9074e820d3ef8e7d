package com.py2cs.ast;

/**
 * One method per statement kind. Implementations are exhaustive by construction:
 * a new {@link Statement} variant does not compile until every visitor handles it.
 */
public interface StatementVisitor<R> {
    R visitFunctionDefinition(FunctionDefinition node);
    R visitClassDefinition(ClassDefinition node);
    R visitReturn(Return node);
    R visitAssignment(Assignment node);
    R visitForLoop(ForLoop node);
    R visitWhileLoop(WhileLoop node);
    R visitConditional(Conditional node);
    R visitExpressionStatement(ExpressionStatement node);
    R visitPass(Pass node);
    R visitBreak(Break node);
    R visitContinue(Continue node);
    R visitUnsupported(UnsupportedStatementNode node);
}
