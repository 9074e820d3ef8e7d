package com.py2cs.ast;

/**
 * One method per expression kind, see {@link StatementVisitor}.
 */
public interface ExpressionVisitor<R> {
    R visitBinaryOp(BinaryOp node);
    R visitBooleanOp(BooleanOp node);
    R visitComparison(Comparison node);
    R visitUnaryOp(UnaryOp node);
    R visitLambda(Lambda node);
    R visitCall(Call node);
    R visitAttribute(Attribute node);
    R visitNumericLiteral(NumericLiteral node);
    R visitStringLiteral(StringLiteral node);
    R visitIdentifier(Identifier node);
    R visitUnsupported(UnsupportedExpressionNode node);
}
