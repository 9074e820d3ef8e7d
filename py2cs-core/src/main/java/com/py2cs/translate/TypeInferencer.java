package com.py2cs.translate;

import com.py2cs.ast.*;

/**
 * Guesses the declared C# type of a value from the syntactic shape of the expression
 * that produces it. This is a heuristic, not a type checker: only literals and
 * comparisons get a concrete type, everything else is {@code dynamic}.
 */
public final class TypeInferencer implements ExpressionVisitor<TypeLabel> {

    private static final TypeInferencer INSTANCE = new TypeInferencer();

    private TypeInferencer() {
    }

    /**
     * @param expression the defining expression, or null when there is none (e.g. no return annotation)
     * @throws UnsupportedExpressionException if the expression is of an unsupported kind
     */
    public static TypeLabel infer(Expression expression) {
        if (expression == null) {
            return TypeLabel.DYNAMIC;
        }
        return expression.accept(INSTANCE);
    }

    /**
     * Type of a function's return annotation. Annotations are never rendered, so kinds the
     * emitters cannot handle ({@code None}, {@code list[int]}, ...) give {@code dynamic}
     * instead of failing the translation.
     *
     * @param annotation the {@code returns} annotation, or null when there is none
     */
    public static TypeLabel inferAnnotation(Expression annotation) {
        if (annotation instanceof UnsupportedExpressionNode) {
            return TypeLabel.DYNAMIC;
        }
        return infer(annotation);
    }

    @Override
    public TypeLabel visitNumericLiteral(NumericLiteral node) {
        return TypeLabel.INT;
    }

    @Override
    public TypeLabel visitStringLiteral(StringLiteral node) {
        return TypeLabel.STRING;
    }

    @Override
    public TypeLabel visitComparison(Comparison node) {
        return TypeLabel.BOOL;
    }

    @Override
    public TypeLabel visitIdentifier(Identifier node) {
        return TypeLabel.DYNAMIC;
    }

    @Override
    public TypeLabel visitCall(Call node) {
        return TypeLabel.DYNAMIC;
    }

    @Override
    public TypeLabel visitBinaryOp(BinaryOp node) {
        return TypeLabel.DYNAMIC;
    }

    @Override
    public TypeLabel visitUnaryOp(UnaryOp node) {
        return TypeLabel.DYNAMIC;
    }

    @Override
    public TypeLabel visitLambda(Lambda node) {
        return TypeLabel.DYNAMIC;
    }

    // Python's and/or yield one of their operands, not a bool
    @Override
    public TypeLabel visitBooleanOp(BooleanOp node) {
        return TypeLabel.DYNAMIC;
    }

    @Override
    public TypeLabel visitAttribute(Attribute node) {
        return TypeLabel.DYNAMIC;
    }

    @Override
    public TypeLabel visitUnsupported(UnsupportedExpressionNode node) {
        throw new UnsupportedExpressionException(node);
    }
}
