package com.py2cs.translate;

import com.py2cs.ast.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders an expression as a single line of C#, without a statement terminator.
 * Operands are emitted as-is; no parentheses are added for precedence.
 */
public class ExpressionEmitter implements ExpressionVisitor<String> {

    public String emit(Expression expression) {
        return expression.accept(this);
    }

    /**
     * Comma-separated rendering of {@code expressions}, used for call arguments and base classes.
     */
    public String emitList(List<Expression> expressions) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Expression expression : expressions) {
            joiner.add(emit(expression));
        }
        return joiner.toString();
    }

    /**
     * {@code dynamic a, dynamic b}: parameters carry no type information of their own.
     */
    public String emitParameters(List<Parameter> parameters) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Parameter parameter : parameters) {
            joiner.add(TypeLabel.DYNAMIC.keyword() + " " + parameter.name());
        }
        return joiner.toString();
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        return emit(node.left()) + " " + OperatorTable.symbolFor(node.op()) + " " + emit(node.right());
    }

    @Override
    public String visitBooleanOp(BooleanOp node) {
        StringJoiner joiner = new StringJoiner(" " + OperatorTable.symbolFor(node.op()) + " ");
        for (Expression value : node.values()) {
            joiner.add(emit(value));
        }
        return joiner.toString();
    }

    /**
     * {@code a < b < c} means {@code a < b and b < c}; each link after the first is
     * rendered as its own comparison joined with {@code &&}. The shared operand is
     * emitted twice.
     */
    @Override
    public String visitComparison(Comparison node) {
        StringBuilder out = new StringBuilder();
        String left = emit(node.left());
        for (int i = 0; i < node.operators().size(); i++) {
            String right = emit(node.comparators().get(i));
            if (i > 0) {
                out.append(" && ");
            }
            out.append(left).append(' ').append(OperatorTable.symbolFor(node.operators().get(i))).append(' ').append(right);
            left = right;
        }
        return out.toString();
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return OperatorTable.unarySymbolFor(node.op()) + emit(node.operand());
    }

    @Override
    public String visitLambda(Lambda node) {
        return "(" + emitParameters(node.parameters()) + ") => " + emit(node.body());
    }

    @Override
    public String visitCall(Call node) {
        return BuiltinResolver.resolve(emit(node.callee())) + "(" + emitList(node.arguments()) + ")";
    }

    @Override
    public String visitAttribute(Attribute node) {
        return emit(node.value()) + "." + node.attribute();
    }

    @Override
    public String visitNumericLiteral(NumericLiteral node) {
        Number value = node.value();
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    @Override
    public String visitStringLiteral(StringLiteral node) {
        return "\"" + escape(node.value()) + "\"";
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    @Override
    public String visitUnsupported(UnsupportedExpressionNode node) {
        throw new UnsupportedExpressionException(node);
    }

    /**
     * Escapes text for a regular (non-verbatim) C# string literal.
     */
    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\0' -> out.append("\\0");
                // line terminators C# rejects inside a regular literal
                case '\u0085' -> out.append("\\u0085");
                case '\u2028' -> out.append("\\u2028");
                case '\u2029' -> out.append("\\u2029");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
