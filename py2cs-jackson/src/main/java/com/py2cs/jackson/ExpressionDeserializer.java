package com.py2cs.jackson;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.py2cs.ast.*;

import java.io.IOException;
import java.util.List;

/**
 * Reads expression nodes. Both the Python 3.8+ {@code Constant} node and the older
 * {@code Num}/{@code Str} nodes are accepted. Unknown kinds become
 * {@link UnsupportedExpressionNode}s.
 */
class ExpressionDeserializer extends PythonNodeDeserializer<Expression> {

    ExpressionDeserializer() {
        super(Expression.class);
    }

    @Override
    protected Expression fromTree(JsonNode node, String type, DeserializationContext ctxt) throws IOException {
        int line = line(node);
        int column = column(node);
        switch (type) {
            case "BinOp":
                return new BinaryOp(line, column,
                    child(node, "left", Expression.class, ctxt),
                    child(node, "op", Operator.class, ctxt),
                    child(node, "right", Expression.class, ctxt));
            case "BoolOp":
                return new BooleanOp(line, column,
                    child(node, "op", Operator.class, ctxt),
                    children(node, "values", Expression.class, ctxt));
            case "Compare": {
                List<Operator> operators = children(node, "ops", Operator.class, ctxt);
                List<Expression> comparators = children(node, "comparators", Expression.class, ctxt);
                if (operators.isEmpty() || operators.size() != comparators.size()) {
                    return ctxt.reportInputMismatch(this, "Compare needs matching 'ops' and 'comparators', got %d and %d",
                        operators.size(), comparators.size());
                }
                return new Comparison(line, column, child(node, "left", Expression.class, ctxt), operators, comparators);
            }
            case "UnaryOp":
                return new UnaryOp(line, column,
                    child(node, "op", Operator.class, ctxt),
                    child(node, "operand", Expression.class, ctxt));
            case "Lambda": {
                List<Parameter> parameters = positionalParameters(node, ctxt);
                if (parameters == null) {
                    return new UnsupportedExpressionNode(line, column, "arguments");
                }
                return new Lambda(line, column, parameters, child(node, "body", Expression.class, ctxt));
            }
            case "Call":
                if (isPresent(node, "keywords")) {
                    return new UnsupportedExpressionNode(line, column, "keyword");
                }
                return new Call(line, column,
                    child(node, "func", Expression.class, ctxt),
                    children(node, "args", Expression.class, ctxt));
            case "Attribute":
                return new Attribute(line, column,
                    child(node, "value", Expression.class, ctxt),
                    text(node, "attr", ctxt));
            case "Name":
                return new Identifier(line, column, text(node, "id", ctxt));
            case "Num":
                return literal(node.get("n"), line, column, type);
            case "Str":
                return literal(node.get("s"), line, column, type);
            case "Constant":
                return literal(node.get("value"), line, column, type);
            default:
                return new UnsupportedExpressionNode(line, column, type);
        }
    }

    private static Expression literal(JsonNode value, int line, int column, String type) {
        if (value != null && value.isTextual()) {
            return new StringLiteral(line, column, value.asText());
        }
        if (value != null && value.isNumber()) {
            return new NumericLiteral(line, column, number(value));
        }
        // True, False, None, bytes, Ellipsis
        return new UnsupportedExpressionNode(line, column, type);
    }

    private static Number number(JsonNode value) {
        if (value.isIntegralNumber()) {
            if (value.canConvertToLong()) {
                return value.longValue();
            }
            return value.bigIntegerValue();
        }
        if (value.isBigDecimal()) {
            return value.decimalValue();
        }
        return value.doubleValue();
    }
}
