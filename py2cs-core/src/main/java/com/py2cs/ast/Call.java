package com.py2cs.ast;

import java.util.List;

/**
 * A call with positional arguments. Keyword arguments are not represented.
 */
public record Call(
    int line,
    int column,
    Expression callee,
    List<Expression> arguments
) implements Expression {

    public Call {
        arguments = List.copyOf(arguments);
    }

    public Call(Expression callee, List<Expression> arguments) {
        this(0, 0, callee, arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String kind() {
        return "Call";
    }
}
