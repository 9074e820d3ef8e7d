package com.py2cs.ast;

import java.util.List;

public record Lambda(
    int line,
    int column,
    List<Parameter> parameters,
    Expression body
) implements Expression {

    public Lambda {
        parameters = List.copyOf(parameters);
    }

    public Lambda(List<Parameter> parameters, Expression body) {
        this(0, 0, parameters, body);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }

    @Override
    public String kind() {
        return "Lambda";
    }
}
