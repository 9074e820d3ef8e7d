package com.py2cs.ast;

import java.util.List;

public record FunctionDefinition(
    int line,
    int column,
    String name,
    List<Parameter> parameters,
    Expression returns,  // Can be null (no annotation)
    List<Statement> body
) implements Statement {

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    public FunctionDefinition(String name, List<Parameter> parameters, Expression returns, List<Statement> body) {
        this(0, 0, name, parameters, returns, body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunctionDefinition(this);
    }

    @Override
    public String kind() {
        return "FunctionDef";
    }
}
