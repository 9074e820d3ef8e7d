package com.py2cs.ast;

import java.util.List;

/**
 * Root of a parsed Python file (the {@code ast.Module} node).
 */
public record Program(
    List<Statement> body
) implements Node {

    public Program {
        body = List.copyOf(body);
    }

    @Override
    public int line() {
        return 0;
    }

    @Override
    public int column() {
        return 0;
    }

    @Override
    public String kind() {
        return "Module";
    }
}
