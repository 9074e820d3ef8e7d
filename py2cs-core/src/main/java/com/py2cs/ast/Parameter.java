package com.py2cs.ast;

/**
 * A positional parameter of a function or lambda ({@code ast.arg}).
 * Annotations are not carried; every parameter is emitted as {@code dynamic}.
 */
public record Parameter(
    int line,
    int column,
    String name
) implements Node {
    public Parameter(String name) {
        this(0, 0, name);
    }

    @Override
    public String kind() {
        return "arg";
    }
}
