package com.py2cs.ast;

/**
 * Base interface for all Python syntax tree nodes.
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    Parameter {

    /**
     * The Python node-type name, e.g. {@code "Assign"} or {@code "Call"}.
     */
    String kind();

    /** 1-based source line reported by the parser, 0 when unknown. */
    int line();

    /** 0-based source column reported by the parser. */
    int column();
}
