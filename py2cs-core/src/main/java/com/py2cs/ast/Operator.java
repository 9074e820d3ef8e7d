package com.py2cs.ast;

/**
 * Python operator tags as they appear on BinOp, BoolOp, Compare and UnaryOp nodes.
 * The constant name is the Python class name, so {@code Operator.valueOf(tag)} resolves
 * a tag read from the tree.
 */
public enum Operator {
    // operator
    Add, Sub, Mult, MatMult, Div, Mod, Pow, LShift, RShift, BitOr, BitXor, BitAnd, FloorDiv,
    // boolop
    And, Or,
    // cmpop
    Eq, NotEq, Lt, LtE, Gt, GtE, Is, IsNot, In, NotIn,
    // unaryop
    Invert, Not, UAdd, USub
}
