package com.py2cs.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.py2cs.ast.Expression;
import com.py2cs.ast.Operator;
import com.py2cs.ast.Program;
import com.py2cs.ast.Statement;

/**
 * Jackson module that reads the JSON form of Python's {@code ast} module into the
 * syntax tree records.
 *
 * This module handles:
 * - Dispatch on the {@code _type} property of every node
 * - Python field names ({@code func}, {@code orelse}, {@code col_offset}, ...)
 * - {@code Constant} as well as the legacy {@code Num}/{@code Str} literals
 * - Mapping unknown statement and expression kinds to placeholder nodes
 */
public class PythonAstModule extends SimpleModule {

    public PythonAstModule() {
        super("PythonAstModule", new Version(1, 0, 0, null, "com.py2cs", "py2cs-jackson"));

        addDeserializer(Program.class, new ProgramDeserializer());
        addDeserializer(Statement.class, new StatementDeserializer());
        addDeserializer(Expression.class, new ExpressionDeserializer());
        addDeserializer(Operator.class, new OperatorDeserializer());
    }
}
