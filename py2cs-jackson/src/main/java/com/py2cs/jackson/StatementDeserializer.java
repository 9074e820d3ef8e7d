package com.py2cs.jackson;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.py2cs.ast.*;

import java.io.IOException;
import java.util.List;

/**
 * Reads statement nodes. Statement kinds without a counterpart in the tree model, and
 * supported kinds using a feature the model cannot hold (decorators, loop {@code else}
 * blocks, ...), become {@link UnsupportedStatementNode}s so translation fails with the
 * construct's name instead of loading failing.
 */
class StatementDeserializer extends PythonNodeDeserializer<Statement> {

    StatementDeserializer() {
        super(Statement.class);
    }

    @Override
    protected Statement fromTree(JsonNode node, String type, DeserializationContext ctxt) throws IOException {
        int line = line(node);
        int column = column(node);
        switch (type) {
            case "FunctionDef": {
                if (isPresent(node, "decorator_list")) {
                    return new UnsupportedStatementNode(line, column, "decorator");
                }
                List<Parameter> parameters = positionalParameters(node, ctxt);
                if (parameters == null) {
                    return new UnsupportedStatementNode(line, column, "arguments");
                }
                return new FunctionDefinition(line, column,
                    text(node, "name", ctxt),
                    parameters,
                    optionalChild(node, "returns", Expression.class, ctxt),
                    children(node, "body", Statement.class, ctxt));
            }
            case "ClassDef":
                if (isPresent(node, "decorator_list")) {
                    return new UnsupportedStatementNode(line, column, "decorator");
                }
                if (isPresent(node, "keywords")) {
                    return new UnsupportedStatementNode(line, column, "keyword");
                }
                return new ClassDefinition(line, column,
                    text(node, "name", ctxt),
                    children(node, "bases", Expression.class, ctxt),
                    children(node, "body", Statement.class, ctxt));
            case "Return":
                return new Return(line, column, optionalChild(node, "value", Expression.class, ctxt));
            case "Assign": {
                List<Expression> targets = children(node, "targets", Expression.class, ctxt);
                if (targets.isEmpty()) {
                    return ctxt.reportInputMismatch(this, "Assign at line %d has no targets", line);
                }
                return new Assignment(line, column, targets, child(node, "value", Expression.class, ctxt));
            }
            case "For":
                if (isPresent(node, "orelse")) {
                    return new UnsupportedStatementNode(line, column, "For-else");
                }
                return new ForLoop(line, column,
                    child(node, "target", Expression.class, ctxt),
                    child(node, "iter", Expression.class, ctxt),
                    children(node, "body", Statement.class, ctxt));
            case "While":
                if (isPresent(node, "orelse")) {
                    return new UnsupportedStatementNode(line, column, "While-else");
                }
                return new WhileLoop(line, column,
                    child(node, "test", Expression.class, ctxt),
                    children(node, "body", Statement.class, ctxt));
            case "If":
                return new Conditional(line, column,
                    child(node, "test", Expression.class, ctxt),
                    children(node, "body", Statement.class, ctxt),
                    children(node, "orelse", Statement.class, ctxt));
            case "Expr":
                return new ExpressionStatement(line, column, child(node, "value", Expression.class, ctxt));
            case "Pass":
                return new Pass(line, column);
            case "Break":
                return new Break(line, column);
            case "Continue":
                return new Continue(line, column);
            default:
                return new UnsupportedStatementNode(line, column, type);
        }
    }
}
