package com.py2cs.translate;

import com.py2cs.ast.*;

import java.util.List;
import java.util.StringJoiner;

/**
 * Renders statements as C# blocks. Nested bodies are joined with newlines and are
 * not re-indented; only the {@code if} rendering carries a fixed leading tab.
 */
public class StatementEmitter implements StatementVisitor<String> {

    private final ExpressionEmitter expressions;

    public StatementEmitter() {
        this(new ExpressionEmitter());
    }

    public StatementEmitter(ExpressionEmitter expressions) {
        this.expressions = expressions;
    }

    public String emit(Statement statement) {
        return statement.accept(this);
    }

    /**
     * Each statement on its own line, in input order.
     */
    public String emitStatements(List<Statement> statements) {
        StringJoiner joiner = new StringJoiner("\n");
        for (Statement statement : statements) {
            joiner.add(emit(statement));
        }
        return joiner.toString();
    }

    @Override
    public String visitFunctionDefinition(FunctionDefinition node) {
        TypeLabel returnType = TypeInferencer.inferAnnotation(node.returns());
        return returnType.keyword() + " " + node.name()
            + "(" + expressions.emitParameters(node.parameters()) + ") {\n"
            + emitStatements(node.body())
            + "\n}";
    }

    @Override
    public String visitClassDefinition(ClassDefinition node) {
        String header = "class " + node.name();
        if (!node.bases().isEmpty()) {
            header += " : " + expressions.emitList(node.bases());
        }
        return header + " {\n" + emitStatements(node.body()) + "\n}";
    }

    @Override
    public String visitReturn(Return node) {
        if (node.value() == null) {
            return "return;";
        }
        return "return " + expressions.emit(node.value()) + ";";
    }

    /**
     * The first target takes the value; every further target of {@code a = b = value}
     * is declared from the first so the value is evaluated once.
     */
    @Override
    public String visitAssignment(Assignment node) {
        String type = TypeInferencer.infer(node.value()).keyword();
        String first = expressions.emit(node.targets().get(0));
        StringBuilder out = new StringBuilder()
            .append(type).append(' ').append(first).append(" = ").append(expressions.emit(node.value())).append(';');
        for (Expression target : node.targets().subList(1, node.targets().size())) {
            out.append('\n').append(type).append(' ').append(expressions.emit(target)).append(" = ").append(first).append(';');
        }
        return out.toString();
    }

    @Override
    public String visitForLoop(ForLoop node) {
        return "foreach (var " + expressions.emit(node.target()) + " in " + expressions.emit(node.iterable()) + ") {\n"
            + emitStatements(node.body())
            + "\n}";
    }

    @Override
    public String visitWhileLoop(WhileLoop node) {
        return "while (" + expressions.emit(node.test()) + ") {\n"
            + emitStatements(node.body())
            + "\n}";
    }

    @Override
    public String visitConditional(Conditional node) {
        String out = "if (" + expressions.emit(node.test()) + ") {\n\t" + emitStatements(node.body()) + "}\n";
        if (!node.orElse().isEmpty()) {
            out += "else {\n\t" + emitStatements(node.orElse()) + "}\n";
        }
        return out;
    }

    @Override
    public String visitExpressionStatement(ExpressionStatement node) {
        return expressions.emit(node.expression()) + ";";
    }

    @Override
    public String visitPass(Pass node) {
        return ";";
    }

    @Override
    public String visitBreak(Break node) {
        return "break;";
    }

    @Override
    public String visitContinue(Continue node) {
        return "continue;";
    }

    @Override
    public String visitUnsupported(UnsupportedStatementNode node) {
        throw new UnsupportedStatementException(node);
    }
}
