package com.py2cs.translate;

import com.py2cs.ast.Program;
import com.py2cs.ast.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a whole Python module into a C# program.
 *
 * <p>Top-level statements end up inside {@code Program.Main}; the output is built
 * completely before it is returned, so a {@link TranslationException} anywhere in the
 * tree leaves nothing behind. Instances hold no mutable state and can be shared
 * between threads.</p>
 *
 * <pre>{@code
 * String csharp = new Translator().translate(program);
 * }</pre>
 */
public class Translator {

    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    static final String PROLOGUE =
        "using System;\n"
            + "public class Program {\n"
            + "\tpublic static void Main(string[] args) {\n";
    static final String EPILOGUE = "}\n}\n";

    private final StatementEmitter statements;

    public Translator() {
        this(new StatementEmitter());
    }

    public Translator(StatementEmitter statements) {
        this.statements = statements;
    }

    /**
     * @return a complete C# compilation unit
     * @throws TranslationException if the tree contains an unsupported statement, expression or operator
     */
    public String translate(Program program) {
        return PROLOGUE + translateBody(program) + EPILOGUE;
    }

    /**
     * The translated top-level statements, each followed by a newline, without the
     * surrounding class.
     */
    public String translateBody(Program program) {
        StringBuilder out = new StringBuilder();
        for (Statement statement : program.body()) {
            out.append(statements.emit(statement)).append('\n');
        }
        log.debug("Translated {} top-level statements into {} characters", program.body().size(), out.length());
        return out.toString();
    }
}
