package com.py2cs.cli;

import com.py2cs.ast.Program;
import com.py2cs.json.AstJsonException;
import com.py2cs.json.AstJsonProvider;
import com.py2cs.translate.TranslationException;
import com.py2cs.translate.Translator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: reads a Python syntax tree, translates it and writes C#.
 *
 * <p>Input ending in {@code .py} is parsed by running Python's own {@code ast} module;
 * any other input is read as an already-dumped JSON tree.</p>
 */
@Command(name = "py2cs", mixinStandardHelpOptions = true, version = "py2cs 1.0",
         description = "Translate a Python program into C# source")
public class Py2Cs implements Callable<Integer> {

    static final int EXIT_TRANSLATION_FAILED = 1;
    static final int EXIT_INPUT_FAILED = 3;

    private static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    @Parameters(index = "0", description = "Python source (.py) or JSON syntax tree")
    private Path input;

    @Parameters(index = "1", description = "C# file to write")
    private Path output;

    @Option(names = "--python", defaultValue = "python3", description = "Python interpreter used to parse .py input (default: ${DEFAULT-VALUE})")
    private String python;

    @Option(names = "--body-only", description = "Write only the translated statements, without the Program/Main wrapper")
    private boolean bodyOnly;

    @Option(names = {"-v", "--verbose"}, description = "Log debug output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Py2Cs()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        // must happen before the first logger is created
        if (verbose) {
            System.setProperty(LOG_LEVEL_PROPERTY, "debug");
        }
        Logger log = LoggerFactory.getLogger(Py2Cs.class);

        Program program;
        try {
            program = load();
        } catch (IOException | AstJsonException e) {
            log.error("Cannot read {}: {}", input, e.getMessage());
            return EXIT_INPUT_FAILED;
        }
        log.debug("Loaded {} top-level statements from {}", program.body().size(), input);

        String csharp;
        try {
            Translator translator = new Translator();
            csharp = bodyOnly ? translator.translateBody(program) : translator.translate(program);
        } catch (TranslationException e) {
            log.error("{}: {}", input, e.getMessage());
            return EXIT_TRANSLATION_FAILED;
        }

        try {
            write(csharp);
        } catch (IOException e) {
            log.error("Cannot write {}: {}", output, e.getMessage());
            return EXIT_INPUT_FAILED;
        }
        log.info("Wrote {}", output);
        return 0;
    }

    private Program load() throws IOException {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        if (input.getFileName() != null && input.getFileName().toString().endsWith(".py")) {
            String json = new PythonAstDumper(python).dump(input);
            return provider.getDeserializer().deserializeProgram(json);
        }
        try (InputStream in = Files.newInputStream(input)) {
            return provider.getDeserializer().deserializeProgram(in);
        }
    }

    /**
     * Writes to a sibling temporary file first so a failed write never leaves a truncated result.
     */
    private void write(String csharp) throws IOException {
        Path target = output.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, csharp, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
