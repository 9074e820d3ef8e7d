package com.py2cs.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the external Python parser on a source file and returns its syntax tree as JSON.
 * The bundled {@code ast_dump.py} script is passed to the interpreter with {@code -c}.
 */
class PythonAstDumper {

    private static final Logger log = LoggerFactory.getLogger(PythonAstDumper.class);

    private static final String SCRIPT_RESOURCE = "ast_dump.py";

    private final String python;

    PythonAstDumper(String python) {
        this.python = python;
    }

    /**
     * @return the JSON dump of {@code source}'s module node
     * @throws IOException if the interpreter cannot be started or rejects the source
     */
    String dump(Path source) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(python, "-c", loadScript(), source.toString());
        log.debug("Running {} on {}", python, source);

        Process process = builder.start();
        CompletableFuture<String> errors = CompletableFuture.supplyAsync(() -> readQuietly(process.getErrorStream()));
        String json;
        try (InputStream out = process.getInputStream()) {
            json = new String(out.readAllBytes(), StandardCharsets.UTF_8);
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while waiting for " + python, e);
        }
        if (exitCode != 0) {
            throw new IOException("Python parser failed (exit " + exitCode + "): " + errors.join().strip());
        }
        return json;
    }

    private static String loadScript() throws IOException {
        try (InputStream in = PythonAstDumper.class.getResourceAsStream(SCRIPT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing resource " + SCRIPT_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String readQuietly(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<stderr unavailable: " + e.getMessage() + ">";
        }
    }
}
