package co.fanki.sourcefacts.analysis.domain.python;

import co.fanki.sourcefacts.analysis.domain.AnalysisResult;
import co.fanki.sourcefacts.shared.Preconditions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the embedded visitor program in a fresh interpreter process per unit.
 *
 * <h3>Protocol</h3>
 * <ul>
 *   <li>argv: {@code [interpreter, "-c", program, absolutePath]}</li>
 *   <li>stdin: the source text, UTF-8, closed after writing</li>
 *   <li>stdout: exactly one JSON object, see {@link VisitorResponse}</li>
 *   <li>stderr: diagnostics only</li>
 * </ul>
 *
 * <p>Success needs exit code 0 and a parseable payload without an
 * {@code error} field; anything else, a timeout included, is a
 * {@link SubprocessFailureException} for that unit only. The source is
 * written and both output streams are drained on their own threads, so
 * the timeout also holds for a child that never reads its stdin or
 * floods its stdout.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SubprocessPythonVisitor implements PythonVisitorService {

    private static final Logger LOG = LoggerFactory.getLogger(
            SubprocessPythonVisitor.class);

    /** Classpath location of the visitor program. */
    public static final String VISITOR_RESOURCE = "python/source_visitor.py";

    private static final int MAX_DIAGNOSTIC_LENGTH = 500;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final String program;

    private final long timeoutSeconds;

    /**
     * Creates a visitor running the bundled program.
     *
     * @param theTimeoutSeconds wall-clock limit per unit
     */
    public SubprocessPythonVisitor(final long theTimeoutSeconds) {
        this(loadProgram(), theTimeoutSeconds);
    }

    /**
     * Creates a visitor running the given program.
     *
     * @param theProgram the program passed with {@code -c}
     * @param theTimeoutSeconds wall-clock limit per unit
     */
    public SubprocessPythonVisitor(final String theProgram,
            final long theTimeoutSeconds) {
        this.program = Preconditions.requireNonBlank(theProgram,
                "Visitor program cannot be blank");
        this.timeoutSeconds = Preconditions.requirePositive(theTimeoutSeconds,
                "Timeout must be positive");
    }

    /** {@inheritDoc} */
    @Override
    public AnalysisResult visit(final String interpreter,
            final Path absolutePath, final String source) {
        Preconditions.requireNonBlank(interpreter, "Interpreter cannot be blank");
        Preconditions.requireNonNull(absolutePath, "Path cannot be null");
        Preconditions.requireNonNull(source, "Source cannot be null");

        final ProcessBuilder pb = new ProcessBuilder(interpreter, "-c",
                program, absolutePath.toString());

        final Process process;
        try {
            process = pb.start();
        } catch (final IOException e) {
            throw new SubprocessFailureException("Cannot start " + interpreter
                    + " for " + absolutePath + ": " + e.getMessage(), e);
        }

        final ExecutorService streams = Executors.newFixedThreadPool(3,
                SubprocessPythonVisitor::streamThread);
        try {
            final CompletableFuture<String> stdout = drain(
                    process.getInputStream(), streams);
            final CompletableFuture<String> stderr = drain(
                    process.getErrorStream(), streams);
            CompletableFuture.runAsync(() -> writeSource(process, source),
                    streams);

            waitForExit(process, absolutePath);
            return readResponse(process, absolutePath,
                    await(stdout, absolutePath), await(stderr, absolutePath));
        } finally {
            streams.shutdownNow();
        }
    }

    private void waitForExit(final Process process, final Path absolutePath) {
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new SubprocessFailureException("Visitor timed out after "
                        + timeoutSeconds + "s on " + absolutePath);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SubprocessFailureException("Interrupted while visiting "
                    + absolutePath, e);
        }
    }

    private static AnalysisResult readResponse(final Process process,
            final Path absolutePath, final String output,
            final String diagnostics) {
        if (!diagnostics.isBlank()) {
            LOG.debug("Visitor stderr for {}: {}", absolutePath,
                    abbreviate(diagnostics));
        }

        if (process.exitValue() != 0) {
            throw new SubprocessFailureException("Visitor exited with code "
                    + process.exitValue() + " on " + absolutePath + ": "
                    + abbreviate(diagnostics));
        }

        final VisitorResponse response;
        try {
            response = OBJECT_MAPPER.readValue(output, VisitorResponse.class);
        } catch (final JsonProcessingException e) {
            throw new SubprocessFailureException("Visitor output for "
                    + absolutePath + " is not a JSON object: "
                    + abbreviate(output), e);
        }
        if (response == null) {
            throw new SubprocessFailureException("Visitor produced no output for "
                    + absolutePath);
        }
        if (response.hasError()) {
            throw new SubprocessFailureException("Visitor reported an error for "
                    + absolutePath + ": " + response.error());
        }
        return response.toResult();
    }

    private static void writeSource(final Process process, final String source) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(source.getBytes(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            // Broken pipe: exit code and stdout decide the outcome.
            LOG.debug("Could not write the whole source to the visitor: {}",
                    e.getMessage());
        }
    }

    private static Thread streamThread(final Runnable task) {
        final Thread thread = new Thread(task, "python-visitor-io");
        thread.setDaemon(true);
        return thread;
    }

    private static CompletableFuture<String> drain(final InputStream stream,
            final ExecutorService executor) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor);
    }

    private static String await(final CompletableFuture<String> stream,
            final Path absolutePath) {
        try {
            return stream.join();
        } catch (final CompletionException e) {
            throw new SubprocessFailureException("Cannot read visitor output for "
                    + absolutePath, e.getCause());
        }
    }

    private static String abbreviate(final String text) {
        final String trimmed = text.strip();
        if (trimmed.length() <= MAX_DIAGNOSTIC_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_DIAGNOSTIC_LENGTH) + "...";
    }

    private static String loadProgram() {
        try (InputStream in = SubprocessPythonVisitor.class.getClassLoader()
                .getResourceAsStream(VISITOR_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException(
                        "Visitor program not found on classpath: "
                                + VISITOR_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot load visitor program", e);
        }
    }

}
