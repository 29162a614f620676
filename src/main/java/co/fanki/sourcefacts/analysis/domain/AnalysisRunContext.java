package co.fanki.sourcefacts.analysis.domain;

import co.fanki.sourcefacts.shared.AnalysisException;
import co.fanki.sourcefacts.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * State shared by every source unit of one analysis run.
 *
 * <p>Holds the two caches allowed to cross file boundaries: the resolved
 * interpreter command and the out-of-process results keyed by absolute path.
 * A context is opened at run start and closed at run end; closing discards
 * both caches so the next run starts clean.</p>
 *
 * <p>Safe for concurrent callers. The interpreter is probed at most once per
 * run: the first caller installs a future, later callers wait on it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalysisRunContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisRunContext.class);

    private final String runId;

    private final AtomicReference<CompletableFuture<String>> interpreter =
            new AtomicReference<>();

    private final Map<Path, AnalysisResult> visitorResults =
            new ConcurrentHashMap<>();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private AnalysisRunContext(final String theRunId) {
        this.runId = theRunId;
    }

    /**
     * Opens a new run.
     *
     * @return the context, to be closed when the run ends
     */
    public static AnalysisRunContext open() {
        final AnalysisRunContext context = new AnalysisRunContext(
                UUID.randomUUID().toString());
        LOG.debug("Opened analysis run {}", context.runId);
        return context;
    }

    /**
     * Returns the identifier of this run, for logging.
     *
     * @return the run id
     */
    public String runId() {
        return runId;
    }

    /**
     * Returns the interpreter command, probing for it on first use.
     *
     * <p>A failed probe is remembered too: every later call in the same run
     * fails with the same exception without probing again.</p>
     *
     * @param probe resolves the interpreter command or throws
     * @return the interpreter command
     * @throws AnalysisException the probe failure, for every caller
     */
    public String interpreter(final Supplier<String> probe) {
        Preconditions.requireNonNull(probe, "Probe cannot be null");
        ensureOpen();

        CompletableFuture<String> future = interpreter.get();
        if (future == null) {
            final CompletableFuture<String> candidate = new CompletableFuture<>();
            if (interpreter.compareAndSet(null, candidate)) {
                try {
                    candidate.complete(probe.get());
                } catch (final RuntimeException e) {
                    candidate.completeExceptionally(e);
                }
            }
            future = interpreter.get();
        }

        try {
            return future.join();
        } catch (final CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Returns a previously cached out-of-process result.
     *
     * @param absolutePath the absolute path of the unit
     * @return the cached result, if any
     */
    public Optional<AnalysisResult> cachedResult(final Path absolutePath) {
        ensureOpen();
        return Optional.ofNullable(visitorResults.get(absolutePath));
    }

    /**
     * Caches an out-of-process result for the rest of the run.
     *
     * @param absolutePath the absolute path of the unit
     * @param result the successful result
     */
    public void cacheResult(final Path absolutePath, final AnalysisResult result) {
        ensureOpen();
        visitorResults.put(
                Preconditions.requireNonNull(absolutePath, "Path cannot be null"),
                Preconditions.requireNonNull(result, "Result cannot be null"));
    }

    /**
     * Whether the run has ended.
     *
     * @return true once closed
     */
    public boolean isClosed() {
        return closed.get();
    }

    /** Ends the run and discards both caches. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.debug("Closing analysis run {} ({} cached results)",
                    runId, visitorResults.size());
            visitorResults.clear();
            interpreter.set(null);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Analysis run " + runId
                    + " is already closed");
        }
    }

}
