package co.fanki.sourcefacts.analysis.domain.python;

import co.fanki.sourcefacts.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Finds a working Python interpreter by probing candidate commands in order.
 *
 * <p>Each candidate runs {@code -c "import sys"}; the first one that exits
 * with 0 within the probe timeout wins. The locator itself does not cache:
 * the run context memoizes its answer for the duration of a run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InterpreterLocator {

    private static final Logger LOG = LoggerFactory.getLogger(
            InterpreterLocator.class);

    private static final String SMOKE_TEST = "import sys";

    private final List<String> candidates;

    private final long probeTimeoutSeconds;

    /**
     * Creates a new locator.
     *
     * @param theCandidates the commands to try, in order, cannot be empty
     * @param theProbeTimeoutSeconds how long one probe may take
     */
    public InterpreterLocator(final List<String> theCandidates,
            final long theProbeTimeoutSeconds) {
        this.candidates = List.copyOf(Preconditions.requireNonEmpty(
                theCandidates, "At least one interpreter candidate is required"));
        this.probeTimeoutSeconds = Preconditions.requirePositive(
                theProbeTimeoutSeconds, "Probe timeout must be positive");
    }

    /**
     * Returns the first candidate that works.
     *
     * @return the interpreter command
     * @throws InterpreterNotFoundException if no candidate works
     */
    public String locate() {
        for (final String candidate : candidates) {
            if (probe(candidate)) {
                LOG.info("Using Python interpreter '{}'", candidate);
                return candidate;
            }
        }
        throw new InterpreterNotFoundException(
                "No working Python interpreter among " + candidates);
    }

    /**
     * Whether some candidate works, without failing when none does.
     *
     * @return true if {@link #locate()} would succeed
     */
    public boolean isAvailable() {
        for (final String candidate : candidates) {
            if (probe(candidate)) {
                return true;
            }
        }
        return false;
    }

    public List<String> candidates() {
        return candidates;
    }

    private boolean probe(final String candidate) {
        final ProcessBuilder pb = new ProcessBuilder(candidate, "-c", SMOKE_TEST);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        try {
            final Process process = pb.start();
            process.getOutputStream().close();
            if (!process.waitFor(probeTimeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                LOG.debug("Interpreter probe '{}' timed out", candidate);
                return false;
            }
            final boolean works = process.exitValue() == 0;
            LOG.debug("Interpreter probe '{}' exited with {}", candidate,
                    process.exitValue());
            return works;
        } catch (final IOException e) {
            LOG.debug("Interpreter probe '{}' failed: {}", candidate,
                    e.getMessage());
            return false;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Interpreter probe '{}' interrupted", candidate);
            return false;
        }
    }

}
