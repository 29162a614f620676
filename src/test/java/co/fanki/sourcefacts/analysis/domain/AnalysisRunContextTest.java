package co.fanki.sourcefacts.analysis.domain;

import co.fanki.sourcefacts.shared.AnalysisException;
import co.fanki.sourcefacts.shared.AnalysisException.FailureKind;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisRunContext}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisRunContextTest {

    @Test
    void whenResolvingInterpreter_givenTwoCalls_shouldLocateOnce() {
        final AtomicInteger lookups = new AtomicInteger();
        try (AnalysisRunContext context = AnalysisRunContext.open()) {
            final String first = context.interpreter(() -> {
                lookups.incrementAndGet();
                return "python3";
            });
            final String second = context.interpreter(() -> {
                lookups.incrementAndGet();
                return "python";
            });

            assertEquals("python3", first);
            assertEquals("python3", second);
            assertEquals(1, lookups.get());
        }
    }

    @Test
    void whenResolvingInterpreter_givenFailedLookup_shouldRethrowWithoutLocatingAgain() {
        final AtomicInteger lookups = new AtomicInteger();
        try (AnalysisRunContext context = AnalysisRunContext.open()) {
            final AnalysisException failure = new AnalysisException("none",
                    FailureKind.INTERPRETER_NOT_FOUND);

            assertSame(failure, assertThrows(AnalysisException.class,
                    () -> context.interpreter(() -> {
                        lookups.incrementAndGet();
                        throw failure;
                    })));
            assertSame(failure, assertThrows(AnalysisException.class,
                    () -> context.interpreter(() -> {
                        lookups.incrementAndGet();
                        return "python3";
                    })));
            assertEquals(1, lookups.get());
        }
    }

    @Test
    void whenCachingResult_givenSamePath_shouldReturnIt() {
        final Path path = Path.of("/tmp/a.py");
        try (AnalysisRunContext context = AnalysisRunContext.open()) {
            assertFalse(context.cachedResult(path).isPresent());

            context.cacheResult(path, AnalysisResult.empty());

            assertSame(AnalysisResult.empty(), context.cachedResult(path).get());
        }
    }

    @Test
    void whenClosed_shouldRejectFurtherUse() {
        final AnalysisRunContext context = AnalysisRunContext.open();
        context.close();

        assertTrue(context.isClosed());
        assertThrows(IllegalStateException.class,
                () -> context.cachedResult(Path.of("/tmp/a.py")));
    }

    @Test
    void whenOpeningTwice_shouldUseDistinctRunIds() {
        try (AnalysisRunContext first = AnalysisRunContext.open();
                AnalysisRunContext second = AnalysisRunContext.open()) {
            assertNotEquals(first.runId(), second.runId());
        }
    }

}
