package co.fanki.sourcefacts.analysis.application;

import co.fanki.sourcefacts.analysis.domain.AnalysisDispatcher;
import co.fanki.sourcefacts.analysis.domain.AnalysisOutcome;
import co.fanki.sourcefacts.analysis.domain.AnalysisRunContext;
import co.fanki.sourcefacts.analysis.domain.SourceUnit;
import co.fanki.sourcefacts.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Application service running analysis over text or files on disk.
 *
 * <p>Every call opens its own {@link AnalysisRunContext} and closes it when
 * done, so the interpreter probe and the visitor cache never outlive one
 * request. Files are read as UTF-8; a file that cannot be read is skipped and
 * the rest of the batch goes on.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class AnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisService.class);

    private final AnalysisDispatcher dispatcher;

    /**
     * Creates a new AnalysisService.
     *
     * @param theDispatcher routes units to their front end
     */
    public AnalysisService(final AnalysisDispatcher theDispatcher) {
        this.dispatcher = Preconditions.requireNonNull(theDispatcher,
                "Dispatcher cannot be null");
    }

    /**
     * Analyzes one in-memory source unit.
     *
     * @param path the file path, cannot be blank
     * @param languageTag the language tag, blank to use the extension
     * @param text the source text, cannot be null
     * @return the outcome
     */
    public AnalysisOutcome analyze(final String path, final String languageTag,
            final String text) {
        final SourceUnit unit = new SourceUnit(path, languageTag, text);
        try (AnalysisRunContext context = AnalysisRunContext.open()) {
            return dispatcher.dispatch(unit, context);
        }
    }

    /**
     * Reads and analyzes a list of files within one run.
     *
     * @param paths the file paths, cannot be empty
     * @param baseDirectory resolves relative paths, null for the working
     *        directory
     * @return the batch report
     */
    public BatchReport analyzeFiles(final List<String> paths,
            final Path baseDirectory) {
        Preconditions.requireNonEmpty(paths, "At least one path is required");

        final List<AnalysisOutcome> outcomes = new ArrayList<>();
        final List<String> unreadable = new ArrayList<>();

        try (AnalysisRunContext context = AnalysisRunContext.open()) {
            LOG.info("Starting analysis run {} over {} files",
                    context.runId(), paths.size());
            final long start = System.currentTimeMillis();

            for (final String path : paths) {
                final Path file;
                final String text;
                try {
                    file = resolve(baseDirectory, path);
                    text = read(file);
                } catch (final IOException | InvalidPathException e) {
                    LOG.warn("Skipping {} [FILE_UNREADABLE]: {}", path,
                            e.getMessage());
                    unreadable.add(Objects.toString(path, ""));
                    continue;
                }
                outcomes.add(dispatcher.dispatch(
                        SourceUnit.of(file.toString(), text), context));
            }

            final BatchReport report = new BatchReport(context.runId(),
                    outcomes, unreadable);
            LOG.info("Finished analysis run {} in {} ms: {} analyzed, "
                            + "{} degraded, {} unreadable",
                    context.runId(), System.currentTimeMillis() - start,
                    report.analyzedCount(), report.degradedCount(),
                    unreadable.size());
            return report;
        }
    }

    private static Path resolve(final Path baseDirectory, final String path)
            throws IOException {
        if (path == null || path.isBlank()) {
            throw new IOException("Blank path");
        }
        final Path file = Path.of(path);
        if (baseDirectory == null || file.isAbsolute()) {
            return file;
        }
        return baseDirectory.resolve(file);
    }

    private static String read(final Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Not a regular file: " + file);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (final MalformedInputException e) {
            throw new IOException("Not valid UTF-8: " + file, e);
        }
    }

}
