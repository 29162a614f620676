package co.fanki.sourcefacts.analysis.domain.python;

import co.fanki.sourcefacts.analysis.domain.AnalysisResult;
import co.fanki.sourcefacts.analysis.domain.AnalysisRunContext;
import co.fanki.sourcefacts.analysis.domain.Language;
import co.fanki.sourcefacts.analysis.domain.SourceAnalyzer;
import co.fanki.sourcefacts.analysis.domain.SourceUnit;
import co.fanki.sourcefacts.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Python implementation of {@link SourceAnalyzer}.
 *
 * <p>Python's own {@code ast} module does the parsing, through a
 * {@link PythonVisitorService}. The interpreter is located once per run and
 * successful results are cached by absolute path in the
 * {@link AnalysisRunContext}, so a unit seen twice in one run spawns one
 * process. Failures are not cached.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonSourceAnalyzer extends SourceAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            PythonSourceAnalyzer.class);

    private final InterpreterLocator locator;

    private final PythonVisitorService visitor;

    /**
     * Creates a new analyzer.
     *
     * @param theLocator finds the interpreter command
     * @param theVisitor runs the visitor program
     */
    public PythonSourceAnalyzer(final InterpreterLocator theLocator,
            final PythonVisitorService theVisitor) {
        this.locator = Preconditions.requireNonNull(theLocator,
                "Locator cannot be null");
        this.visitor = Preconditions.requireNonNull(theVisitor,
                "Visitor cannot be null");
    }

    /** {@inheritDoc} */
    @Override
    public Set<Language> languages() {
        return Set.of(Language.PYTHON);
    }

    /** {@inheritDoc} */
    @Override
    protected AnalysisResult extract(final SourceUnit unit,
            final AnalysisRunContext context) {
        final Path absolutePath = unit.absolutePath();
        final Optional<AnalysisResult> cached = context.cachedResult(absolutePath);
        if (cached.isPresent()) {
            LOG.debug("Reusing visitor result for {}", absolutePath);
            return cached.get();
        }

        final String interpreter = context.interpreter(locator::locate);
        final AnalysisResult result = visitor.visit(interpreter, absolutePath,
                unit.rawText());
        context.cacheResult(absolutePath, result);
        return result;
    }

}
