package co.fanki.sourcefacts.analysis.domain.python;

import co.fanki.sourcefacts.analysis.domain.AnalysisResult;

import java.nio.file.Path;

/**
 * Runs the Python AST visitor over one source unit.
 *
 * <p>The contract is request in, facts out: the analyzer neither knows nor
 * cares whether the visitor runs in another process or in this one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface PythonVisitorService {

    /**
     * Visits one unit.
     *
     * @param interpreter the interpreter command to run the visitor with
     * @param absolutePath the absolute path of the unit, passed as argument
     * @param source the source text
     * @return the facts
     * @throws SubprocessFailureException if the visitor fails for this unit
     */
    AnalysisResult visit(String interpreter, Path absolutePath, String source);

}
