package co.fanki.sourcefacts.analysis.domain.ecmascript;

import co.fanki.sourcefacts.shared.AnalysisException;
import co.fanki.sourcefacts.shared.AnalysisException.FailureKind;

import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.Node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Parses ECMAScript source into a Closure Compiler AST.
 *
 * <p>Only the parser of the compiler is used: no checks, no optimizations.
 * The input level is {@code UNSTABLE} so class fields are accepted. Private
 * names and top-level {@code await}, which this parser does not know, are
 * rewritten first by {@link EcmaScriptPreprocessor}: private names always,
 * {@code await} only when the plain parse fails. Anything the parser still
 * rejects (JSX, TypeScript annotations, plain syntax errors) surfaces as a
 * {@link FailureKind#PARSE_FAILURE}.</p>
 *
 * <p>A fresh compiler instance is created per call; instances are cheap and
 * not thread safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ClosureAstParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            ClosureAstParser.class);

    /**
     * Parses one source text.
     *
     * @param path the file name reported in errors
     * @param code the source text, already sanitized
     * @return the SCRIPT root node
     * @throws AnalysisException with kind PARSE_FAILURE on any parse error
     */
    public Node parse(final String path, final String code) {
        try {
            return parseOnce(path,
                    EcmaScriptPreprocessor.encodePrivateNames(code));
        } catch (final AnalysisException e) {
            if (!EcmaScriptPreprocessor.mentionsAwait(code)) {
                throw e;
            }
            LOG.debug("Retrying {} with await neutralized", path);
            try {
                return parseOnce(path,
                        EcmaScriptPreprocessor.encodeWithoutAwait(code));
            } catch (final AnalysisException retry) {
                e.addSuppressed(retry);
                throw e;
            }
        }
    }

    private static Node parseOnce(final String path, final String code) {
        final com.google.javascript.jscomp.Compiler compiler =
                new com.google.javascript.jscomp.Compiler(new PrintStream(
                        OutputStream.nullOutputStream(), true,
                        StandardCharsets.UTF_8));

        final CompilerOptions options = new CompilerOptions();
        options.setLanguageIn(CompilerOptions.LanguageMode.UNSTABLE);
        compiler.initOptions(options);

        final Node root;
        try {
            root = compiler.parse(SourceFile.fromCode(path, code));
        } catch (final RuntimeException e) {
            throw new AnalysisException("Cannot parse " + path + ": "
                    + e.getMessage(), FailureKind.PARSE_FAILURE, e);
        }

        if (compiler.getErrorCount() > 0 || root == null) {
            final StringBuilder message = new StringBuilder("Cannot parse ")
                    .append(path);
            // First error only.
            for (final JSError error : compiler.getErrors()) {
                message.append(": ").append(error);
                break;
            }
            throw new AnalysisException(message.toString(),
                    FailureKind.PARSE_FAILURE);
        }
        return root;
    }

}
