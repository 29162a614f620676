package co.fanki.sourcefacts.analysis.domain.ecmascript;

import com.google.javascript.rhino.Node;

import java.util.Set;
import java.util.TreeSet;

/**
 * Collects module specifiers: static imports, re-exports,
 * {@code require('x')} and {@code import('x')} with a literal argument.
 *
 * <p>Specifiers are recorded as written, never resolved.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DependencyCollector {

    Set<String> collect(final Node root) {
        final Set<String> dependencies = new TreeSet<>();
        for (final Node node : AstNodes.preOrder(root)) {
            switch (node.getToken()) {
                case IMPORT:
                    addIfPresent(dependencies,
                            AstNodes.stringLiteral(node.getLastChild()));
                    break;
                case EXPORT:
                    // export default 'x' has a single child
                    if (node.getChildCount() > 1) {
                        addIfPresent(dependencies,
                                AstNodes.stringLiteral(node.getLastChild()));
                    }
                    break;
                case CALL:
                    if (isRequire(node)) {
                        addIfPresent(dependencies, AstNodes.stringLiteral(
                                AstNodes.firstArgument(node)));
                    }
                    break;
                case DYNAMIC_IMPORT:
                    addIfPresent(dependencies,
                            AstNodes.stringLiteral(node.getFirstChild()));
                    break;
                default:
                    break;
            }
        }
        return dependencies;
    }

    private static boolean isRequire(final Node call) {
        final Node callee = call.getFirstChild();
        return callee.isName() && "require".equals(callee.getString())
                && AstNodes.argumentCount(call) == 1;
    }

    private static void addIfPresent(final Set<String> dependencies,
            final String specifier) {
        if (specifier != null && !specifier.isEmpty()) {
            dependencies.add(specifier);
        }
    }

}
