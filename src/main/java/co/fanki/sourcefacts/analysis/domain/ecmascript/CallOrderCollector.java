package co.fanki.sourcefacts.analysis.domain.ecmascript;

import com.google.javascript.rhino.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists call and {@code new} expressions in source encounter order.
 *
 * <p>Pre-order: an outer call comes before the calls in its arguments.
 * Nothing is sorted or deduplicated.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CallOrderCollector {

    List<String> collect(final Node root) {
        final List<String> calls = new ArrayList<>();
        for (final Node node : AstNodes.preOrder(root)) {
            if (AstNodes.isCall(node)) {
                addIfNamed(calls, AstNodes.calleeName(node.getFirstChild()));
            } else if (node.isNew()) {
                final String name = AstNodes.calleeName(node.getFirstChild());
                if (name != null) {
                    calls.add("new " + name);
                }
            }
        }
        return calls;
    }

    private static void addIfNamed(final List<String> calls, final String name) {
        if (name != null && !name.isEmpty()) {
            calls.add(name);
        }
    }

}
