package co.fanki.sourcefacts.analysis.domain.ecmascript;

import co.fanki.sourcefacts.analysis.domain.IoFacts;

import com.google.javascript.rhino.Node;

import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the input and output touchpoints of an ECMAScript unit.
 *
 * <p>Inputs: event listeners, DOM lookups through {@code document}, file
 * reads, fetch-style network calls, storage reads, {@code process.env}.
 * Outputs: DOM mutations through {@code document}, file writes, storage
 * writes, console logging, and whatever the unit hands back to its caller
 * (returns, exports).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class IoCollector {

    IoFacts collect(final Node root) {
        final Set<String> inputs = new TreeSet<>();
        final Set<String> outputs = new TreeSet<>();

        for (final Node node : AstNodes.preOrder(root)) {
            if (AstNodes.isCall(node)) {
                classifyCall(node, inputs, outputs);
            } else if (AstNodes.isAssignment(node)) {
                classifyAssignmentTarget(node.getFirstChild(), outputs);
            } else if (AstNodes.isPropertyAccess(node)) {
                final String chain = AstNodes.memberChain(node);
                if (chain != null && EcmaScriptApiTables.isProcessEnv(chain)) {
                    inputs.add("CONFIG:process.env");
                }
            } else if (node.isReturn() && node.hasChildren()) {
                outputs.add("COMPONENT:return");
            } else if (node.isExport()) {
                outputs.add("COMPONENT:export");
            }
        }
        return IoFacts.of(inputs, outputs);
    }

    private static void classifyCall(final Node call, final Set<String> inputs,
            final Set<String> outputs) {
        final String chain = AstNodes.memberChain(call.getFirstChild());
        if (chain == null) {
            return;
        }
        final String method = AstNodes.lastSegment(chain);

        if ("addEventListener".equals(method)) {
            final String event = AstNodes.stringLiteral(
                    AstNodes.firstArgument(call));
            inputs.add("USER:addEventListener("
                    + (event != null ? event : "event") + ")");
            return;
        }

        final String documentMember = EcmaScriptApiTables.documentMember(chain);
        if (documentMember != null) {
            if (EcmaScriptApiTables.DOM_READ.contains(method)) {
                inputs.add("UI:" + EcmaScriptApiTables.withoutWindow(chain));
            } else if (isDomOutput(documentMember, method)) {
                outputs.add("UI:" + EcmaScriptApiTables.withoutWindow(chain));
            }
            return;
        }

        if (EcmaScriptApiTables.FS_READ.matcher(chain).find()) {
            inputs.add("FILE:" + chain + "()");
        } else if (EcmaScriptApiTables.FS_WRITE.matcher(chain).find()) {
            outputs.add("FILE:" + chain + "()");
        } else if (EcmaScriptApiTables.isFetchLike(chain)) {
            inputs.add("NETWORK:" + chain);
        } else if (EcmaScriptApiTables.storageObject(chain) != null) {
            final String storage = EcmaScriptApiTables.withoutWindow(chain);
            if ("getItem".equals(method)) {
                inputs.add("STORAGE:" + storage);
            } else if ("setItem".equals(method) || "removeItem".equals(method)) {
                outputs.add("STORAGE:" + storage);
            }
        } else if (chain.startsWith("console.")
                && EcmaScriptApiTables.CONSOLE_LEVELS.contains(method)) {
            outputs.add("LOG:" + chain);
        }
    }

    private static boolean isDomOutput(final String documentMember,
            final String method) {
        if ("write".equals(method) || "writeln".equals(method)) {
            return false;
        }
        return EcmaScriptApiTables.DOM_WRITE.contains(documentMember)
                || EcmaScriptApiTables.DOM_WRITE.contains(method);
    }

    private static void classifyAssignmentTarget(final Node target,
            final Set<String> outputs) {
        if (!AstNodes.isMemberAccess(target)) {
            return;
        }
        final String chain = AstNodes.memberChain(target);
        if (chain == null) {
            return;
        }
        if (EcmaScriptApiTables.documentMember(chain) != null) {
            outputs.add("UI:" + EcmaScriptApiTables.withoutWindow(chain));
        } else if (EcmaScriptApiTables.storageObject(chain) != null) {
            outputs.add("STORAGE:" + EcmaScriptApiTables.withoutWindow(chain));
        } else if (chain.equals("module.exports")
                || chain.startsWith("module.exports.")) {
            outputs.add("COMPONENT:module.exports");
        } else if (chain.startsWith("exports.")) {
            outputs.add("COMPONENT:" + chain);
        }
    }

}
