package co.fanki.sourcefacts.analysis.domain.ecmascript;

import co.fanki.sourcefacts.analysis.domain.SideEffectTags;

import com.google.javascript.rhino.Node;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tags the side-effect categories an ECMAScript unit exhibits.
 *
 * <p>Calls are classified by their member chain, assignments and updates by
 * the root of their target. Writes to bare identifiers are tagged
 * {@code STATE:module} only when the scope-aware walk found one that is not
 * function or block local.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SideEffectCollector {

    SideEffectTags collect(final Node root, final boolean moduleStateWritten) {
        final Set<String> tags = new TreeSet<>();
        if (moduleStateWritten) {
            tags.add("STATE:module");
        }

        for (final Node node : AstNodes.preOrder(root)) {
            if (AstNodes.isCall(node)) {
                classifyCall(AstNodes.memberChain(node.getFirstChild()), tags);
            } else if (node.isNew()) {
                classifyConstruction(node, tags);
            } else if (AstNodes.isAssignment(node)) {
                classifyAssignmentTarget(node.getFirstChild(), tags);
            } else if (node.isInc() || node.isDec()) {
                classifyUpdateTarget(node.getFirstChild(), tags);
            } else if (AstNodes.isPropertyAccess(node)) {
                final String chain = AstNodes.memberChain(node);
                if (chain != null && EcmaScriptApiTables.isProcessEnv(chain)) {
                    tags.add("CONFIG:process.env");
                }
            }
        }
        return SideEffectTags.of(tags);
    }

    private static void classifyCall(final String rawChain,
            final Set<String> tags) {
        if (rawChain == null) {
            return;
        }
        final String chain = EcmaScriptApiTables.withoutWindow(rawChain);
        final String method = AstNodes.lastSegment(chain);

        if (EcmaScriptApiTables.isFsRead(chain)) {
            tags.add("FILE:read");
        }
        if (EcmaScriptApiTables.isFsWrite(chain)) {
            tags.add("FILE:write");
        }
        if (EcmaScriptApiTables.isNetwork(chain)) {
            tags.add("NETWORK");
        }
        if (EcmaScriptApiTables.storageObject(chain) != null) {
            if (EcmaScriptApiTables.STORAGE_READS.contains(method)) {
                tags.add("STORAGE:read");
            } else if (EcmaScriptApiTables.STORAGE_WRITES.contains(method)) {
                tags.add("STORAGE:write");
            }
        }
        if (chain.startsWith("console.")
                && EcmaScriptApiTables.CONSOLE_LEVELS.contains(method)) {
            tags.add("LOG:console");
        }

        final String documentMember = EcmaScriptApiTables.documentMember(chain);
        if (documentMember != null) {
            if (EcmaScriptApiTables.DOM_WRITE.contains(documentMember)
                    || EcmaScriptApiTables.DOM_WRITE.contains(method)) {
                tags.add("DOM:mutate");
            } else if (EcmaScriptApiTables.DOM_READ.contains(method)) {
                tags.add("DOM:read");
            }
        }

        if (EcmaScriptApiTables.WINDOW_DIALOGS.contains(chain)
                || (rawChain.startsWith("window.")
                        && EcmaScriptApiTables.WINDOW_DIALOGS.contains(method))) {
            tags.add("UI:window");
        }
        if (Arrays.asList(chain.split("\\.")).contains("emit")
                || "dispatchEvent".equals(method)) {
            tags.add("EVENT:emit");
        }
        if ("setState".equals(method) || "forceUpdate".equals(method)) {
            tags.add("STATE:component");
        }
        if (EcmaScriptApiTables.TIMERS.contains(chain)) {
            tags.add("TIMER");
        }
        if (EcmaScriptApiTables.RANDOM.contains(chain)
                || EcmaScriptApiTables.CLOCK.contains(chain)) {
            tags.add("NON_DETERMINISTIC");
        }
    }

    private static void classifyConstruction(final Node newNode,
            final Set<String> tags) {
        final String chain = AstNodes.memberChain(newNode.getFirstChild());
        if (chain == null) {
            return;
        }
        if ("Date".equals(chain)) {
            tags.add("NON_DETERMINISTIC");
        } else if (EcmaScriptApiTables.isNetwork(chain)) {
            tags.add("NETWORK");
        }
    }

    private static void classifyAssignmentTarget(final Node target,
            final Set<String> tags) {
        if (!AstNodes.isMemberAccess(target)) {
            return;
        }
        final String chain = AstNodes.memberChain(target);
        final Node root = AstNodes.chainRoot(target);
        final String rootName = root.isName() ? root.getString() : null;

        if (chain != null && EcmaScriptApiTables.storageObject(chain) != null) {
            tags.add("STORAGE:write");
        } else if (chain != null
                && EcmaScriptApiTables.documentMember(chain) != null) {
            tags.add("DOM:mutate");
        } else if (chain != null && (chain.equals("module.exports")
                || chain.startsWith("module.exports.")
                || "exports".equals(rootName))) {
            tags.add("MODULE:export");
        } else if (chain != null && EcmaScriptApiTables.isProcessEnv(chain)) {
            tags.add("CONFIG:process.env");
        } else if (rootName != null
                && EcmaScriptApiTables.GLOBAL_OBJECTS.contains(rootName)) {
            tags.add("STATE:global");
        } else if (root.isThis()) {
            tags.add("STATE:instance");
        }
    }

    private static void classifyUpdateTarget(final Node target,
            final Set<String> tags) {
        if (!AstNodes.isMemberAccess(target)) {
            return;
        }
        final Node root = AstNodes.chainRoot(target);
        if (root.isThis()) {
            tags.add("STATE:instance");
        } else if (root.isName()
                && EcmaScriptApiTables.GLOBAL_OBJECTS.contains(root.getString())) {
            tags.add("STATE:global");
        }
    }

}
