package co.fanki.sourcefacts.analysis.domain.ecmascript;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Enumerates the functions an ECMAScript unit declares.
 *
 * <p>Counted: named declarations and expressions, functions and arrows bound
 * to a variable or assigned to a name or property, object literal methods
 * and function-valued properties, class methods other than the constructor,
 * getters and setters, class fields holding a function. Imported bindings
 * (ES imports and {@code const {a} = require('x')}) are candidates only:
 * they count when the unit later calls them by name.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FunctionCatalogCollector {

    /**
     * Collects the function names of a parsed unit.
     *
     * @param root the SCRIPT node
     * @return the names, sorted
     */
    Set<String> collect(final Node root) {
        final Set<String> functions = new TreeSet<>();
        final Set<String> candidates = new HashSet<>();
        final Set<String> called = new HashSet<>();

        for (final Node node : AstNodes.preOrder(root)) {
            switch (node.getToken()) {
                case FUNCTION:
                    addIfNamed(functions, node.getFirstChild().getString());
                    break;
                case NAME:
                    if (isDeclaredWithFunction(node)) {
                        functions.add(node.getString());
                    }
                    break;
                case DESTRUCTURING_LHS:
                    collectRequireBindings(node, functions, candidates);
                    break;
                case IMPORT:
                    collectImportBindings(node, candidates);
                    break;
                case ASSIGN:
                    if (node.getSecondChild().isFunction()) {
                        addIfNamed(functions, assignedName(node.getFirstChild()));
                    }
                    break;
                case STRING_KEY:
                    if (node.getParent().isObjectLit()
                            && node.getFirstChild() != null
                            && node.getFirstChild().isFunction()) {
                        functions.add(node.getString());
                    }
                    break;
                case MEMBER_FUNCTION_DEF:
                    if (!isConstructor(node)) {
                        functions.add(node.getString());
                    }
                    break;
                case GETTER_DEF:
                case SETTER_DEF:
                    functions.add(node.getString());
                    break;
                case MEMBER_FIELD_DEF:
                    if (node.getFirstChild() != null
                            && node.getFirstChild().isFunction()) {
                        functions.add(node.getString());
                    }
                    break;
                case COMPUTED_PROP:
                    if (node.getSecondChild().isFunction()) {
                        addIfNamed(functions,
                                AstNodes.literalKey(node.getFirstChild()));
                    }
                    break;
                case CALL:
                case OPTCHAIN_CALL:
                    if (node.getFirstChild().isName()) {
                        called.add(node.getFirstChild().getString());
                    }
                    break;
                default:
                    break;
            }
        }

        for (final String candidate : candidates) {
            if (called.contains(candidate)) {
                functions.add(candidate);
            }
        }
        return functions;
    }

    private static boolean isDeclaredWithFunction(final Node name) {
        final Node parent = name.getParent();
        final Node init = name.getFirstChild();
        return parent != null
                && (parent.isVar() || parent.isLet() || parent.isConst())
                && init != null && init.isFunction();
    }

    private static boolean isConstructor(final Node member) {
        return member.getParent().isClassMembers()
                && !member.isStaticMember()
                && "constructor".equals(member.getString());
    }

    private static String assignedName(final Node target) {
        if (target.isName()) {
            return target.getString();
        }
        if (AstNodes.isPropertyAccess(target)) {
            return target.getString();
        }
        if (AstNodes.isElementAccess(target)) {
            return AstNodes.literalKey(target.getSecondChild());
        }
        return null;
    }

    private static void collectRequireBindings(final Node lhs,
            final Set<String> functions, final Set<String> candidates) {
        final Node pattern = lhs.getFirstChild();
        final Node init = lhs.getSecondChild();
        if (!pattern.isObjectPattern() || !isRequireCall(init)) {
            return;
        }
        for (Node element = pattern.getFirstChild(); element != null;
                element = element.getNext()) {
            final List<Node> names = AstNodes.boundNames(element);
            if (element.getToken() == Token.OBJECT_REST) {
                names.forEach(name -> functions.add(name.getString()));
            } else {
                names.forEach(name -> candidates.add(name.getString()));
            }
        }
    }

    private static void collectImportBindings(final Node importNode,
            final Set<String> candidates) {
        final Node defaultBinding = importNode.getFirstChild();
        if (defaultBinding.isName()) {
            candidates.add(defaultBinding.getString());
        }
        final Node bindings = defaultBinding.getNext();
        if (bindings.getToken() == Token.IMPORT_STAR) {
            candidates.add(bindings.getString());
        } else if (bindings.getToken() == Token.IMPORT_SPECS) {
            for (Node specifier = bindings.getFirstChild(); specifier != null;
                    specifier = specifier.getNext()) {
                candidates.add(specifier.getLastChild().getString());
            }
        }
    }

    private static boolean isRequireCall(final Node node) {
        return node != null && node.isCall()
                && node.getFirstChild().isName()
                && "require".equals(node.getFirstChild().getString());
    }

    private static void addIfNamed(final Set<String> functions,
            final String name) {
        if (name != null && !name.isEmpty()) {
            functions.add(name);
        }
    }

}
