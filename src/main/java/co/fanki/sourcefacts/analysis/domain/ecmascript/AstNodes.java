package co.fanki.sourcefacts.analysis.domain.ecmascript;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers over Closure AST nodes shared by the ECMAScript collectors.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class AstNodes {

    /** Every assignment operator, plain and compound. */
    static final Set<Token> ASSIGNMENTS = EnumSet.of(Token.ASSIGN,
            Token.ASSIGN_BITOR, Token.ASSIGN_BITXOR, Token.ASSIGN_BITAND,
            Token.ASSIGN_LSH, Token.ASSIGN_RSH, Token.ASSIGN_URSH,
            Token.ASSIGN_ADD, Token.ASSIGN_SUB, Token.ASSIGN_MUL,
            Token.ASSIGN_DIV, Token.ASSIGN_MOD, Token.ASSIGN_EXPONENT,
            Token.ASSIGN_OR, Token.ASSIGN_AND, Token.ASSIGN_COALESCE);

    private static final Set<Token> CALLS = EnumSet.of(Token.CALL,
            Token.OPTCHAIN_CALL);

    private static final Set<Token> PROPERTY_ACCESS = EnumSet.of(
            Token.GETPROP, Token.OPTCHAIN_GETPROP);

    private static final Set<Token> ELEMENT_ACCESS = EnumSet.of(
            Token.GETELEM, Token.OPTCHAIN_GETELEM);

    private static final Set<Token> STATEMENT_CONTAINERS = EnumSet.of(
            Token.SCRIPT, Token.MODULE_BODY, Token.BLOCK, Token.EXPORT,
            Token.LABEL);

    private AstNodes() {
    }

    /**
     * Lists every node under the root in pre-order, root first.
     *
     * <p>Iterative, so deeply nested input cannot overflow the stack.</p>
     *
     * @param root the root node
     * @return the nodes in source encounter order
     */
    static List<Node> preOrder(final Node root) {
        final List<Node> nodes = new ArrayList<>();
        final Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final Node node = pending.pop();
            nodes.add(node);
            for (Node child = node.getLastChild(); child != null;
                    child = child.getPrevious()) {
                pending.push(child);
            }
        }
        return nodes;
    }

    static boolean isCall(final Node node) {
        return CALLS.contains(node.getToken());
    }

    static boolean isPropertyAccess(final Node node) {
        return PROPERTY_ACCESS.contains(node.getToken());
    }

    static boolean isElementAccess(final Node node) {
        return ELEMENT_ACCESS.contains(node.getToken());
    }

    static boolean isMemberAccess(final Node node) {
        return isPropertyAccess(node) || isElementAccess(node);
    }

    static boolean isAssignment(final Node node) {
        return ASSIGNMENTS.contains(node.getToken());
    }

    /**
     * Whether a FUNCTION node is a statement-level named declaration.
     *
     * @param function the FUNCTION node
     * @return true for {@code function name() {}} in statement position
     */
    static boolean isFunctionDeclaration(final Node function) {
        if (!function.isFunction() || function.isArrowFunction()) {
            return false;
        }
        final Node parent = function.getParent();
        return !function.getFirstChild().getString().isEmpty()
                && parent != null
                && STATEMENT_CONTAINERS.contains(parent.getToken());
    }

    /**
     * Whether a CLASS node is a statement-level named declaration.
     *
     * @param clazz the CLASS node
     * @return true for {@code class Name {}} in statement position
     */
    static boolean isClassDeclaration(final Node clazz) {
        final Node parent = clazz.getParent();
        return clazz.isClass() && clazz.getFirstChild().isName()
                && parent != null
                && STATEMENT_CONTAINERS.contains(parent.getToken());
    }

    /**
     * Returns the value of a literal key: a string or a number.
     *
     * @param node the node
     * @return the literal text, or null when the node is not a literal
     */
    static String literalKey(final Node node) {
        if (node == null) {
            return null;
        }
        if (node.isStringLit()) {
            return node.getString();
        }
        if (node.isNumber()) {
            final double value = node.getDouble();
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
        return null;
    }

    /**
     * Returns the string of a STRINGLIT node.
     *
     * @param node the node, may be null
     * @return the string, or null when the node is not a string literal
     */
    static String stringLiteral(final Node node) {
        return node != null && node.isStringLit() ? node.getString() : null;
    }

    /**
     * Returns the first argument of a call or new expression.
     *
     * @param call the CALL or NEW node
     * @return the first argument, or null
     */
    static Node firstArgument(final Node call) {
        return call.getFirstChild().getNext();
    }

    /**
     * Returns the number of arguments of a call or new expression.
     *
     * @param call the CALL or NEW node
     * @return the argument count
     */
    static int argumentCount(final Node call) {
        return call.getChildCount() - 1;
    }

    /**
     * Names a callee the way the call order shows it.
     *
     * <p>Member chains are dot-joined, literal element keys are kept,
     * {@code this} is dropped so {@code this.save()} reads {@code save}, and
     * an inline function reads {@code (anonymous)}.</p>
     *
     * @param callee the callee expression
     * @return the name, or null when nothing nameable remains
     */
    static String calleeName(final Node callee) {
        if (callee == null) {
            return null;
        }
        switch (callee.getToken()) {
            case NAME:
                return callee.getString();
            case THIS:
                return null;
            case SUPER:
                return "super";
            case FUNCTION:
                return "(anonymous)";
            case GETPROP:
            case OPTCHAIN_GETPROP:
                return join(calleeName(callee.getFirstChild()),
                        callee.getString());
            case GETELEM:
            case OPTCHAIN_GETELEM:
                final String receiver = calleeName(callee.getFirstChild());
                final String key = literalKey(callee.getSecondChild());
                return key == null ? receiver : join(receiver, key);
            case CALL:
            case OPTCHAIN_CALL:
            case NEW:
                return calleeName(callee.getFirstChild());
            case CAST:
                return calleeName(callee.getFirstChild());
            default:
                return null;
        }
    }

    /**
     * Names a member chain the way the API tables spell it.
     *
     * <p>Unlike {@link #calleeName(Node)} the receiver {@code this} is kept,
     * and {@code window.} is kept as written.</p>
     *
     * @param node the expression
     * @return the dot-joined chain, or null when the root cannot be named
     */
    static String memberChain(final Node node) {
        if (node == null) {
            return null;
        }
        switch (node.getToken()) {
            case NAME:
                return node.getString();
            case THIS:
                return "this";
            case GETPROP:
            case OPTCHAIN_GETPROP:
                return join(memberChain(node.getFirstChild()),
                        node.getString());
            case GETELEM:
            case OPTCHAIN_GETELEM:
                final String receiver = memberChain(node.getFirstChild());
                final String key = literalKey(node.getSecondChild());
                return key == null ? receiver : join(receiver, key);
            case CALL:
            case OPTCHAIN_CALL:
                return memberChain(node.getFirstChild());
            default:
                return null;
        }
    }

    /**
     * Returns the innermost receiver of a member chain.
     *
     * @param node the expression
     * @return the root node, the node itself when it is not a member access
     */
    static Node chainRoot(final Node node) {
        Node current = node;
        while (isMemberAccess(current) || isCall(current)) {
            current = current.getFirstChild();
        }
        return current;
    }

    /**
     * Returns the last segment of a dot-joined chain.
     *
     * @param chain the chain
     * @return the last segment
     */
    static String lastSegment(final String chain) {
        final int dot = chain.lastIndexOf('.');
        return dot < 0 ? chain : chain.substring(dot + 1);
    }

    /**
     * Collects the NAME targets bound by a declaration target.
     *
     * <p>Handles plain names, object and array patterns, defaults and rest
     * elements. Member targets inside an assignment pattern are skipped.</p>
     *
     * @param target the NAME or pattern node
     * @return the bound NAME nodes in source order
     */
    static List<Node> boundNames(final Node target) {
        final List<Node> names = new ArrayList<>();
        collectBoundNames(target, names);
        return names;
    }

    private static void collectBoundNames(final Node target,
            final List<Node> names) {
        if (target == null) {
            return;
        }
        switch (target.getToken()) {
            case NAME:
                names.add(target);
                break;
            case DEFAULT_VALUE:
            case ITER_REST:
            case OBJECT_REST:
            case STRING_KEY:
                collectBoundNames(target.getFirstChild(), names);
                break;
            case COMPUTED_PROP:
                collectBoundNames(target.getSecondChild(), names);
                break;
            case ARRAY_PATTERN:
            case OBJECT_PATTERN:
            case PARAM_LIST:
            case DESTRUCTURING_LHS:
                if (target.isDestructuringLhs()) {
                    collectBoundNames(target.getFirstChild(), names);
                    break;
                }
                for (Node child = target.getFirstChild(); child != null;
                        child = child.getNext()) {
                    collectBoundNames(child, names);
                }
                break;
            default:
                break;
        }
    }

    private static String join(final String receiver, final String property) {
        if (receiver == null) {
            return property;
        }
        return receiver + "." + property;
    }

}
