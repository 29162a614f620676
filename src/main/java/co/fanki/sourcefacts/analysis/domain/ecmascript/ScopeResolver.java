package co.fanki.sourcefacts.analysis.domain.ecmascript;

import co.fanki.sourcefacts.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Chain of lexical scopes maintained while walking an ECMAScript AST.
 *
 * <p>The walker opens a scope for every function-like node and block,
 * declares every binding before visiting its initializer, and asks the
 * resolver to classify each identifier reference. Declarations are seen in
 * encounter order only: a reference that precedes the declaration of the
 * same name keeps the classification it got when it was seen.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ScopeResolver {

    /** Identifiers provided by the host, never reported as free. */
    public static final Set<String> HOST_GLOBALS = Set.of(
            "console", "document", "window", "globalThis", "Math", "JSON",
            "Array", "Object", "String", "Number", "Boolean", "Promise",
            "Set", "Map", "WeakMap", "WeakSet", "Date", "RegExp", "Intl",
            "Symbol", "Reflect", "localStorage", "sessionStorage", "fetch",
            "require", "module", "exports", "__dirname", "__filename",
            "process", "setTimeout", "setInterval", "clearTimeout",
            "clearInterval", "undefined", "NaN", "Infinity", "arguments");

    /** How an identifier reference resolved. */
    public enum Resolution {

        /** Declared in a function or block scope on the chain. */
        LOCAL,

        /** Declared at module scope. */
        MODULE,

        /** Not declared anywhere, but provided by the host. */
        HOST,

        /** Not declared anywhere: a free variable. */
        FREE
    }

    private final Deque<Scope> scopes = new ArrayDeque<>();

    /** Creates a resolver positioned at module scope. */
    public ScopeResolver() {
        scopes.push(new Scope(true));
    }

    /** Opens the scope of a function-like node. */
    public void enterFunction() {
        scopes.push(new Scope(true));
    }

    /** Opens the scope of a block, loop or catch clause. */
    public void enterBlock() {
        scopes.push(new Scope(false));
    }

    /** Closes the innermost scope; the module scope is never closed. */
    public void exit() {
        Preconditions.require(scopes.size() > 1,
                "Cannot exit the module scope");
        scopes.pop();
    }

    /**
     * Declares a lexical binding in the innermost scope.
     *
     * @param name the bound name
     * @return true when the binding landed in the module scope
     */
    public boolean declare(final String name) {
        final Scope scope = scopes.peek();
        scope.names.add(name);
        return scope == scopes.peekLast();
    }

    /**
     * Declares a {@code var} binding in the innermost function scope.
     *
     * @param name the bound name
     * @return true when the binding landed in the module scope
     */
    public boolean declareVar(final String name) {
        for (final Scope scope : scopes) {
            if (scope.functionLike) {
                scope.names.add(name);
                return scope == scopes.peekLast();
            }
        }
        throw new IllegalStateException("No function scope on the chain");
    }

    /**
     * Resolves a reference by walking the chain outward.
     *
     * @param name the referenced name
     * @return the resolution
     */
    public Resolution resolve(final String name) {
        final Iterator<Scope> it = scopes.iterator();
        while (it.hasNext()) {
            final Scope scope = it.next();
            if (scope.names.contains(name)) {
                return it.hasNext() ? Resolution.LOCAL : Resolution.MODULE;
            }
        }
        return HOST_GLOBALS.contains(name) ? Resolution.HOST : Resolution.FREE;
    }

    /**
     * Whether the innermost scope is the module scope.
     *
     * @return true at top level
     */
    public boolean atModuleScope() {
        return scopes.size() == 1;
    }

    /**
     * Returns the number of open scopes, the module scope included.
     *
     * @return the depth
     */
    public int depth() {
        return scopes.size();
    }

    private static final class Scope {

        private final boolean functionLike;

        private final Set<String> names = new HashSet<>();

        private Scope(final boolean isFunctionLike) {
            this.functionLike = isFunctionLike;
        }
    }

}
