package co.fanki.sourcefacts.analysis.domain.ecmascript;

import co.fanki.sourcefacts.analysis.domain.DataFlowFacts;
import co.fanki.sourcefacts.analysis.domain.ecmascript.ScopeResolver.Resolution;

import com.google.javascript.rhino.Node;

/**
 * Scope-aware walk that extracts the data-flow facts of an ECMAScript unit.
 *
 * <p>Every function opens a function scope; every block, loop and catch
 * clause opens a block scope. Bindings are declared before their
 * initializers are visited. A NAME reached through any other path is a
 * reference: assignment and update targets are writes, everything else is
 * a read. The property name of {@code a.b} is not a node, so it is never
 * a reference; neither is a bare identifier used as a computed key,
 * {@code a[b]}.</p>
 *
 * <p>Module-level {@code var}, {@code let}, {@code const} and class
 * declarations count as global writes, as does any write to a name that
 * resolves to the module scope or to nothing at all. Free reads outside the
 * host allowlist count as global reads.</p>
 *
 * <p>One instance per unit: the resolver and the accumulator live for one
 * walk.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DataFlowCollector {

    private static final String DYNAMIC = "<dynamic>";

    private static final String EXPRESSION = "<expression>";

    private final ScopeResolver scopes = new ScopeResolver();

    private final DataFlowFacts.Builder facts = DataFlowFacts.builder();

    private boolean moduleStateWritten;

    /**
     * What one walk produced.
     *
     * @param dataFlow the data-flow facts
     * @param moduleStateWritten whether some assignment or update wrote a
     *        name that is not function or block local
     */
    record ScopedFacts(DataFlowFacts dataFlow, boolean moduleStateWritten) {
    }

    /**
     * Walks a parsed unit.
     *
     * @param root the SCRIPT node
     * @return the facts
     */
    static ScopedFacts collect(final Node root) {
        final DataFlowCollector collector = new DataFlowCollector();
        collector.visit(root);
        return new ScopedFacts(collector.facts.build(),
                collector.moduleStateWritten);
    }

    private void visit(final Node node) {
        if (node == null) {
            return;
        }
        if (AstNodes.isAssignment(node)) {
            visitAssignment(node);
            return;
        }
        switch (node.getToken()) {
            case FUNCTION:
                visitFunction(node);
                break;
            case CLASS:
                visitClass(node);
                break;
            case VAR:
            case LET:
            case CONST:
                visitDeclaration(node);
                break;
            case BLOCK:
            case FOR:
            case FOR_IN:
            case FOR_OF:
            case FOR_AWAIT_OF:
                scopes.enterBlock();
                visitChildren(node);
                scopes.exit();
                break;
            case CATCH:
                visitCatch(node);
                break;
            case IMPORT:
                visitImport(node);
                break;
            case EXPORT:
                visitExport(node);
                break;
            case INC:
            case DEC:
                visitUpdate(node);
                break;
            case NAME:
                read(node.getString());
                break;
            case GETPROP:
            case OPTCHAIN_GETPROP:
                visit(node.getFirstChild());
                break;
            case GETELEM:
            case OPTCHAIN_GETELEM:
                visit(node.getFirstChild());
                if (!node.getSecondChild().isName()) {
                    visit(node.getSecondChild());
                }
                break;
            case CALL:
            case OPTCHAIN_CALL:
                recordCall(node);
                visitChildren(node);
                break;
            default:
                visitChildren(node);
                break;
        }
    }

    private void visitChildren(final Node node) {
        for (Node child = node.getFirstChild(); child != null;
                child = child.getNext()) {
            visit(child);
        }
    }

    private void visitFunction(final Node function) {
        final String name = function.getFirstChild().getString();
        final boolean declaration = AstNodes.isFunctionDeclaration(function);
        if (declaration) {
            scopes.declare(name);
        }

        scopes.enterFunction();
        if (!declaration && !name.isEmpty()) {
            scopes.declare(name);
        }
        final Node params = function.getSecondChild();
        for (final Node param : AstNodes.boundNames(params)) {
            scopes.declare(param.getString());
        }
        visitPatternExpressions(params);

        final Node body = function.getLastChild();
        if (body.isBlock()) {
            visitChildren(body);
        } else {
            visit(body);
        }
        scopes.exit();
    }

    private void visitClass(final Node clazz) {
        final Node name = clazz.getFirstChild();
        boolean ownScope = false;
        if (name.isName()) {
            if (AstNodes.isClassDeclaration(clazz)) {
                if (scopes.declare(name.getString())) {
                    facts.globalWritten(name.getString());
                }
            } else {
                scopes.enterBlock();
                scopes.declare(name.getString());
                ownScope = true;
            }
        }
        final Node superClass = name.getNext();
        if (!superClass.isEmpty()) {
            visit(superClass);
        }
        visitChildren(clazz.getLastChild());
        if (ownScope) {
            scopes.exit();
        }
    }

    private void visitDeclaration(final Node declaration) {
        final boolean functionScoped = declaration.isVar();
        for (Node child = declaration.getFirstChild(); child != null;
                child = child.getNext()) {
            if (child.isName()) {
                declareBinding(child.getString(), functionScoped);
                visit(child.getFirstChild());
            } else if (child.isDestructuringLhs()) {
                final Node pattern = child.getFirstChild();
                for (final Node name : AstNodes.boundNames(pattern)) {
                    declareBinding(name.getString(), functionScoped);
                }
                visitPatternExpressions(pattern);
                visit(child.getSecondChild());
            }
        }
    }

    private void declareBinding(final String name, final boolean functionScoped) {
        final boolean moduleLevel = functionScoped
                ? scopes.declareVar(name)
                : scopes.declare(name);
        if (moduleLevel) {
            facts.globalWritten(name);
        }
    }

    private void visitCatch(final Node catchNode) {
        scopes.enterBlock();
        final Node param = catchNode.getFirstChild();
        for (final Node name : AstNodes.boundNames(param)) {
            scopes.declare(name.getString());
        }
        visitPatternExpressions(param);
        visit(catchNode.getSecondChild());
        scopes.exit();
    }

    private void visitImport(final Node importNode) {
        final Node defaultBinding = importNode.getFirstChild();
        if (defaultBinding.isName()) {
            scopes.declare(defaultBinding.getString());
        }
        final Node bindings = defaultBinding.getNext();
        switch (bindings.getToken()) {
            case IMPORT_STAR:
                scopes.declare(bindings.getString());
                break;
            case IMPORT_SPECS:
                for (Node specifier = bindings.getFirstChild(); specifier != null;
                        specifier = specifier.getNext()) {
                    scopes.declare(specifier.getLastChild().getString());
                }
                break;
            default:
                break;
        }
        final String source = AstNodes.stringLiteral(importNode.getLastChild());
        if (source != null) {
            facts.sharedState("import:" + source);
        }
    }

    private void visitExport(final Node export) {
        final Node exported = export.getFirstChild();
        if (isDefaultExport(export)) {
            facts.sharedState("export:default");
            visit(exported);
            return;
        }

        if (export.getChildCount() > 1) {
            final String source = AstNodes.stringLiteral(export.getLastChild());
            if (source != null) {
                facts.sharedState("export-from:" + source);
            }
        }

        switch (exported.getToken()) {
            case EXPORT_SPECS:
                for (Node specifier = exported.getFirstChild(); specifier != null;
                        specifier = specifier.getNext()) {
                    facts.sharedState("export:" + specifier.getLastChild().getString());
                }
                break;
            case FUNCTION:
            case CLASS:
                if (exported.getFirstChild().isName()
                        && !exported.getFirstChild().getString().isEmpty()) {
                    facts.sharedState("export:"
                            + exported.getFirstChild().getString());
                }
                visit(exported);
                break;
            case VAR:
            case LET:
            case CONST:
                for (Node child = exported.getFirstChild(); child != null;
                        child = child.getNext()) {
                    for (final Node name : AstNodes.boundNames(child)) {
                        facts.sharedState("export:" + name.getString());
                    }
                }
                visit(exported);
                break;
            default:
                break;
        }
    }

    /**
     * {@code export default} of an expression or of an anonymous function
     * or class. A named default declaration reads as a named export.
     */
    private static boolean isDefaultExport(final Node export) {
        if (export.getChildCount() != 1) {
            return false;
        }
        final Node exported = export.getFirstChild();
        switch (exported.getToken()) {
            case EXPORT_SPECS:
            case VAR:
            case LET:
            case CONST:
            case EMPTY:
                return false;
            case FUNCTION:
                return exported.getFirstChild().getString().isEmpty();
            case CLASS:
                return !exported.getFirstChild().isName();
            default:
                return true;
        }
    }

    private void visitAssignment(final Node assignment) {
        final Node target = assignment.getFirstChild();
        if (target.isName()) {
            write(target.getString());
        } else if (target.isObjectPattern() || target.isArrayPattern()) {
            for (final Node name : AstNodes.boundNames(target)) {
                write(name.getString());
            }
            visitPatternExpressions(target);
        } else {
            visit(target);
        }
        visit(assignment.getSecondChild());
    }

    private void visitUpdate(final Node update) {
        final Node operand = update.getFirstChild();
        if (operand.isName()) {
            write(operand.getString());
        } else {
            visit(operand);
        }
    }

    /**
     * Visits the expressions a binding pattern contains (defaults, computed
     * keys, member targets) without visiting the names it binds.
     */
    private void visitPatternExpressions(final Node target) {
        if (target == null) {
            return;
        }
        switch (target.getToken()) {
            case NAME:
            case EMPTY:
                break;
            case DEFAULT_VALUE:
                visitPatternExpressions(target.getFirstChild());
                visit(target.getSecondChild());
                break;
            case STRING_KEY:
            case ITER_REST:
            case OBJECT_REST:
                visitPatternExpressions(target.getFirstChild());
                break;
            case COMPUTED_PROP:
                visit(target.getFirstChild());
                visitPatternExpressions(target.getSecondChild());
                break;
            case ARRAY_PATTERN:
            case OBJECT_PATTERN:
            case PARAM_LIST:
                for (Node child = target.getFirstChild(); child != null;
                        child = child.getNext()) {
                    visitPatternExpressions(child);
                }
                break;
            default:
                visit(target);
                break;
        }
    }

    private void write(final String name) {
        final Resolution resolution = scopes.resolve(name);
        if (resolution == Resolution.LOCAL) {
            return;
        }
        moduleStateWritten = true;
        if (resolution != Resolution.HOST) {
            facts.globalWritten(name);
        }
    }

    private void read(final String name) {
        // #field in obj
        if (EcmaScriptPreprocessor.isPrivateName(name)) {
            return;
        }
        if (scopes.resolve(name) == Resolution.FREE) {
            facts.globalRead(name);
        }
    }

    private void recordCall(final Node call) {
        final Node callee = call.getFirstChild();
        if (!AstNodes.isPropertyAccess(callee)) {
            return;
        }
        final String method = callee.getString();
        final Node receiver = callee.getFirstChild();
        final String literal = AstNodes.stringLiteral(
                AstNodes.firstArgument(call));

        final String receiverChain = AstNodes.memberChain(receiver);
        if (receiverChain != null) {
            final String storage = EcmaScriptApiTables.withoutWindow(
                    receiverChain);
            if (EcmaScriptApiTables.STORAGE_OBJECTS.contains(storage)) {
                facts.storageOp(storage + "." + method);
            }
        }

        switch (method) {
            case "createElement":
                if (literal != null) {
                    facts.domCreated("<" + literal + ">");
                }
                break;
            case "getElementById":
                if (literal != null) {
                    facts.domQueried("#" + literal);
                }
                break;
            case "getElementsByClassName":
                if (literal != null) {
                    facts.domQueried("." + literal);
                }
                break;
            case "querySelector":
            case "querySelectorAll":
                facts.domQueried(literal);
                break;
            case "addEventListener":
                facts.eventListener((literal != null ? literal : DYNAMIC)
                        + "@" + expressionName(receiver));
                break;
            default:
                if (EcmaScriptApiTables.CLASS_LIST_OPERATIONS.contains(method)
                        && AstNodes.isPropertyAccess(receiver)
                        && "classList".equals(receiver.getString())) {
                    facts.domModified(method + ":"
                            + (literal != null ? literal : DYNAMIC));
                }
                break;
        }
    }

    private static String expressionName(final Node node) {
        switch (node.getToken()) {
            case NAME:
                return node.getString();
            case THIS:
                return "this";
            case GETPROP:
            case OPTCHAIN_GETPROP:
                return expressionName(node.getFirstChild()) + "."
                        + node.getString();
            case GETELEM:
            case OPTCHAIN_GETELEM:
                final Node key = node.getSecondChild();
                String keyName = AstNodes.literalKey(key);
                if (keyName == null) {
                    keyName = key.isName() ? key.getString() : EXPRESSION;
                }
                return expressionName(node.getFirstChild()) + ".[" + keyName + "]";
            case CALL:
            case OPTCHAIN_CALL:
                return expressionName(node.getFirstChild());
            default:
                return EXPRESSION;
        }
    }

}
