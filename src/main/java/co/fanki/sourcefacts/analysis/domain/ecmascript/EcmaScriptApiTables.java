package co.fanki.sourcefacts.analysis.domain.ecmascript;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fixed API tables used to classify ECMAScript member chains.
 *
 * <p>Chains are matched as written in the source, after
 * {@link #withoutWindow(String)} drops a leading {@code window.}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class EcmaScriptApiTables {

    /** Members of {@code document} that change the page. */
    static final Set<String> DOM_WRITE = Set.of(
            "createElement", "createTextNode", "createDocumentFragment",
            "appendChild", "append", "prepend", "insertBefore",
            "replaceChild", "replaceChildren", "removeChild", "innerHTML",
            "innerText", "textContent", "classList.add", "classList.remove",
            "classList.toggle", "write", "writeln");

    /** Members of {@code document} that only look the page up. */
    static final Set<String> DOM_READ = Set.of(
            "querySelector", "querySelectorAll", "getElementById",
            "getElementsByClassName", "getElementsByTagName", "closest");

    static final Set<String> TIMERS = Set.of(
            "setTimeout", "setInterval", "setImmediate", "clearTimeout",
            "clearInterval", "requestAnimationFrame", "cancelAnimationFrame");

    static final Set<String> RANDOM = Set.of(
            "Math.random", "crypto.getRandomValues", "crypto.randomUUID");

    static final Set<String> CLOCK = Set.of(
            "Date.now", "performance.now", "process.hrtime",
            "process.hrtime.bigint");

    static final Set<String> WINDOW_DIALOGS = Set.of(
            "alert", "confirm", "prompt", "open", "close");

    static final Set<String> CONSOLE_LEVELS = Set.of(
            "log", "info", "warn", "error", "debug", "trace");

    static final Set<String> STORAGE_OBJECTS = Set.of(
            "localStorage", "sessionStorage");

    static final Set<String> STORAGE_READS = Set.of("getItem", "get");

    static final Set<String> STORAGE_WRITES = Set.of(
            "setItem", "set", "removeItem");

    static final Set<String> GLOBAL_OBJECTS = Set.of(
            "window", "global", "globalThis");

    static final Set<String> CLASS_LIST_OPERATIONS = Set.of(
            "add", "remove", "toggle", "replace");

    static final Pattern FS_READ = Pattern.compile(
            "^(?:fs(?:\\.promises)?\\.(?:read|createReadStream)|fsExtra\\.read)",
            Pattern.CASE_INSENSITIVE);

    static final Pattern FS_WRITE = Pattern.compile(
            "^(?:fs(?:\\.promises)?\\.(?:write|append|createWriteStream)"
                    + "|fsExtra\\.write)",
            Pattern.CASE_INSENSITIVE);

    private EcmaScriptApiTables() {
    }

    /**
     * Drops a leading {@code window.} so both spellings match.
     *
     * @param chain the member chain
     * @return the chain without the window prefix
     */
    static String withoutWindow(final String chain) {
        if (chain.startsWith("window.")) {
            return chain.substring("window.".length());
        }
        return chain;
    }

    /**
     * Returns the member of {@code document} a chain reaches, if any.
     *
     * @param chain the member chain
     * @return the part after {@code document.}, or null
     */
    static String documentMember(final String chain) {
        final String normalized = withoutWindow(chain);
        if (normalized.startsWith("document.")) {
            return normalized.substring("document.".length());
        }
        return null;
    }

    static boolean isFsRead(final String chain) {
        return chain.endsWith(".readFile") || chain.endsWith(".readFileSync")
                || chain.endsWith(".createReadStream");
    }

    static boolean isFsWrite(final String chain) {
        return chain.endsWith(".writeFile") || chain.endsWith(".writeFileSync")
                || chain.endsWith(".appendFile")
                || chain.endsWith(".appendFileSync")
                || chain.endsWith(".createWriteStream");
    }

    static boolean isFetchLike(final String chain) {
        final String normalized = withoutWindow(chain);
        return normalized.equals("fetch") || normalized.equals("axios")
                || normalized.startsWith("axios.");
    }

    static boolean isNetwork(final String chain) {
        final String normalized = withoutWindow(chain);
        return isFetchLike(normalized)
                || normalized.startsWith("http.")
                || normalized.startsWith("https.")
                || normalized.startsWith("XMLHttpRequest")
                || normalized.startsWith("navigator.sendBeacon");
    }

    /**
     * Returns the storage object a chain starts with, if any.
     *
     * @param chain the member chain
     * @return {@code localStorage} or {@code sessionStorage}, or null
     */
    static String storageObject(final String chain) {
        final String normalized = withoutWindow(chain);
        final int dot = normalized.indexOf('.');
        final String head = dot < 0 ? normalized : normalized.substring(0, dot);
        return STORAGE_OBJECTS.contains(head) ? head : null;
    }

    static boolean isProcessEnv(final String chain) {
        return chain.equals("process.env") || chain.startsWith("process.env.");
    }

}
