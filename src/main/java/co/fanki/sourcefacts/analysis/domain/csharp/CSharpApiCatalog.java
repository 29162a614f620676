package co.fanki.sourcefacts.analysis.domain.csharp;

import co.fanki.sourcefacts.shared.Preconditions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Table-driven detection of the C# APIs that read or write the outside
 * world.
 *
 * <p>Fixed API names ({@code File.ReadAllText}, {@code Console.WriteLine},
 * ...) are matched as {@code Name(}. Configuration and logger APIs come in
 * many spellings, so they are matched by regular expressions that each
 * contribute one canonical label. HttpClient verbs only count when the unit
 * mentions {@code HttpClient} or {@code IHttpClientFactory}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CSharpApiCatalog {

    /** Keywords that look like calls but are not. */
    public static final Set<String> SKIP_CALL_NAMES = Set.of(
            "if", "else", "for", "foreach", "while", "switch", "case",
            "default", "do", "try", "catch", "finally", "using", "lock",
            "checked", "unchecked", "fixed", "typeof", "nameof", "sizeof",
            "new");

    static final List<String> FILE_READS = List.of(
            "File.ReadAllText", "File.ReadAllLines", "File.ReadAllBytes",
            "File.OpenRead", "File.OpenText", "File.Exists",
            "FileInfo.OpenRead", "FileStream.Read", "Directory.GetFiles",
            "Directory.GetDirectories", "Directory.EnumerateFiles",
            "Directory.EnumerateDirectories", "Directory.Exists");

    static final List<String> FILE_WRITES = List.of(
            "File.WriteAllText", "File.WriteAllLines", "File.WriteAllBytes",
            "File.AppendAllText", "File.AppendAllLines", "File.AppendText",
            "File.OpenWrite", "File.Create", "File.CreateText", "File.Copy",
            "File.Move", "File.Delete", "FileStream.Write",
            "Directory.CreateDirectory", "Directory.Delete", "Directory.Move");

    static final List<String> CONSOLE_INPUTS = List.of(
            "Console.ReadLine", "Console.ReadKey", "Console.Read");

    static final List<String> LOGS = List.of(
            "Console.WriteLine", "Console.Write", "Console.Error.WriteLine",
            "Console.Error.Write", "Debug.WriteLine", "Debug.Write",
            "Trace.WriteLine", "Trace.Write");

    static final List<String> WEB_CLIENT_READS = List.of(
            "WebClient.DownloadString", "WebClient.DownloadData",
            "WebClient.OpenRead");

    static final List<String> WEB_CLIENT_WRITES = List.of(
            "WebClient.UploadString", "WebClient.UploadData",
            "WebClient.UploadValues");

    static final List<String> HTTP_WEB_REQUEST_READS = List.of(
            "HttpWebRequest.Create", "HttpWebRequest.GetResponse");

    private static final String LOGGER_LABEL = "ILogger.Log";

    private static final List<Pattern> LOGGER_PATTERNS = List.of(
            Pattern.compile("\\bILogger\\w*\\s*\\.\\s*Log"
                    + "(?:Trace|Debug|Information|Warning|Error|Critical)?\\s*\\("),
            Pattern.compile("\\blogger\\s*\\.\\s*Log"
                    + "(?:Trace|Debug|Information|Warning|Error|Critical)\\s*\\(",
                    Pattern.CASE_INSENSITIVE));

    private static final Map<Pattern, String> CONFIG_PATTERNS = configPatterns();

    private static final Pattern STATIC_FIELD = Pattern.compile(
            "\\bstatic\\s+(?:readonly\\s+)?[A-Za-z_][A-Za-z0-9_<>,\\[\\]\\s?]*"
                    + "\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*(?:=|;)");

    private static final Pattern EVENT_SUBSCRIPTION = Pattern.compile(
            "([A-Za-z_][A-Za-z0-9_]*\\.[A-Za-z_][A-Za-z0-9_]*)\\s*\\+=");

    private static final Pattern HTTP_CLIENT_PRESENT = Pattern.compile(
            "\\b(?:HttpClient|IHttpClientFactory)\\b");

    private static final Pattern HTTP_CLIENT_READ = Pattern.compile(
            "\\.\\s*(?:GetAsync|GetStringAsync)\\s*\\(");

    private static final Pattern HTTP_CLIENT_WRITE = Pattern.compile(
            "\\.\\s*(PostAsync|PutAsync|DeleteAsync|SendAsync)\\s*\\(");

    private static final Pattern WEB_REQUEST_PRESENT = Pattern.compile(
            "\\bWebRequest\\b|\\bHttpWebRequest\\b");

    private static final Map<String, Pattern> CALL_PATTERNS = callPatterns();

    private final HeuristicLimits limits;

    /**
     * Creates a new catalog.
     *
     * @param theLimits the caps for the open-ended scans
     */
    public CSharpApiCatalog(final HeuristicLimits theLimits) {
        this.limits = Preconditions.requireNonNull(theLimits,
                "Limits cannot be null");
    }

    /**
     * Detects every known API the unit touches.
     *
     * @param code the source without comments and string contents
     * @return what was found
     */
    public CSharpApiUsage scan(final String code) {
        final Set<String> networkReads = new TreeSet<>(
                calledApis(code, WEB_CLIENT_READS));
        networkReads.addAll(calledApis(code, HTTP_WEB_REQUEST_READS));
        final Set<String> networkWrites = new TreeSet<>(
                calledApis(code, WEB_CLIENT_WRITES));

        if (HTTP_CLIENT_PRESENT.matcher(code).find()) {
            if (HTTP_CLIENT_READ.matcher(code).find()) {
                networkReads.add("HttpClient.GetAsync");
            }
            for (final String verb : firstGroups(code, HTTP_CLIENT_WRITE)) {
                networkWrites.add("HttpClient." + verb);
            }
        }
        if (WEB_REQUEST_PRESENT.matcher(code).find()) {
            networkReads.add("HttpWebRequest.Create");
        }

        final Set<String> logs = new TreeSet<>(calledApis(code, LOGS));
        for (final Pattern logger : LOGGER_PATTERNS) {
            if (logger.matcher(code).find()) {
                logs.add(LOGGER_LABEL);
            }
        }

        final Set<String> configs = new TreeSet<>();
        CONFIG_PATTERNS.forEach((pattern, label) -> {
            if (pattern.matcher(code).find()) {
                configs.add(label);
            }
        });

        return new CSharpApiUsage(
                calledApis(code, FILE_READS),
                calledApis(code, FILE_WRITES),
                calledApis(code, CONSOLE_INPUTS),
                logs,
                networkReads,
                networkWrites,
                configs,
                lastSegments(code, EVENT_SUBSCRIPTION),
                firstGroups(code, STATIC_FIELD));
    }

    private static Set<String> calledApis(final String code,
            final List<String> apis) {
        final Set<String> found = new TreeSet<>();
        for (final String api : apis) {
            if (CALL_PATTERNS.get(api).matcher(code).find()) {
                found.add(api);
            }
        }
        return found;
    }

    private Set<String> firstGroups(final String code, final Pattern pattern) {
        final Set<String> found = new TreeSet<>();
        final Matcher matcher = pattern.matcher(code);
        int matches = 0;
        while (matches++ < limits.maxScanMatches() && matcher.find()) {
            found.add(matcher.group(1));
        }
        return found;
    }

    private Set<String> lastSegments(final String code, final Pattern pattern) {
        final Set<String> found = new TreeSet<>();
        for (final String chain : firstGroups(code, pattern)) {
            found.add(chain.substring(chain.lastIndexOf('.') + 1));
        }
        return found;
    }

    private static Map<Pattern, String> configPatterns() {
        final Map<Pattern, String> patterns = new LinkedHashMap<>();
        patterns.put(Pattern.compile(
                "\\bEnvironment\\.GetEnvironmentVariable\\s*\\("),
                "Environment.GetEnvironmentVariable");
        patterns.put(Pattern.compile(
                "\\bConfigurationManager\\.[A-Za-z_][A-Za-z0-9_]*"),
                "ConfigurationManager");
        patterns.put(Pattern.compile("\\bIConfiguration\\s*\\["),
                "IConfiguration[indexer]");
        patterns.put(Pattern.compile("\\bIOptions(?:Monitor|Snapshot)?"
                + "<[A-Za-z_][A-Za-z0-9_<>,\\s]*>\\s*\\."), "IOptions");
        return patterns;
    }

    private static Map<String, Pattern> callPatterns() {
        final Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (final List<String> table : List.of(FILE_READS, FILE_WRITES,
                CONSOLE_INPUTS, LOGS, WEB_CLIENT_READS, WEB_CLIENT_WRITES,
                HTTP_WEB_REQUEST_READS)) {
            for (final String api : table) {
                patterns.put(api, Pattern.compile(
                        "\\b" + Pattern.quote(api) + "\\s*\\("));
            }
        }
        return patterns;
    }

}
