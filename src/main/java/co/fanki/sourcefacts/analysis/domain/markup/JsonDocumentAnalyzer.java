package co.fanki.sourcefacts.analysis.domain.markup;

import co.fanki.sourcefacts.analysis.domain.AnalysisResult;
import co.fanki.sourcefacts.analysis.domain.AnalysisRunContext;
import co.fanki.sourcefacts.analysis.domain.DataFlowFacts;
import co.fanki.sourcefacts.analysis.domain.FactCategory;
import co.fanki.sourcefacts.analysis.domain.IoFacts;
import co.fanki.sourcefacts.analysis.domain.Language;
import co.fanki.sourcefacts.analysis.domain.SideEffectTags;
import co.fanki.sourcefacts.analysis.domain.SourceAnalyzer;
import co.fanki.sourcefacts.analysis.domain.SourceUnit;
import co.fanki.sourcefacts.shared.AnalysisException;
import co.fanki.sourcefacts.shared.AnalysisException.FailureKind;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Reference extraction for JSON documents.
 *
 * <p>Strings that look like paths or module files become dependencies; the
 * document shape (root type, first keys, references) becomes data flow and
 * the keys of the first levels become configuration inputs. A document that
 * does not parse is a parse failure.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JsonDocumentAnalyzer extends SourceAnalyzer {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final int MAX_REFERENCE_DEPTH = 5;

    private static final int MAX_KEY_DEPTH = 2;

    private static final int SHOWN_KEYS = 6;

    private static final Pattern RELATIVE_PATH = Pattern.compile(
            "^(?:\\./|\\.\\./|/)");

    private static final Pattern DEPENDENCY_FILE = Pattern.compile(
            "\\.(?:js|jsx|mjs|cjs|json|css|html)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern REFERENCE_FILE = Pattern.compile(
            "\\.(?:js|jsx|mjs|cjs|json|css)$", Pattern.CASE_INSENSITIVE);

    /** {@inheritDoc} */
    @Override
    public Set<Language> languages() {
        return Set.of(Language.JSON);
    }

    /** {@inheritDoc} */
    @Override
    protected AnalysisResult extract(final SourceUnit unit,
            final AnalysisRunContext context) {
        final JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(unit.rawText());
        } catch (final JsonProcessingException e) {
            throw new AnalysisException("Invalid JSON in " + unit.path() + ": "
                    + e.getOriginalMessage(), FailureKind.PARSE_FAILURE, e);
        }
        if (root == null || root.isMissingNode()) {
            throw new AnalysisException("Empty JSON document " + unit.path(),
                    FailureKind.PARSE_FAILURE);
        }

        final Set<String> dependencies = new TreeSet<>();
        final Set<String> references = new TreeSet<>();
        collectStrings(root, 0, dependencies, references);

        final DataFlowFacts.Builder flow = DataFlowFacts.builder();
        flow.add(FactCategory.JSON, "root=" + rootType(root));
        if (root.isObject()) {
            final Iterator<String> names = root.fieldNames();
            for (int i = 0; i < SHOWN_KEYS && names.hasNext(); i++) {
                flow.add(FactCategory.JSON, "keys", names.next());
            }
        }
        references.forEach(r -> flow.add(FactCategory.JSON, "refs", r));

        final Set<String> inputs = new TreeSet<>();
        collectKeys(root, 0, inputs);

        return new AnalysisResult(List.of(), List.of(),
                new ArrayList<>(dependencies), flow.build(),
                IoFacts.of(inputs, List.of()), SideEffectTags.notAnalyzed());
    }

    private static void collectStrings(final JsonNode node, final int depth,
            final Set<String> dependencies, final Set<String> references) {
        if (depth > MAX_REFERENCE_DEPTH) {
            return;
        }
        if (node.isContainerNode()) {
            for (final JsonNode child : node) {
                collectStrings(child, depth + 1, dependencies, references);
            }
            return;
        }
        if (!node.isTextual()) {
            return;
        }
        final String value = node.asText();
        final boolean relative = RELATIVE_PATH.matcher(value).find();
        if (relative || DEPENDENCY_FILE.matcher(value).find()) {
            dependencies.add(value);
        }
        if (relative || REFERENCE_FILE.matcher(value).find()
                || value.startsWith("#") || value.startsWith("@")) {
            references.add(value);
        }
    }

    private static void collectKeys(final JsonNode node, final int depth,
            final Set<String> inputs) {
        if (depth > MAX_KEY_DEPTH) {
            return;
        }
        if (node.isArray()) {
            inputs.add("CONFIG:Array(length=" + node.size() + ")");
            for (final JsonNode item : node) {
                collectKeys(item, depth + 1, inputs);
            }
        } else if (node.isObject()) {
            final Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                final String name = names.next();
                inputs.add("CONFIG:" + name);
                collectKeys(node.get(name), depth + 1, inputs);
            }
        }
    }

    private static String rootType(final JsonNode root) {
        if (root.isArray()) {
            return "array";
        }
        if (root.isObject() || root.isNull()) {
            return "object";
        }
        if (root.isTextual()) {
            return "string";
        }
        return root.getNodeType().name().toLowerCase(Locale.ROOT);
    }

}
