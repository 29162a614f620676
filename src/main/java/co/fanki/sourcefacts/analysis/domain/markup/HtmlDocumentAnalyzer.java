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

import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Reference extraction for HTML documents.
 *
 * <p>The document is parsed with jsoup, which never rejects its input.
 * Element ids, classes, script sources, stylesheet links and inline event
 * handlers become data flow; form controls become user inputs and rendering
 * surfaces become UI outputs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class HtmlDocumentAnalyzer extends SourceAnalyzer {

    private static final Pattern INLINE_HANDLER = Pattern.compile(
            "\\bon(?:load|error|submit|click|change|keydown|keyup)\\s*=",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SCRIPT_TAG = Pattern.compile(
            "<script\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** {@inheritDoc} */
    @Override
    public Set<Language> languages() {
        return Set.of(Language.HTML);
    }

    /** {@inheritDoc} */
    @Override
    protected AnalysisResult extract(final SourceUnit unit,
            final AnalysisRunContext context) {
        final String html = unit.rawText();
        final Document document = Jsoup.parse(html);

        return new AnalysisResult(List.of(), List.of(),
                dependencies(document), dataFlow(document), io(document),
                sideEffects(html));
    }

    private static List<String> dependencies(final Document document) {
        final Set<String> dependencies = new TreeSet<>();
        addAttributes(document, "script[src]", "src", dependencies);
        addAttributes(document, "link[href]", "href", dependencies);
        addAttributes(document, "img[src]", "src", dependencies);
        addAttributes(document, "[data-module]", "data-module", dependencies);
        addAttributes(document, "[data-import]", "data-import", dependencies);
        return List.copyOf(dependencies);
    }

    private static DataFlowFacts dataFlow(final Document document) {
        final DataFlowFacts.Builder flow = DataFlowFacts.builder();
        for (final Element element : document.getAllElements()) {
            final String id = element.id();
            if (!id.isEmpty()) {
                flow.add(FactCategory.HTML, "ids", id);
            }
            final String classes = element.attr("class").trim();
            if (!classes.isEmpty()) {
                for (final String name : WHITESPACE.split(classes)) {
                    flow.add(FactCategory.HTML, "classes", name);
                }
            }
            for (final Attribute attribute : element.attributes()) {
                final String key = attribute.getKey().toLowerCase(Locale.ROOT);
                if (key.length() > 2 && key.startsWith("on")) {
                    flow.add(FactCategory.HTML, "events", key.substring(2));
                }
            }
        }
        for (final Element script : document.select("script[src]")) {
            flow.add(FactCategory.HTML, "scripts", script.attr("src"));
        }
        for (final Element link : document.select("link[href]")) {
            flow.add(FactCategory.HTML, "assets", link.attr("href"));
        }
        return flow.build();
    }

    private static IoFacts io(final Document document) {
        final Set<String> inputs = new TreeSet<>();
        final Set<String> outputs = new TreeSet<>();

        for (final Element form : document.select("form")) {
            inputs.add("USER:form#" + firstPresent(form, "id", "name", "form"));
        }
        for (final Element input : document.select("input")) {
            final String type = input.attr("type").isEmpty()
                    ? "text" : input.attr("type").toLowerCase(Locale.ROOT);
            inputs.add("USER:input[type=" + type + "]");
        }
        for (final Element button : document.select("button")) {
            inputs.add("USER:button(" + firstPresent(button, "id", "class",
                    "button") + ")");
        }
        for (final Element select : document.select("select")) {
            inputs.add("USER:select(" + firstPresent(select, "id", "name",
                    "select") + ")");
        }
        for (final Element element : document.getAllElements()) {
            final String tag = element.normalName();
            if ("canvas".equals(tag) || "svg".equals(tag) || "video".equals(tag)
                    || tag.startsWith("sp-")) {
                outputs.add("UI:" + tag);
            }
        }
        return IoFacts.of(inputs, outputs);
    }

    private static SideEffectTags sideEffects(final String html) {
        final Set<String> tags = new TreeSet<>();
        if (INLINE_HANDLER.matcher(html).find()) {
            tags.add("DOM:event-handlers");
        }
        if (SCRIPT_TAG.matcher(html).find()) {
            tags.add("DOM:script");
        }
        return tags.isEmpty() ? SideEffectTags.notAnalyzed()
                : SideEffectTags.of(tags);
    }

    private static void addAttributes(final Document document,
            final String query, final String attribute, final Set<String> into) {
        for (final Element element : document.select(query)) {
            final String value = element.attr(attribute).trim();
            if (!value.isEmpty()) {
                into.add(value);
            }
        }
    }

    private static String firstPresent(final Element element,
            final String first, final String second, final String fallback) {
        if (!element.attr(first).isEmpty()) {
            return element.attr(first);
        }
        if (!element.attr(second).isEmpty()) {
            return element.attr(second);
        }
        return fallback;
    }

}
