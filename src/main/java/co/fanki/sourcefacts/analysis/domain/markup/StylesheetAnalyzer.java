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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reference extraction for stylesheets.
 *
 * <p>Collects {@code @import} targets, {@code url(...)} assets and custom
 * property names, and counts rule blocks. Inline {@code data:} URLs are
 * kept as assets but are not dependencies or inputs. Stylesheets have no
 * side effects to analyze.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StylesheetAnalyzer extends SourceAnalyzer {

    private static final Pattern IMPORT = Pattern.compile(
            "@import\\s+(?:url\\()?['\"]([^'\"]+)['\"]\\)?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern URL = Pattern.compile(
            "url\\(\\s*['\"]?([^)'\"]+)['\"]?\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CUSTOM_PROPERTY = Pattern.compile(
            "--([a-z0-9-_]+)", Pattern.CASE_INSENSITIVE);

    /** {@inheritDoc} */
    @Override
    public Set<Language> languages() {
        return Set.of(Language.CSS);
    }

    /** {@inheritDoc} */
    @Override
    protected AnalysisResult extract(final SourceUnit unit,
            final AnalysisRunContext context) {
        final String code = unit.rawText();

        final Set<String> imports = groups(IMPORT, code);
        final Set<String> assets = groups(URL, code);
        final Set<String> customProperties = groups(CUSTOM_PROPERTY, code);
        final long rules = code.chars().filter(c -> c == '{').count();

        final DataFlowFacts.Builder flow = DataFlowFacts.builder();
        imports.forEach(i -> flow.add(FactCategory.CSS, "imports", i));
        assets.forEach(a -> flow.add(FactCategory.CSS, "assets", a));
        customProperties.forEach(p -> flow.add(FactCategory.CSS, "customProps", p));
        flow.add(FactCategory.CSS, "rules=" + rules);

        final List<String> dependencies = new ArrayList<>(imports);
        final Set<String> inputs = new TreeSet<>();
        imports.forEach(i -> inputs.add("FILE:@import(" + i + ")"));
        for (final String asset : assets) {
            if (!asset.startsWith("data:")) {
                dependencies.add(asset);
                inputs.add("FILE:url(" + asset + ")");
            }
        }

        return new AnalysisResult(List.of(), List.of(), dependencies,
                flow.build(), IoFacts.of(inputs, List.of()),
                SideEffectTags.notAnalyzed());
    }

    private static Set<String> groups(final Pattern pattern, final String code) {
        final Set<String> values = new TreeSet<>();
        final Matcher matcher = pattern.matcher(code);
        while (matcher.find()) {
            values.add(matcher.group(1));
        }
        return values;
    }

}
