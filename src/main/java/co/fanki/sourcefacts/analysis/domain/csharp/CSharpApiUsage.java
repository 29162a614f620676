package co.fanki.sourcefacts.analysis.domain.csharp;

import co.fanki.sourcefacts.analysis.domain.DataFlowFacts;
import co.fanki.sourcefacts.analysis.domain.FactCategory;
import co.fanki.sourcefacts.analysis.domain.IoFacts;
import co.fanki.sourcefacts.analysis.domain.SideEffectTags;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * The APIs a C# unit was found to touch, and the facts derived from them.
 *
 * @param fileReads file and directory read APIs
 * @param fileWrites file and directory write APIs
 * @param consoleInputs console read APIs
 * @param logs logging APIs, fixed names and the canonical logger label
 * @param networkReads network read APIs
 * @param networkWrites network write APIs
 * @param configs canonical configuration labels
 * @param events subscribed event names
 * @param staticFields static field names
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CSharpApiUsage(
        Set<String> fileReads,
        Set<String> fileWrites,
        Set<String> consoleInputs,
        Set<String> logs,
        Set<String> networkReads,
        Set<String> networkWrites,
        Set<String> configs,
        Set<String> events,
        Set<String> staticFields) {

    private static final String READ = "read";
    private static final String WRITE = "write";

    /** Copies every set. */
    public CSharpApiUsage {
        fileReads = Set.copyOf(fileReads);
        fileWrites = Set.copyOf(fileWrites);
        consoleInputs = Set.copyOf(consoleInputs);
        logs = Set.copyOf(logs);
        networkReads = Set.copyOf(networkReads);
        networkWrites = Set.copyOf(networkWrites);
        configs = Set.copyOf(configs);
        events = Set.copyOf(events);
        staticFields = Set.copyOf(staticFields);
    }

    /**
     * Builds the data-flow facts.
     *
     * @param usings the imported namespaces, reported as shared state
     * @return the facts
     */
    public DataFlowFacts dataFlow(final Collection<String> usings) {
        final DataFlowFacts.Builder builder = DataFlowFacts.builder();
        staticFields.forEach(builder::globalWritten);
        events.forEach(e -> builder.add(FactCategory.EVENTS, "subscribe", e));
        consoleInputs.forEach(i -> builder.add(FactCategory.INPUT, "console", i));
        fileReads.forEach(f -> builder.add(FactCategory.STORAGE, READ, f));
        fileWrites.forEach(f -> builder.add(FactCategory.STORAGE, WRITE, f));
        networkReads.forEach(n -> builder.add(FactCategory.NETWORK, READ, n));
        networkWrites.forEach(n -> builder.add(FactCategory.NETWORK, WRITE, n));
        logs.forEach(l -> builder.add(FactCategory.LOGS, "emit", l));
        configs.forEach(c -> builder.add(FactCategory.CONFIG, READ, c));
        usings.forEach(u -> builder.sharedState("using:" + u));
        return builder.build();
    }

    /**
     * Builds the I/O facts.
     *
     * @return file reads, console input, network reads, configuration and
     *         events as inputs; file writes, logs and network writes as
     *         outputs
     */
    public IoFacts io() {
        final Set<String> inputs = new TreeSet<>();
        final Set<String> outputs = new TreeSet<>();
        fileReads.forEach(f -> inputs.add("FILE:" + f + "()"));
        fileWrites.forEach(f -> outputs.add("FILE:" + f + "()"));
        consoleInputs.forEach(c -> inputs.add("USER:" + c));
        logs.forEach(l -> outputs.add("LOG:" + l));
        networkReads.forEach(n -> inputs.add("NETWORK:" + n));
        networkWrites.forEach(n -> outputs.add("NETWORK:" + n));
        configs.forEach(c -> inputs.add("CONFIG:" + c));
        events.forEach(e -> inputs.add("USER:" + e));
        return IoFacts.of(inputs, outputs);
    }

    /**
     * Builds the side-effect tags; an empty set renders as PURE.
     *
     * @return the tags
     */
    public SideEffectTags sideEffects() {
        final Set<String> tags = new TreeSet<>();
        if (!fileReads.isEmpty()) {
            tags.add("FILE:read");
        }
        if (!fileWrites.isEmpty()) {
            tags.add("FILE:write");
        }
        if (!networkReads.isEmpty() || !networkWrites.isEmpty()) {
            tags.add("NETWORK");
        }
        if (!logs.isEmpty()) {
            tags.add("LOG");
        }
        if (!configs.isEmpty()) {
            tags.add("CONFIG");
        }
        if (!events.isEmpty()) {
            tags.add("EVENT:user");
        }
        if (!staticFields.isEmpty()) {
            tags.add("STATE:global");
        }
        return SideEffectTags.of(tags);
    }

}
