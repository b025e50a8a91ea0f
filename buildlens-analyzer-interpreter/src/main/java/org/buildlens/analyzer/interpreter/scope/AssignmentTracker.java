package org.buildlens.analyzer.interpreter.scope;

import org.buildlens.analyzer.ast.FlowVertex;
import org.buildlens.analyzer.common.AnalysisBugException;
import org.buildlens.analyzer.interpreter.graph.DataflowGraph;
import org.buildlens.analyzer.interpreter.value.UnknownValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * For every variable, the ordered list of its definitions, each tagged with the nesting path at which it
 * was recorded. Lookups pick the most recent definition visible from the current path.
 */
public class AssignmentTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(AssignmentTracker.class);

    /*
    provided by the build system at runtime; never resolvable statically
     */
    public static final Set<String> MACHINE_VARIABLES = Set.of("meson", "host_machine", "build_machine",
            "target_machine");

    public record Definition(NestingPath path, FlowVertex value) {
    }

    private final Map<String, List<Definition>> definitions = new LinkedHashMap<>();
    private boolean tainted;

    public void record(String variable, NestingPath path, FlowVertex value) {
        Objects.requireNonNull(value);
        LOGGER.debug("Record {} = {} at {}", variable, value, path);
        definitions.computeIfAbsent(variable, v -> new ArrayList<>()).add(new Definition(path, value));
    }

    /*
    set when a variable was assigned through a name that cannot be computed: from then on, an undefined
    variable may simply be one of those.
     */
    public void taint() {
        tainted = true;
    }

    public boolean isTainted() {
        return tainted;
    }

    public FlowVertex lookup(String variable, NestingPath path) {
        return lookup(variable, path, false);
    }

    /**
     * @param allowMissing return <code>null</code> rather than failing when there is no visible definition
     * @return the most recent definition whose path is a prefix of <code>path</code>
     */
    public FlowVertex lookup(String variable, NestingPath path, boolean allowMissing) {
        if (MACHINE_VARIABLES.contains(variable)) {
            return new UnknownValue();
        }
        List<Definition> list = definitions.get(variable);
        if (list != null) {
            ListIterator<Definition> it = list.listIterator(list.size());
            while (it.hasPrevious()) {
                Definition d = it.previous();
                if (d.path.isPrefixOf(path)) return d.value;
            }
        }
        if (allowMissing) return null;
        if (tainted) return new UnknownValue();
        throw new AnalysisBugException("No definition of '" + variable + "' visible at " + path);
    }

    public List<Definition> definitions(String variable) {
        return Collections.unmodifiableList(definitions.getOrDefault(variable, List.of()));
    }

    public Set<String> variableNames() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    /**
     * Called when all arms of a conditional have been evaluated, with <code>enclosing</code> the path of the
     * conditional itself. Definitions made inside the arms are removed; wherever more than one value can reach
     * the join, a fresh unknown value is recorded at the enclosing path, with an edge from every candidate.
     *
     * @return the merge vertices created, per variable
     */
    public Map<String, UnknownValue> mergeBranches(NestingPath enclosing, DataflowGraph graph) {
        Map<String, UnknownValue> merges = new LinkedHashMap<>();
        for (Map.Entry<String, List<Definition>> entry : definitions.entrySet()) {
            String variable = entry.getKey();
            List<Definition> list = entry.getValue();
            FlowVertex old = lookup(variable, enclosing, true);
            List<FlowVertex> candidates = new ArrayList<>();
            if (old != null) candidates.add(old);
            for (Definition d : list) {
                if (d.path.depth() > enclosing.depth()) candidates.add(d.value);
            }
            list.removeIf(d -> d.path.depth() > enclosing.depth());
            if (candidates.size() > 1 || !candidates.isEmpty() && old == null) {
                UnknownValue merge = new UnknownValue();
                candidates.forEach(c -> graph.addEdge(c, merge));
                list.add(new Definition(enclosing, merge));
                merges.put(variable, merge);
            }
        }
        if (!merges.isEmpty()) {
            LOGGER.debug("Merged at {}: {}", enclosing, merges.keySet());
        }
        return merges;
    }

    /*
    used around loop bodies: after an unknown number of iterations, nothing is known about these variables
     */
    public void seedUnknown(Collection<String> variables, NestingPath path) {
        for (String variable : variables) {
            record(variable, path, new UnknownValue());
        }
    }
}
