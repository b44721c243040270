package work.envctl.params;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.envctl.template.ParameterConfigurationException;

/**
 * Prompt ordering for parameters whose metadata references other parameters. Edges only exist between
 * queued parameters; references to values already resolved are satisfied.
 */
final class ParameterDependencies {
    private ParameterDependencies() {}

    /**
     * Orders {@code queued} (given in declaration order) so referenced parameters come first. Ties keep
     * declaration order.
     *
     * @param references referenced names per queued parameter
     * @param declared every parameter the template declares
     * @throws ParameterConfigurationException on unknown references or dependency cycles
     */
    static List<String> order(List<String> queued, Map<String, List<String>> references, Set<String> declared) {
        Set<String> pending = new LinkedHashSet<>(queued);
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (String name : queued) {
            List<String> dependsOn = new ArrayList<>();
            for (String reference : references.getOrDefault(name, List.of())) {
                if (!declared.contains(reference)) {
                    throw new ParameterConfigurationException(
                        "Parameter '" + name + "' references unknown parameter '" + reference + "'");
                }
                if (pending.contains(reference) && !dependsOn.contains(reference)) {
                    dependsOn.add(reference);
                }
            }
            edges.put(name, dependsOn);
        }
        detectCycle(queued, edges);

        List<String> ordered = new ArrayList<>(queued.size());
        Set<String> placed = new LinkedHashSet<>();
        while (ordered.size() < queued.size()) {
            for (String name : queued) {
                if (!placed.contains(name) && placed.containsAll(edges.get(name))) {
                    ordered.add(name);
                    placed.add(name);
                    break;
                }
            }
        }
        return ordered;
    }

    private static void detectCycle(List<String> queued, Map<String, List<String>> edges) {
        Map<String, Integer> state = new HashMap<>();
        for (String name : queued) {
            List<String> path = new ArrayList<>();
            visit(name, edges, state, path);
        }
    }

    // 1 = on the current path, 2 = fully explored
    private static void visit(String name, Map<String, List<String>> edges, Map<String, Integer> state, List<String> path) {
        Integer current = state.get(name);
        if (current != null && current == 2) {
            return;
        }
        if (current != null && current == 1) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
            cycle.add(name);
            throw new ParameterConfigurationException("Parameter dependency cycle detected: " + String.join(" -> ", cycle));
        }
        state.put(name, 1);
        path.add(name);
        for (String dependency : edges.getOrDefault(name, List.of())) {
            visit(dependency, edges, state, path);
        }
        path.remove(path.size() - 1);
        state.put(name, 2);
    }
}
