package avatar.tools.graph;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shared checks for graph shaped results.
 */
final class GraphAssertions {

    private GraphAssertions() {
    }

    static Map<String, Set<String>> transpose(Map<String, Set<String>> forward) {
        final Map<String, Set<String>> out = new HashMap<>();
        for (var e : forward.entrySet()) {
            for (String target : e.getValue()) {
                out.computeIfAbsent(target, k -> new HashSet<>()).add(e.getKey());
            }
        }
        return out;
    }

    static void assertWellFormed(DependencyGraph graph) {
        assertThat(transpose(graph.forward())).isEqualTo(graph.reverse());
        for (var e : graph.forward().entrySet()) {
            assertThat(e.getValue()).doesNotContain(e.getKey());
        }
    }

    static void assertIsCycleOf(List<String> cycle, DependencyGraph graph) {
        assertThat(cycle).hasSizeGreaterThanOrEqualTo(3);
        assertThat(cycle.get(0)).isEqualTo(cycle.get(cycle.size() - 1));
        for (int i = 0; i + 1 < cycle.size(); i++) {
            assertThat(graph.dependenciesOf(cycle.get(i))).contains(cycle.get(i + 1));
        }
    }
}
