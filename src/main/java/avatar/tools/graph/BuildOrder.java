package avatar.tools.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Kahn's algorithm over the include graph.
 * <p>
 * Nodes are every path that takes part in an edge, in first-seen order; ties
 * between nodes that become ready together are broken first-in-first-out.
 * When the graph has a cycle, nodes on the cycle (and everything only
 * reachable through it) never become ready and are left out of the result.
 */
public final class BuildOrder {

    public enum Direction {
        /**
         * In-degree counts edges into an included file: files nobody includes
         * come first, leaf headers last.
         */
        INCLUDERS_FIRST,
        /**
         * Same algorithm over the reverse index: included files come before
         * the files that include them.
         */
        DEPENDENCIES_FIRST
    }

    private final DependencyGraph graph;

    public BuildOrder(DependencyGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public List<String> compute(Direction direction) {
        Objects.requireNonNull(direction, "direction");
        final Map<String, Set<String>> adjacency = direction == Direction.INCLUDERS_FIRST
                ? graph.forward()
                : graph.reverse();
        return kahn(adjacency);
    }

    static List<String> kahn(Map<String, Set<String>> adjacency) {
        // 1. in-degrees; keys first, then targets as they appear
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (var e : adjacency.entrySet()) {
            inDegree.putIfAbsent(e.getKey(), 0);
            for (String target : e.getValue()) {
                inDegree.merge(target, 1, Integer::sum);
            }
        }

        // 2. seed with zero in-degree
        final Deque<String> queue = new ArrayDeque<>();
        for (var e : inDegree.entrySet()) {
            if (e.getValue() == 0) {
                queue.add(e.getKey());
            }
        }

        // 3. drain
        final List<String> order = new ArrayList<>(inDegree.size());
        while (!queue.isEmpty()) {
            final String node = queue.poll();
            order.add(node);
            for (String target : adjacency.getOrDefault(node, Set.of())) {
                final int remaining = inDegree.merge(target, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(target);
                }
            }
        }
        return order;
    }
}
