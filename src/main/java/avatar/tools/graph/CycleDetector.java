package avatar.tools.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Depth-first search for a circular include.
 * <p>
 * Iterative: each stack frame holds a node and the iterator over its
 * remaining neighbours. The current path and the set of nodes on it mirror
 * the frame stack. Reaching a node that is on the path closes a cycle; the
 * first one found is returned and the search stops.
 */
public final class CycleDetector {

    private final DependencyGraph graph;

    public CycleDetector(DependencyGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Returns the first cycle found, as a path whose first and last element
     * are the same node, or empty when the graph is acyclic.
     */
    public Optional<List<String>> findFirst() {
        final Set<String> visited = new HashSet<>();
        final List<String> roots = new ArrayList<>(graph.forward().keySet());

        for (String root : roots) {
            if (visited.contains(root)) continue;
            final List<String> cycle = search(root, visited);
            if (cycle != null) {
                return Optional.of(cycle);
            }
        }
        return Optional.empty();
    }

    private List<String> search(String root, Set<String> visited) {
        final Deque<Frame> stack = new ArrayDeque<>();
        final List<String> path = new ArrayList<>();
        final Set<String> onPath = new HashSet<>();

        enter(root, stack, path, onPath, visited);

        while (!stack.isEmpty()) {
            final Frame top = stack.peek();
            if (!top.neighbours.hasNext()) {
                stack.pop();
                path.remove(path.size() - 1);
                onPath.remove(top.node);
                continue;
            }

            final String next = top.neighbours.next();
            if (onPath.contains(next)) {
                final List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
            if (!visited.contains(next)) {
                enter(next, stack, path, onPath, visited);
            }
        }
        return null;
    }

    private void enter(String node, Deque<Frame> stack, List<String> path, Set<String> onPath, Set<String> visited) {
        visited.add(node);
        onPath.add(node);
        path.add(node);
        stack.push(new Frame(node, graph.dependenciesOf(node).iterator()));
    }

    private static final class Frame {
        final String node;
        final Iterator<String> neighbours;

        private Frame(String node, Iterator<String> neighbours) {
            this.node = node;
            this.neighbours = neighbours;
        }
    }
}
