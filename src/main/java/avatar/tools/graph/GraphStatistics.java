package avatar.tools.graph;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

import avatar.tools.model.SourceFile;

/**
 * Aggregate numbers for the default report.
 * <p>
 * {@code mostDependencies} / {@code mostDependents} are the first maximal
 * entries in iteration order of the forward / reverse index; null when the
 * graph has no edges.
 */
public record GraphStatistics(
        int sourceFiles,       // .c and .S
        int headerFiles,       // .h
        int edges,
        Extreme mostDependencies,
        Extreme mostDependents,
        int unresolvedIncludes,
        int systemIncludes,
        int readWarnings
) {

    public record Extreme(String path, int count) {
    }

    public static GraphStatistics of(DependencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        int sources = 0;
        int headers = 0;
        for (SourceFile f : graph.files().values()) {
            if (f.isHeader()) {
                headers++;
            } else {
                sources++;
            }
        }
        return new GraphStatistics(
                sources,
                headers,
                graph.edgeCount(),
                max(graph.forward()),
                max(graph.reverse()),
                graph.unresolvedIncludes(),
                graph.systemIncludes(),
                graph.readWarnings()
        );
    }

    private static Extreme max(Map<String, Set<String>> index) {
        Extreme best = null;
        for (var e : index.entrySet()) {
            final int n = e.getValue().size();
            if (best == null || n > best.count()) {
                best = new Extreme(e.getKey(), n);
            }
        }
        return best;
    }
}
