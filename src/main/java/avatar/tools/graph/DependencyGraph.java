package avatar.tools.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import avatar.tools.model.SourceFile;

/**
 * Include graph of one analyzer run.
 * <ul>
 *   <li>forward: file path -> paths it includes directly</li>
 *   <li>reverse: file path -> paths that include it</li>
 * </ul>
 * Both maps are updated together by {@link #addEdge}, so reverse is the exact
 * transpose of forward after every insertion. Self edges are never stored.
 * Iteration order of keys and sets is insertion order.
 */
public final class DependencyGraph {

    private final Map<String, SourceFile> files;
    private final Map<String, Set<String>> forward = new LinkedHashMap<>();
    private final Map<String, Set<String>> reverse = new LinkedHashMap<>();

    private int unresolvedIncludes;
    private int systemIncludes;
    private int readWarnings;

    /**
     * @param files discovered files by path, in discovery order
     */
    public DependencyGraph(Map<String, SourceFile> files) {
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(files, "files")));
    }

    /**
     * Adds {@code from -> to}. Returns false for self edges and for edges that
     * already exist.
     */
    public boolean addEdge(String from, String to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.equals(to)) {
            return false;
        }
        final boolean added = forward.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        if (added) {
            reverse.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
        }
        return added;
    }

    /** Discovered files by path. */
    public Map<String, SourceFile> files() {
        return files;
    }

    public Map<String, Set<String>> forward() {
        return readOnly(forward);
    }

    public Map<String, Set<String>> reverse() {
        return readOnly(reverse);
    }

    public Set<String> dependenciesOf(String path) {
        final Set<String> deps = forward.get(path);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    public Set<String> dependentsOf(String path) {
        final Set<String> deps = reverse.get(path);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    public int edgeCount() {
        int n = 0;
        for (Set<String> deps : forward.values()) {
            n += deps.size();
        }
        return n;
    }

    public int unresolvedIncludes() {
        return unresolvedIncludes;
    }

    public int systemIncludes() {
        return systemIncludes;
    }

    public int readWarnings() {
        return readWarnings;
    }

    void recordUnresolved() {
        unresolvedIncludes++;
    }

    void recordSystem() {
        systemIncludes++;
    }

    void recordReadWarnings(int count) {
        readWarnings += count;
    }

    private static Map<String, Set<String>> readOnly(Map<String, Set<String>> m) {
        final Map<String, Set<String>> out = new LinkedHashMap<>();
        for (var e : m.entrySet()) {
            out.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }
}
