package avatar.tools.graph;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import avatar.tools.config.AnalyzerConfig;
import avatar.tools.model.SourceFile;
import avatar.tools.scan.FileDiscovery;
import avatar.tools.scan.IncludeExtractor;

/**
 * Builds the include graph from a full scan of the project tree.
 * No caching: every call walks the filesystem again.
 */
public final class GraphBuilder {

    private final Path projectRoot;
    private final AnalyzerConfig config;
    private final PrintStream warnings;

    private FileDiscovery.Discovery lastDiscovery;

    public GraphBuilder(Path projectRoot, AnalyzerConfig config) {
        this(projectRoot, config, System.err);
    }

    /**
     * @param warnings stream for {@code WARN:} lines about unreadable files and directories
     */
    public GraphBuilder(Path projectRoot, AnalyzerConfig config, PrintStream warnings) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        this.config = Objects.requireNonNull(config, "config");
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    public DependencyGraph build() throws IOException {
        // Step 1: discover files (name -> file)
        final FileDiscovery.Discovery discovery = new FileDiscovery(projectRoot, config, warnings).discover();
        lastDiscovery = discovery;
        if (discovery.isEmpty()) {
            throw new EmptyDiscoveryException("no .c/.h/.S files found under " + config.sourceRoots()
                    + " in " + projectRoot);
        }
        return build(discovery);
    }

    DependencyGraph build(FileDiscovery.Discovery discovery) {
        final Map<String, SourceFile> byPath = new LinkedHashMap<>();
        for (SourceFile f : discovery.files().values()) {
            byPath.put(f.path(), f);
        }
        final DependencyGraph graph = new DependencyGraph(byPath);

        final IncludeResolver resolver = new IncludeResolver(
                projectRoot, discovery.files(), config.includeDirs(), config.systemPrefixes());
        final IncludeExtractor extractor = new IncludeExtractor(warnings);

        // Step 2: every discovered file, headers included, contributes its includes
        for (SourceFile file : byPath.values()) {
            final Set<String> targets = extractor.extract(projectRoot.resolve(file.path()));
            for (String target : targets) {
                final Resolution r = resolver.resolve(target);
                switch (r.kind()) {
                    case RESOLVED -> graph.addEdge(file.path(), r.path());
                    case SYSTEM -> graph.recordSystem();
                    case UNRESOLVED -> graph.recordUnresolved();
                }
            }
        }

        graph.recordReadWarnings(extractor.readWarningCount());
        return graph;
    }

    /** Discovery of the last {@link #build()} call, or null before the first one. */
    public FileDiscovery.Discovery lastDiscovery() {
        return lastDiscovery;
    }
}
