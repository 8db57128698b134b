package avatar.tools.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import avatar.tools.graph.DependencyGraph;
import avatar.tools.graph.GraphStatistics;
import avatar.tools.model.SourceFile;

/**
 * Writes the graph and its statistics as one indented JSON document.
 */
public final class JsonGraphWriter {

    public static final String SCHEMA_VERSION = "avatar-deps/v1";

    private final ObjectMapper jsonMapper;

    public JsonGraphWriter() {
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(DependencyGraph graph, Path file, String generatedAt) throws IOException {
        Objects.requireNonNull(file, "file");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        jsonMapper.writeValue(file.toFile(), toDocument(graph, generatedAt));
    }

    public String render(DependencyGraph graph, String generatedAt) throws IOException {
        return jsonMapper.writeValueAsString(toDocument(graph, generatedAt));
    }

    GraphDocument toDocument(DependencyGraph graph, String generatedAt) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(generatedAt, "generatedAt");

        final List<NodeEntry> nodes = new ArrayList<>(graph.files().size());
        for (SourceFile f : graph.files().values()) {
            nodes.add(new NodeEntry(f.path(), f.name(), f.kind().name().toLowerCase(Locale.ROOT)));
        }

        final List<EdgeEntry> edges = new ArrayList<>(graph.edgeCount());
        for (var e : graph.forward().entrySet()) {
            for (String target : e.getValue()) {
                edges.add(new EdgeEntry(e.getKey(), target));
            }
        }

        return new GraphDocument(SCHEMA_VERSION, generatedAt, nodes, edges, GraphStatistics.of(graph));
    }

    // --- document records ---

    public record GraphDocument(
            String schema,
            String generatedAt,
            List<NodeEntry> nodes,
            List<EdgeEntry> edges,
            GraphStatistics statistics
    ) {
    }

    public record NodeEntry(
            String path,
            String name,
            String kind   // "header" | "source" | "assembly"
    ) {
    }

    public record EdgeEntry(
            String from,
            String to
    ) {
    }
}
