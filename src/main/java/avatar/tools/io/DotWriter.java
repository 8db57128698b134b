package avatar.tools.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import avatar.tools.graph.DependencyGraph;
import avatar.tools.model.SourceFile;

/**
 * Graphviz DOT export: one node statement per discovered file, one edge
 * statement per include edge.
 */
public final class DotWriter {

    static final String HEADER_COLOR = "lightblue";
    static final String OTHER_COLOR = "lightgreen";

    public void write(DependencyGraph graph, Path file) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(file, "file");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            render(graph, bw);
        }
    }

    public String render(DependencyGraph graph) {
        final StringWriter sw = new StringWriter();
        try {
            render(graph, sw);
        } catch (IOException ex) {
            // StringWriter does not throw
            throw new UncheckedIOException(ex);
        }
        return sw.toString();
    }

    private void render(DependencyGraph graph, Writer out) throws IOException {
        out.write("digraph dependencies {\n");
        out.write("  rankdir=TB;\n");
        out.write("  node [shape=box];\n");

        for (SourceFile f : graph.files().values()) {
            final String color = f.isHeader() ? HEADER_COLOR : OTHER_COLOR;
            out.write("  \"" + quote(f.path()) + "\" [label=\"" + quote(f.name())
                    + "\" fillcolor=\"" + color + "\" style=filled];\n");
        }

        for (var e : graph.forward().entrySet()) {
            for (String target : e.getValue()) {
                out.write("  \"" + quote(e.getKey()) + "\" -> \"" + quote(target) + "\";\n");
            }
        }

        out.write("}\n");
    }

    private static String quote(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
