package avatar.tools.io;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import avatar.tools.graph.GraphStatistics;

/**
 * Console output of the dependency analyzer.
 */
public final class ReportPrinter {

    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void banner() {
        out.println("Avatar VMM Dependency Analysis");
        out.println("=".repeat(40));
    }

    public void statistics(GraphStatistics stats) {
        out.println("Source files: " + stats.sourceFiles());
        out.println("Header files: " + stats.headerFiles());
        out.println("Dependencies: " + stats.edges());
        out.println("Most dependencies: " + describe(stats.mostDependencies(), "deps"));
        out.println("Most dependents: " + describe(stats.mostDependents(), "dependents"));
        if (stats.unresolvedIncludes() > 0 || stats.systemIncludes() > 0) {
            out.println("Ignored includes: " + stats.systemIncludes() + " system, "
                    + stats.unresolvedIncludes() + " unresolved");
        }
    }

    public void cycle(Optional<List<String>> cycle) {
        out.println();
        out.println("Checking for circular dependencies...");
        if (cycle.isPresent()) {
            out.println("Circular dependency found: " + String.join(" -> ", cycle.get()));
        } else {
            out.println("No circular dependencies found.");
        }
    }

    public void buildOrder(List<String> order) {
        out.println();
        out.println("Build order:");
        for (int i = 0; i < order.size(); i++) {
            out.println(String.format("%3d. %s", i + 1, order.get(i)));
        }
    }

    public void exported(String what, Object file) {
        out.println();
        out.println(what + " saved to " + file);
    }

    private static String describe(GraphStatistics.Extreme e, String unit) {
        if (e == null) {
            return "none";
        }
        return e.path() + " (" + e.count() + " " + unit + ")";
    }
}
