package avatar.tools;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

import avatar.tools.config.AnalyzerConfig;
import avatar.tools.config.ConfigLoader;
import avatar.tools.graph.BuildOrder;
import avatar.tools.graph.CycleDetector;
import avatar.tools.graph.DependencyGraph;
import avatar.tools.graph.EmptyDiscoveryException;
import avatar.tools.graph.GraphBuilder;
import avatar.tools.graph.GraphStatistics;
import avatar.tools.io.DotWriter;
import avatar.tools.io.JsonGraphWriter;
import avatar.tools.io.ReportPrinter;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path projectRoot = null;
        Path configFile = null;
        Path dotFile = null;
        Path jsonFile = null;
        boolean checkCycles = false;
        boolean buildOrder = false;
        BuildOrder.Direction direction = BuildOrder.Direction.INCLUDERS_FIRST;

        try {
            for (int i = 0; i < args.length; i++) {
                final String arg = args[i];
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage(out);
                    return 0;
                }
                if ("--check-cycles".equals(arg)) {
                    checkCycles = true;
                    continue;
                }
                if ("--build-order".equals(arg)) {
                    buildOrder = true;
                    continue;
                }
                if ("--dependencies-first".equals(arg)) {
                    direction = BuildOrder.Direction.DEPENDENCIES_FIRST;
                    continue;
                }
                if ("--dot".equals(arg)) {
                    if (i + 1 >= args.length) {
                        err.println("ERROR: --dot requires a file argument");
                        printUsage(err);
                        return 2;
                    }
                    dotFile = Paths.get(args[++i]);
                    continue;
                }
                if (arg.startsWith("--dot=")) {
                    dotFile = Paths.get(arg.substring("--dot=".length()));
                    continue;
                }
                if (arg.startsWith("--json=")) {
                    jsonFile = Paths.get(arg.substring("--json=".length()));
                    continue;
                }
                if (arg.startsWith("--config=")) {
                    configFile = Paths.get(arg.substring("--config=".length()));
                    continue;
                }
                if (arg.startsWith("-")) {
                    err.println("ERROR: unknown argument: " + arg);
                    printUsage(err);
                    return 2;
                }
                if (projectRoot == null) {
                    projectRoot = Paths.get(arg);
                    continue;
                }
                err.println("ERROR: unexpected argument: " + arg);
                printUsage(err);
                return 2;
            }

            if (projectRoot == null) {
                projectRoot = Paths.get(".");
            }
            projectRoot = projectRoot.toAbsolutePath().normalize();

            AnalyzerConfig config = AnalyzerConfig.defaults();
            if (configFile != null) {
                config = new ConfigLoader().load(resolve(projectRoot, configFile));
            }

            final GraphBuilder builder = new GraphBuilder(projectRoot, config, err);
            final DependencyGraph graph = builder.build(); // full scan, nothing cached

            for (String collision : builder.lastDiscovery().collisions()) {
                err.println("WARN: duplicate file name " + collision);
            }

            final ReportPrinter report = new ReportPrinter(out);
            report.banner();
            report.statistics(GraphStatistics.of(graph));

            if (checkCycles) {
                report.cycle(new CycleDetector(graph).findFirst());
            }
            if (buildOrder) {
                report.buildOrder(new BuildOrder(graph).compute(direction));
            }

            int code = 0;
            if (dotFile != null) {
                final Path target = resolve(projectRoot, dotFile);
                try {
                    new DotWriter().write(graph, target);
                    report.exported("DOT graph", target);
                    out.println("Generate image with: dot -Tpng " + target.getFileName() + " -o deps.png");
                } catch (IOException ex) {
                    err.println("ERROR: could not write DOT graph " + target + ": " + safeMsg(ex.getMessage()));
                    code = 2;
                }
            }
            if (jsonFile != null) {
                final Path target = resolve(projectRoot, jsonFile);
                try {
                    new JsonGraphWriter().write(graph, target, Instant.now().toString());
                    report.exported("JSON graph", target);
                } catch (IOException ex) {
                    err.println("ERROR: could not write JSON graph " + target + ": " + safeMsg(ex.getMessage()));
                    code = 2;
                }
            }

            if (graph.readWarnings() > 0) {
                err.println("WARN: unreadable files: " + graph.readWarnings());
            }
            return code;
        } catch (EmptyDiscoveryException ex) {
            err.println("ERROR: nothing to analyze: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (IllegalArgumentException ex) {
            err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IOException ex) {
            err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            err.println("ERROR: failed to analyze dependencies: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static Path resolve(Path projectRoot, Path p) {
        return p.isAbsolute() ? p : projectRoot.resolve(p).normalize();
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: avatar-deps [projectRoot] [options]");
        out.println("Options:");
        out.println("  --check-cycles          Report the first circular include found");
        out.println("  --build-order           Print the build order (Kahn's algorithm)");
        out.println("  --dependencies-first    With --build-order: included files before their includers");
        out.println("  --dot <file>            Write the graph in Graphviz DOT format (also --dot=<file>)");
        out.println("  --json=<file>           Write nodes, edges and statistics as JSON");
        out.println("  --config=<file>         JSON file overriding roots, include dirs and filters");
        out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
