package avatar.tools.headers;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds copyright headers to the source files under the given paths.
 */
public final class HeadersMain {

    static final Set<String> EXCLUDED_DIRS = Set.of("build", ".git", "__pycache__", "clib", "guest");

    static final List<String> EXCLUDED_PATTERNS = List.of(
            "*.o", "*.bin", "*.img", "*.gz", "*.pyc", "*.so", "*.a", "*.lib", "*.dll");

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        final List<Path> paths = new ArrayList<>();
        final List<String> patterns = new ArrayList<>(EXCLUDED_PATTERNS);
        boolean dryRun = false;
        boolean force = false;
        boolean verbose = false;

        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage(out);
                return 0;
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--force".equals(arg)) {
                force = true;
                continue;
            }
            if ("--verbose".equals(arg) || "-v".equals(arg)) {
                verbose = true;
                continue;
            }
            if (arg.startsWith("--exclude=")) {
                patterns.add(arg.substring("--exclude=".length()));
                continue;
            }
            if (arg.startsWith("-")) {
                err.println("ERROR: unknown argument: " + arg);
                printUsage(err);
                return 2;
            }
            paths.add(Paths.get(arg));
        }
        if (paths.isEmpty()) {
            paths.add(Paths.get("."));
        }

        out.println("Avatar Project - Copyright Header Tool");
        out.println("=".repeat(40));
        if (dryRun) {
            out.println("DRY RUN MODE - No files will be modified");
        }
        out.println();
        out.println("Excluded directories: " + String.join(", ", EXCLUDED_DIRS.stream().sorted().toList()));
        out.println("Excluded file patterns: " + String.join(", ", patterns));
        out.println();

        final HeaderRun run = new HeaderRun(new HeaderInjector(dryRun, force), patterns, verbose, out);
        try {
            for (Path path : paths) {
                if (Files.isRegularFile(path)) {
                    run.file(path);
                } else if (Files.isDirectory(path)) {
                    run.tree(path);
                } else {
                    err.println("WARN: no such file or directory: " + path);
                }
            }
        } catch (IOException ex) {
            err.println("ERROR: IO failure: " + ex.getMessage());
            return 2;
        }

        run.summary(dryRun);
        return 0;
    }

    /**
     * One invocation: walks trees, counts outcomes.
     */
    static final class HeaderRun {
        private final HeaderInjector injector;
        private final List<String> suffixes = new ArrayList<>();
        private final boolean verbose;
        private final PrintStream out;
        private final Map<HeaderInjector.Outcome, Integer> counts = new EnumMap<>(HeaderInjector.Outcome.class);
        private int excluded;

        HeaderRun(HeaderInjector injector, List<String> patterns, boolean verbose, PrintStream out) {
            this.injector = injector;
            this.verbose = verbose;
            this.out = out;
            for (String p : patterns) {
                suffixes.add(p.replace("*", ""));
            }
        }

        void tree(Path dir) throws IOException {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                    final String name = d.getFileName() != null ? d.getFileName().toString() : "";
                    if (!d.equals(dir) && EXCLUDED_DIRS.contains(name)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (verbose && !d.equals(dir)) {
                        out.println("Processing directory: " + dir.relativize(d));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path f, BasicFileAttributes attrs) throws IOException {
                    if (attrs.isRegularFile()) {
                        if (isExcluded(f)) {
                            excluded++;
                            if (verbose) {
                                out.println("Skipping excluded file: " + f);
                            }
                        } else {
                            file(f);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        }

        void file(Path f) throws IOException {
            final HeaderInjector.Outcome outcome = injector.process(f);
            counts.merge(outcome, 1, Integer::sum);
            switch (outcome) {
                case ADDED -> out.println("Added header to: " + f);
                case WOULD_ADD -> out.println("Would add header to: " + f);
                case HAS_HEADER -> {
                    if (verbose) out.println("Already has header: " + f);
                }
                case NO_TEMPLATE -> {
                    if (verbose) out.println("No template for: " + f);
                }
                case BINARY -> {
                    if (verbose) out.println("Skipping binary file: " + f);
                }
            }
        }

        boolean isExcluded(Path f) {
            final String s = f.toString();
            for (String suffix : suffixes) {
                if (!suffix.isEmpty() && s.endsWith(suffix)) {
                    return true;
                }
            }
            return false;
        }

        int count(HeaderInjector.Outcome outcome) {
            return counts.getOrDefault(outcome, 0);
        }

        int skipped() {
            return excluded + count(HeaderInjector.Outcome.BINARY) + count(HeaderInjector.Outcome.NO_TEMPLATE);
        }

        void summary(boolean dryRun) {
            final int processed = count(HeaderInjector.Outcome.ADDED) + count(HeaderInjector.Outcome.WOULD_ADD);
            final int hasHeader = count(HeaderInjector.Outcome.HAS_HEADER);
            out.println();
            out.println("=".repeat(50));
            out.println("SUMMARY");
            out.println("=".repeat(50));
            if (dryRun) {
                out.println("Files that would be processed: " + processed);
            } else {
                out.println("Files processed (headers added): " + processed);
            }
            out.println("Files already with headers: " + hasHeader);
            out.println("Files skipped: " + skipped());
            out.println("Total files examined: " + (processed + hasHeader + skipped()));
            out.println("=".repeat(50));
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: avatar-headers [paths...] [options]");
        out.println("Options:");
        out.println("  --dry-run               Show what would be done without changing files");
        out.println("  --force                 Add a header even when one is present");
        out.println("  --exclude=<pattern>     Additional excluded file pattern, e.g. *.tmp");
        out.println("  --verbose, -v           Report every file");
        out.println("  --help, -h              Show this help");
    }
}
