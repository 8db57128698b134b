package avatar.tools.scan;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import avatar.tools.config.AnalyzerConfig;
import avatar.tools.model.DirectoryCategory;
import avatar.tools.model.FileKind;
import avatar.tools.model.RelPaths;
import avatar.tools.model.SourceFile;

/**
 * Walks the configured source roots and maps each bare file name to one
 * discovered {@code .c}, {@code .h} or {@code .S} file.
 * <p>
 * Rules:
 * - a directory whose name is excluded is skipped before its children are visited
 * - below the guest-payload root only allow-listed sub-directories are entered,
 *   and only allow-listed file names are kept
 * - below the application root the configured stub files are dropped
 * - duplicate file names: the later discovery replaces the earlier entry
 * - an entry or directory that cannot be read is reported and skipped
 */
public final class FileDiscovery {

    private final Path projectRoot;
    private final AnalyzerConfig config;
    private final PrintStream warnings;
    private final Set<String> excludedDirs;
    private final Set<String> guestAllowedFiles;
    private final Set<String> appExcludedFiles;

    public FileDiscovery(Path projectRoot, AnalyzerConfig config) {
        this(projectRoot, config, System.err);
    }

    public FileDiscovery(Path projectRoot, AnalyzerConfig config, PrintStream warnings) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        this.config = Objects.requireNonNull(config, "config");
        this.warnings = Objects.requireNonNull(warnings, "warnings");
        this.excludedDirs = new HashSet<>(config.excludedDirs());
        this.guestAllowedFiles = new HashSet<>(config.guestAllowedFiles());
        this.appExcludedFiles = new HashSet<>(config.appExcludedFiles());
    }

    public Discovery discover() throws IOException {
        final Map<String, SourceFile> byName = new LinkedHashMap<>();
        final List<String> collisions = new ArrayList<>();

        for (String root : config.sourceRoots()) {
            final Path rootDir = projectRoot.resolve(root).normalize();
            if (!Files.isDirectory(rootDir)) continue;

            Files.walkFileTree(rootDir, new DiscoveryVisitor(byName, collisions));
        }

        return new Discovery(byName, collisions);
    }

    final class DiscoveryVisitor extends SimpleFileVisitor<Path> {
        private final Map<String, SourceFile> byName;
        private final List<String> collisions;

        DiscoveryVisitor(Map<String, SourceFile> byName, List<String> collisions) {
            this.byName = byName;
            this.collisions = collisions;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            return shouldDescend(dir) ? FileVisitResult.CONTINUE : FileVisitResult.SKIP_SUBTREE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()) {
                accept(file, byName, collisions);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            // also called for a directory that cannot be opened
            warnings.println("WARN: skipping unreadable " + file + " -> " + describe(exc));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                warnings.println("WARN: listing of " + dir + " stopped early -> " + describe(exc));
            }
            return FileVisitResult.CONTINUE;
        }
    }

    private static String describe(IOException exc) {
        final String msg = exc.getMessage();
        return exc.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    private boolean shouldDescend(Path dir) {
        final List<String> parts = components(dir);
        for (String part : parts) {
            if (excludedDirs.contains(part)) {
                return false;
            }
        }

        final int guestIdx = parts.indexOf(config.guestRoot());
        if (guestIdx >= 0 && guestIdx < parts.size() - 1) {
            final String sub = String.join("/", parts.subList(guestIdx + 1, parts.size()));
            return isAllowedGuestSubdir(sub);
        }
        return true;
    }

    private boolean isAllowedGuestSubdir(String sub) {
        for (String allowed : config.guestAllowedSubdirs()) {
            // descend into the allowed path itself, anything below it, and its ancestors
            if (sub.equals(allowed) || sub.startsWith(allowed + "/") || allowed.startsWith(sub + "/")) {
                return true;
            }
        }
        return false;
    }

    private void accept(Path file, Map<String, SourceFile> byName, List<String> collisions) {
        final String name = file.getFileName() != null ? file.getFileName().toString() : "";
        final FileKind kind = FileKind.of(name);
        if (kind == null) return;

        final Path parent = file.getParent();
        final DirectoryCategory category = categoryOf(parent == null ? List.of() : components(parent));
        switch (category) {
            case GUEST_PAYLOAD -> {
                if (!guestAllowedFiles.contains(name)) return;
            }
            case APPLICATION -> {
                if (appExcludedFiles.contains(name)) return;
            }
            default -> {
            }
        }

        final String rel = RelPaths.relativize(projectRoot, file);
        final SourceFile previous = byName.put(name, new SourceFile(rel, name, kind, category));
        if (previous != null && !previous.path().equals(rel)) {
            collisions.add(name + ": " + rel + " replaces " + previous.path());
        }
    }

    private DirectoryCategory categoryOf(List<String> dirParts) {
        if (dirParts.contains(config.guestRoot())) {
            return DirectoryCategory.GUEST_PAYLOAD;
        }
        if (dirParts.contains(config.appRoot())) {
            return DirectoryCategory.APPLICATION;
        }
        return DirectoryCategory.ORDINARY;
    }

    private List<String> components(Path dir) {
        final Path abs = dir.toAbsolutePath().normalize();
        final List<String> out = new ArrayList<>();
        if (!abs.startsWith(projectRoot)) {
            // outside the project: judge by the directory's own name only
            if (abs.getFileName() != null) {
                out.add(abs.getFileName().toString());
            }
            return out;
        }
        final Path rel = projectRoot.relativize(abs);
        for (Path part : rel) {
            final String s = part.toString();
            if (!s.isEmpty()) {
                out.add(s);
            }
        }
        return out;
    }

    /**
     * Discovery result.
     *
     * @param files      bare file name to discovered file, in discovery order
     * @param collisions human readable notes for names claimed by two different paths
     */
    public record Discovery(Map<String, SourceFile> files, List<String> collisions) {
        public Discovery {
            files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
            collisions = List.copyOf(collisions);
        }

        public boolean isEmpty() {
            return files.isEmpty();
        }
    }
}
