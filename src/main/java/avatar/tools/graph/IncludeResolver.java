package avatar.tools.graph;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import avatar.tools.model.RelPaths;
import avatar.tools.model.SourceFile;

/**
 * Maps a raw include target to a discovered file.
 * Strategy:
 * 1) exact bare-name lookup in the discovery map
 * 2) first include directory containing {@code dir/target}
 * 3) system prefix: ignored
 * 4) otherwise unresolved
 * <p>
 * Lookup (1) is by file name only, so {@code "fs/fat32.h"} never matches the
 * map and goes to the include directories.
 */
public final class IncludeResolver {

    private final Path projectRoot;
    private final Map<String, SourceFile> filesByName;
    private final List<String> includeDirs;
    private final List<String> systemPrefixes;

    public IncludeResolver(Path projectRoot,
                           Map<String, SourceFile> filesByName,
                           List<String> includeDirs,
                           List<String> systemPrefixes) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        this.filesByName = Objects.requireNonNull(filesByName, "filesByName");
        this.includeDirs = List.copyOf(Objects.requireNonNull(includeDirs, "includeDirs"));
        this.systemPrefixes = List.copyOf(Objects.requireNonNull(systemPrefixes, "systemPrefixes"));
    }

    public Resolution resolve(String target) {
        if (target == null || target.isBlank()) {
            return Resolution.unresolved();
        }

        final SourceFile known = filesByName.get(target);
        if (known != null) {
            return Resolution.resolved(known.path());
        }

        for (String dir : includeDirs) {
            final Path candidate = projectRoot.resolve(dir).resolve(target).normalize();
            if (Files.isRegularFile(candidate)) {
                return Resolution.resolved(RelPaths.relativize(projectRoot, candidate));
            }
        }

        if (RelPaths.hasAnyPrefix(target, systemPrefixes)) {
            return Resolution.system();
        }
        return Resolution.unresolved();
    }
}
