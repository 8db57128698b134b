package avatar.tools.config;

import java.util.List;
import java.util.Objects;

/**
 * Discovery and resolution settings for one analyzer run.
 * <p>
 * All directories are relative to the project root. Directory names in
 * {@code excludedDirs}, {@code guestRoot} and {@code appRoot} are matched
 * against single path components, not substrings.
 */
public record AnalyzerConfig(
        List<String> sourceRoots,
        List<String> includeDirs,
        List<String> excludedDirs,
        List<String> systemPrefixes,
        String guestRoot,
        List<String> guestAllowedFiles,
        List<String> guestAllowedSubdirs,
        String appRoot,
        List<String> appExcludedFiles
) {

    public AnalyzerConfig {
        sourceRoots = List.copyOf(Objects.requireNonNull(sourceRoots, "sourceRoots"));
        includeDirs = List.copyOf(Objects.requireNonNull(includeDirs, "includeDirs"));
        excludedDirs = List.copyOf(Objects.requireNonNull(excludedDirs, "excludedDirs"));
        systemPrefixes = List.copyOf(Objects.requireNonNull(systemPrefixes, "systemPrefixes"));
        Objects.requireNonNull(guestRoot, "guestRoot");
        guestAllowedFiles = List.copyOf(Objects.requireNonNull(guestAllowedFiles, "guestAllowedFiles"));
        guestAllowedSubdirs = List.copyOf(Objects.requireNonNull(guestAllowedSubdirs, "guestAllowedSubdirs"));
        Objects.requireNonNull(appRoot, "appRoot");
        appExcludedFiles = List.copyOf(Objects.requireNonNull(appExcludedFiles, "appExcludedFiles"));
        if (sourceRoots.isEmpty()) {
            throw new IllegalArgumentException("sourceRoots must not be empty");
        }
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(
                List.of(".", "boot", "exception", "io", "mem", "timer", "task",
                        "process", "spinlock", "vmm", "lib", "fs", "syscall", "guest"),
                List.of("include", "guest"),
                List.of("clib", ".git", "build"),
                List.of("sys/", "linux/", "asm/"),
                "guest",
                List.of("test_guest.S", "guest_manifests.c", "guest_manifest.h"),
                List.of(),
                "app",
                List.of("syscall.S")
        );
    }

    public AnalyzerConfig withSourceRoots(List<String> roots) {
        return new AnalyzerConfig(roots, includeDirs, excludedDirs, systemPrefixes, guestRoot,
                guestAllowedFiles, guestAllowedSubdirs, appRoot, appExcludedFiles);
    }
}
