package avatar.tools.model;

import java.nio.file.Path;
import java.util.Objects;

public final class RelPaths {

    private RelPaths() {
    }

    /**
     * Root-relative path with '/' separators; "." components and redundant
     * separators are removed.
     */
    public static String relativize(Path root, Path file) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(file, "file");
        final Path absRoot = root.toAbsolutePath().normalize();
        final Path absFile = file.toAbsolutePath().normalize();
        return absRoot.relativize(absFile).toString().replace('\\', '/');
    }

    public static boolean hasAnyPrefix(String value, Iterable<String> prefixes) {
        if (value == null) {
            return false;
        }
        for (String prefix : prefixes) {
            if (value.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
