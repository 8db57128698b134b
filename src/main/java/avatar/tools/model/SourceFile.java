package avatar.tools.model;

import java.util.Objects;

/**
 * A discovered file. Identity is the root-relative path.
 */
public record SourceFile(
        String path,                 // root-relative, '/' separated
        String name,                 // bare file name
        FileKind kind,
        DirectoryCategory category
) {
    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(category, "category");
    }

    public boolean isHeader() {
        return kind.isHeader();
    }
}
