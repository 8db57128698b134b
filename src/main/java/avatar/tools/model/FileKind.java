package avatar.tools.model;

/**
 * Kind of a discovered file, derived from its extension.
 */
public enum FileKind {
    HEADER,
    SOURCE,
    ASSEMBLY;

    /**
     * Returns the kind for the given file name, or null when the extension is
     * not one of {@code .h}, {@code .c}, {@code .S}.
     */
    public static FileKind of(String fileName) {
        if (fileName == null) {
            return null;
        }
        if (fileName.endsWith(".h")) {
            return HEADER;
        }
        if (fileName.endsWith(".c")) {
            return SOURCE;
        }
        if (fileName.endsWith(".S")) {
            return ASSEMBLY;
        }
        return null;
    }

    public boolean isHeader() {
        return this == HEADER;
    }
}
