package avatar.tools.graph;

import java.util.Objects;

/**
 * Outcome of resolving one raw include target.
 */
public record Resolution(Kind kind, String path) {

    public enum Kind {
        RESOLVED,
        SYSTEM,     // conventional platform prefix, ignored on purpose
        UNRESOLVED  // not found anywhere, dropped
    }

    public Resolution {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.RESOLVED) {
            Objects.requireNonNull(path, "path");
        } else if (path != null) {
            throw new IllegalArgumentException("only resolved includes carry a path");
        }
    }

    public static Resolution resolved(String path) {
        return new Resolution(Kind.RESOLVED, path);
    }

    public static Resolution system() {
        return new Resolution(Kind.SYSTEM, null);
    }

    public static Resolution unresolved() {
        return new Resolution(Kind.UNRESOLVED, null);
    }
}
