package avatar.tools.scan;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts raw {@code #include} targets from C and assembly sources.
 * <p>
 * Line grammar (after trimming leading and trailing whitespace):
 * <pre>
 *   directive := '#' ws* "include" ws* ( '"' target '"' | '<' target '>' ) any*
 *   target    := one or more characters other than the closing delimiter
 *   ws        := ' ' | '\t'
 * </pre>
 * Any line that does not match is not an include. Conditional compilation and
 * macros are not evaluated: every matching line counts.
 */
public final class IncludeExtractor {

    private static final String KEYWORD = "include";

    private final PrintStream warnings;
    private int readWarnings;

    public IncludeExtractor() {
        this(System.err);
    }

    /**
     * @param warnings stream for per-file {@code WARN:} lines
     */
    public IncludeExtractor(PrintStream warnings) {
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    /**
     * Reads the file as strict UTF-8. A file that cannot be read or decoded is
     * reported on the warnings stream and contributes no includes.
     */
    public Set<String> extract(Path file) {
        Objects.requireNonNull(file, "file");
        final List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            readWarnings++;
            warnings.println("WARN: could not read " + file + " -> "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return Collections.emptySet();
        }
        return extract(lines);
    }

    public Set<String> extract(List<String> lines) {
        final Set<String> out = new LinkedHashSet<>();
        for (String line : lines) {
            final String target = parseDirective(line);
            if (target != null) {
                out.add(target);
            }
        }
        return out;
    }

    /**
     * Returns the include target of one line, or null when the line is not an
     * include directive.
     */
    public static String parseDirective(String line) {
        if (line == null) {
            return null;
        }
        final String s = line.trim();
        int i = 0;
        final int n = s.length();

        if (i >= n || s.charAt(i) != '#') return null;
        i = skipBlanks(s, i + 1);

        if (!s.startsWith(KEYWORD, i)) return null;
        i = skipBlanks(s, i + KEYWORD.length());

        if (i >= n) return null;
        final char open = s.charAt(i);
        final char close;
        if (open == '"') {
            close = '"';
        } else if (open == '<') {
            close = '>';
        } else {
            return null;
        }

        final int start = i + 1;
        final int end = s.indexOf(close, start);
        if (end <= start) {
            // unterminated or empty target
            return null;
        }
        return s.substring(start, end);
    }

    private static int skipBlanks(String s, int i) {
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }

    public int readWarningCount() {
        return readWarnings;
    }
}
