package avatar.tools.symbols;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cuts the symbol block out of a disassembly listing: the lines after
 * {@code SYMBOL TABLE:} up to the first {@code Disassembly of section .text:}
 * line, blank lines dropped.
 */
public final class SymbolTableReader {

    static final String START_MARKER = "SYMBOL TABLE:";
    static final String END_MARKER = "Disassembly of section .text:";

    private final PrintStream warnings;

    public SymbolTableReader() {
        this(System.err);
    }

    public SymbolTableReader(PrintStream warnings) {
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    public List<String> read(Path listing) throws IOException {
        Objects.requireNonNull(listing, "listing");
        if (!Files.isRegularFile(listing)) {
            throw new IOException("Listing not found: " + listing);
        }
        return extract(Files.readAllLines(listing, StandardCharsets.UTF_8), listing.toString());
    }

    List<String> extract(List<String> lines, String source) {
        int start = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (START_MARKER.equals(lines.get(i).trim())) {
                start = i + 1;
                break;
            }
        }
        if (start < 0) {
            throw new IllegalArgumentException("no '" + START_MARKER + "' marker in " + source);
        }

        int end = -1;
        for (int i = start; i < lines.size(); i++) {
            if (lines.get(i).trim().startsWith(END_MARKER)) {
                end = i;
                break;
            }
        }
        if (end < 0) {
            warnings.println("WARN: no '" + END_MARKER + "' marker in " + source + ", reading to end of file");
            end = lines.size();
        }

        final List<String> out = new ArrayList<>();
        for (int i = start; i < end; i++) {
            final String line = lines.get(i).trim();
            if (!line.isEmpty()) {
                out.add(line);
            }
        }
        return out;
    }
}
