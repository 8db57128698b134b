package avatar.tools.symbols;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Console tables for the symbol reporter.
 */
public final class SymbolReport {

    private final PrintStream out;

    public SymbolReport(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void sectionAnalysis(SymbolAnalyzer analyzer) {
        out.println("=".repeat(90));
        out.println("Avatar OS Symbol Table Section Analysis");
        out.println("=".repeat(90));
        out.println();
        out.println("Total symbols: " + analyzer.symbols().size());
        out.println();
        out.println("Section Statistics:");
        out.println(String.format("%-15s | %8s | %18s | %18s | %12s",
                "Section", "Count", "Start Address", "End Address", "Size"));
        out.println("-".repeat(90));
        for (SectionLayout l : analyzer.layout()) {
            out.println(String.format("%-15s | %8d | 0x%016x | 0x%016x | %12s",
                    l.section(), l.count(), l.minAddress(), l.maxAddress(), humanSize(l.actualSize())));
        }
    }

    public void sectionSymbols(SymbolAnalyzer analyzer, String section, SortKey sortKey) {
        final List<Symbol> inSection = analyzer.bySection(section);
        if (inSection.isEmpty()) {
            out.println("No symbols found in section '" + section + "'");
            return;
        }

        out.println("=".repeat(100));
        out.println("Symbols in Section: " + section);
        if (sortKey != SortKey.ADDRESS) {
            out.println("Sorted by: " + sortKey.name().toLowerCase(Locale.ROOT));
        }
        out.println("=".repeat(100));
        out.println();
        out.println("Found " + inSection.size() + " symbols in section '" + section + "'");
        out.println();
        out.println(String.format("%-18s | %-8s | %-6s | %-12s | %s", "Address", "Flags", "Type", "Size", "Symbol Name"));
        out.println("-".repeat(100));
        for (Symbol s : SymbolAnalyzer.sorted(inSection, sortKey)) {
            final String size = s.size() != 0 ? symbolSize(s.size()) : s.sizeText();
            out.println(String.format("0x%016x | %-8s | %-6s | %-12s | %s",
                    s.address(), s.flags(), s.type(), size, s.name()));
        }
    }

    public void sectionList(SymbolAnalyzer analyzer) {
        out.println("Available sections:");
        final List<String> names = analyzer.sectionNames();
        for (int i = 0; i < names.size(); i++) {
            final String name = names.get(i);
            out.println(String.format("  %2d. %-20s (%d symbols)", i + 1, name, analyzer.bySection(name).size()));
        }
    }

    /** Size in bytes, KB or MB; {@code size} is unsigned. */
    static String humanSize(long size) {
        if (Long.compareUnsigned(size, 1024L * 1024L) >= 0) {
            return String.format(Locale.ROOT, "%.1f MB", unsignedToDouble(size) / (1024.0 * 1024.0));
        }
        if (Long.compareUnsigned(size, 1024L) >= 0) {
            return String.format(Locale.ROOT, "%.1f KB", unsignedToDouble(size) / 1024.0);
        }
        return Long.toUnsignedString(size) + " bytes";
    }

    private static String symbolSize(long size) {
        if (Long.compareUnsigned(size, 1024L) >= 0) {
            return String.format(Locale.ROOT, "%.1f KB", unsignedToDouble(size) / 1024.0);
        }
        return Long.toUnsignedString(size) + " bytes";
    }

    private static double unsignedToDouble(long v) {
        return v >= 0 ? (double) v : (double) (v >>> 1) * 2.0;
    }
}
