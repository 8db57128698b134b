package avatar.tools.symbols;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Filters, sorts and summarises parsed symbols. Filters match by substring,
 * the same way the flag and section columns are read by eye.
 */
public final class SymbolAnalyzer {

    private final List<Symbol> symbols;
    private final int skippedLines;

    public SymbolAnalyzer(List<String> symbolLines) {
        Objects.requireNonNull(symbolLines, "symbolLines");
        final List<Symbol> parsed = new ArrayList<>(symbolLines.size());
        int skipped = 0;
        for (int i = 0; i < symbolLines.size(); i++) {
            final Symbol s = SymbolLineTokenizer.parse(symbolLines.get(i), i + 1);
            if (s == null) {
                skipped++;
            } else {
                parsed.add(s);
            }
        }
        this.symbols = List.copyOf(parsed);
        this.skippedLines = skipped;
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    public int skippedLines() {
        return skippedLines;
    }

    public List<Symbol> sorted(SortKey key) {
        return sorted(symbols, key);
    }

    public static List<Symbol> sorted(List<Symbol> in, SortKey key) {
        final List<Symbol> out = new ArrayList<>(in);
        out.sort(key.comparator());
        return out;
    }

    public List<Symbol> bySection(String section) {
        return filter(s -> s.section().contains(section));
    }

    public List<Symbol> byFlags(String flag) {
        return filter(s -> s.flags().contains(flag));
    }

    public List<Symbol> byType(String type) {
        return filter(s -> s.type().contains(type));
    }

    /** Case-insensitive regex search over symbol names. */
    public List<Symbol> search(String regex) {
        final Pattern p = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return filter(s -> p.matcher(s.name()).find());
    }

    /** Function symbols: objdump prints {@code F} in the type column. */
    public List<Symbol> functions() {
        return byType("F");
    }

    public List<Symbol> objects() {
        return byType("O");
    }

    public List<Symbol> globals() {
        return byFlags("g");
    }

    public List<Symbol> locals() {
        return byFlags("l");
    }

    public List<String> sectionNames() {
        final TreeSet<String> names = new TreeSet<>();
        for (Symbol s : symbols) {
            names.add(s.section());
        }
        return new ArrayList<>(names);
    }

    /**
     * Per-section address range and sizes, largest actual size first.
     */
    public List<SectionLayout> layout() {
        final Map<String, SectionLayout.Accumulator> acc = new LinkedHashMap<>();
        for (Symbol s : symbols) {
            acc.computeIfAbsent(s.section(), SectionLayout.Accumulator::new).add(s);
        }
        final List<SectionLayout> out = new ArrayList<>(acc.size());
        for (SectionLayout.Accumulator a : acc.values()) {
            out.add(a.toLayout());
        }
        out.sort((a, b) -> Long.compareUnsigned(b.actualSize(), a.actualSize()));
        return out;
    }

    private List<Symbol> filter(Predicate<Symbol> p) {
        final List<Symbol> out = new ArrayList<>();
        for (Symbol s : symbols) {
            if (p.test(s)) {
                out.add(s);
            }
        }
        return out;
    }
}
