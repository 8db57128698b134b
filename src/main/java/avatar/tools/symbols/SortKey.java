package avatar.tools.symbols;

import java.util.Comparator;
import java.util.Locale;

/**
 * Orderings for section symbol listings. SIZE is largest first. Addresses
 * and sizes compare as unsigned 64-bit values.
 */
public enum SortKey {
    ADDRESS((a, b) -> Long.compareUnsigned(a.address(), b.address())),
    NAME(Comparator.comparing(s -> s.name().toLowerCase(Locale.ROOT))),
    SIZE((a, b) -> Long.compareUnsigned(b.size(), a.size())),
    FLAGS(Comparator.comparing(Symbol::flags)),
    TYPE(Comparator.comparing(Symbol::type));

    private final Comparator<Symbol> comparator;

    SortKey(Comparator<Symbol> comparator) {
        this.comparator = comparator;
    }

    public Comparator<Symbol> comparator() {
        return comparator;
    }

    public static SortKey parse(String value) {
        for (SortKey k : values()) {
            if (k.name().equalsIgnoreCase(value)) {
                return k;
            }
        }
        throw new IllegalArgumentException("unknown sort key: " + value
                + " (expected address, name, size, flags or type)");
    }
}
