package avatar.tools.symbols;

/**
 * Address span of one section as seen through its symbols.
 * {@code actualSize} is {@code maxAddress - minAddress}, or the sum of symbol
 * sizes when all symbols share one address. Addresses and sizes are unsigned
 * 64-bit values held in {@code long}.
 */
public record SectionLayout(
        String section,
        int count,
        long minAddress,
        long maxAddress,
        long symbolSizeSum,
        long actualSize
) {

    static final class Accumulator {
        private final String section;
        private int count;
        private long min;
        private long max;
        private long sizeSum;

        Accumulator(String section) {
            this.section = section;
        }

        void add(Symbol s) {
            count++;
            // addresses are unsigned 64-bit
            if (count == 1 || Long.compareUnsigned(s.address(), min) < 0) {
                min = s.address();
            }
            if (count == 1 || Long.compareUnsigned(s.address(), max) > 0) {
                max = s.address();
            }
            sizeSum += s.size();
        }

        SectionLayout toLayout() {
            final long actual = min == max ? sizeSum : max - min;
            return new SectionLayout(section, count, min, max, sizeSum, actual);
        }
    }
}
