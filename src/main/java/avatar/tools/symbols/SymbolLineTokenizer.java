package avatar.tools.symbols;

import java.util.ArrayList;
import java.util.List;

/**
 * Column splitter for symbol table rows.
 * <p>
 * Grammar (columns separated by runs of spaces or tabs):
 * <pre>
 *   row5  := address flags section size name
 *   row6  := address flags type section size name-part+
 *   address := exactly 16 hex digits, base 16
 *   size    := hex digits, base 16; "*ABS*" or anything else non-hex reads as 0
 * </pre>
 * A row with fewer than five columns or a malformed address is rejected
 * ({@link #parse} returns null). In a six-column row the name parts are joined
 * with single spaces.
 */
public final class SymbolLineTokenizer {

    private SymbolLineTokenizer() {
    }

    public static Symbol parse(String line, int lineNumber) {
        if (line == null) {
            return null;
        }
        final List<String> cols = split(line);
        if (cols.size() < 5) {
            return null;
        }

        final String addressText = cols.get(0);
        if (!isHex16(addressText)) {
            return null;
        }
        final long address = Long.parseUnsignedLong(addressText, 16);
        final String flags = cols.get(1);

        final String type;
        final String section;
        final String sizeText;
        final String name;
        if (cols.size() == 5) {
            type = "";
            section = cols.get(2);
            sizeText = cols.get(3);
            name = cols.get(4);
        } else {
            type = cols.get(2);
            section = cols.get(3);
            sizeText = cols.get(4);
            name = String.join(" ", cols.subList(5, cols.size()));
        }

        return new Symbol(address, addressText, flags, type, section, parseSize(sizeText), sizeText, name, lineNumber);
    }

    static List<String> split(String line) {
        final List<String> out = new ArrayList<>();
        final int n = line.length();
        int i = 0;
        while (i < n) {
            while (i < n && isBlank(line.charAt(i))) {
                i++;
            }
            final int start = i;
            while (i < n && !isBlank(line.charAt(i))) {
                i++;
            }
            if (i > start) {
                out.add(line.substring(start, i));
            }
        }
        return out;
    }

    static long parseSize(String sizeText) {
        if (sizeText.isEmpty() || sizeText.length() > 16) {
            return 0;
        }
        for (int i = 0; i < sizeText.length(); i++) {
            if (Character.digit(sizeText.charAt(i), 16) < 0) {
                return 0; // *ABS* and friends
            }
        }
        return Long.parseUnsignedLong(sizeText, 16);
    }

    private static boolean isHex16(String s) {
        if (s.length() != 16) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }
}
