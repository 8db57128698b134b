package avatar.tools.symbols;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SymbolLineTokenizerTest {

    @Test
    void sixColumnRowHasAType() {
        final Symbol s = SymbolLineTokenizer.parse("0000000040080000 l    d  .text\t0000000000000000 .text", 1);

        assertThat(s).isNotNull();
        assertThat(s.address()).isEqualTo(0x40080000L);
        assertThat(s.flags()).isEqualTo("l");
        assertThat(s.type()).isEqualTo("d");
        assertThat(s.section()).isEqualTo(".text");
        assertThat(s.size()).isZero();
        assertThat(s.name()).isEqualTo(".text");
        assertThat(s.lineNumber()).isEqualTo(1);
    }

    @Test
    void fiveColumnRowHasNoType() {
        final Symbol s = SymbolLineTokenizer.parse("0000000040080148 l       .text\t0000000000000010 from_el3_to_el1", 7);

        assertThat(s.type()).isEmpty();
        assertThat(s.section()).isEqualTo(".text");
        assertThat(s.size()).isEqualTo(16);
        assertThat(s.sizeText()).isEqualTo("0000000000000010");
        assertThat(s.name()).isEqualTo("from_el3_to_el1");
    }

    @Test
    void extraColumnsAreJoinedIntoTheName() {
        final Symbol s = SymbolLineTokenizer.parse("0000000040081000 g     F .text\t0000000000000040 .hidden  uart_putc", 2);

        assertThat(s.type()).isEqualTo("F");
        assertThat(s.name()).isEqualTo(".hidden uart_putc");
    }

    @Test
    void highAddressesStayUnsigned() {
        final Symbol s = SymbolLineTokenizer.parse("ffffff8000080000 g       .text\t0000000000000000 _start", 1);

        assertThat(Long.toUnsignedString(s.address(), 16)).isEqualTo("ffffff8000080000");
    }

    @Test
    void nonHexSizesReadAsZero() {
        assertThat(SymbolLineTokenizer.parseSize("*ABS*")).isZero();
        assertThat(SymbolLineTokenizer.parseSize("zz")).isZero();
        assertThat(SymbolLineTokenizer.parseSize("")).isZero();
        assertThat(SymbolLineTokenizer.parseSize("0000000000001000")).isEqualTo(4096);
    }

    @Test
    void malformedRowsAreRejected() {
        assertThat(SymbolLineTokenizer.parse("0000000040080000 l .text 0", 1)).isNull();
        assertThat(SymbolLineTokenizer.parse("40080000 l d .text 0000000000000000 short_addr", 1)).isNull();
        assertThat(SymbolLineTokenizer.parse("000000004008000g l d .text 0000000000000000 bad_hex", 1)).isNull();
        assertThat(SymbolLineTokenizer.parse("", 1)).isNull();
        assertThat(SymbolLineTokenizer.parse(null, 1)).isNull();
    }

    @Test
    void splitCollapsesTabsAndSpaces() {
        assertThat(SymbolLineTokenizer.split("  a\t\tb   c ")).containsExactly("a", "b", "c");
    }
}
