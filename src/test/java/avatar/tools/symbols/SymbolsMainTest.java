package avatar.tools.symbols;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class SymbolsMainTest {

    @TempDir
    Path tempDir;

    private Path listing;
    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException {
        final List<String> lines = new ArrayList<>();
        lines.add("SYMBOL TABLE:");
        lines.addAll(SymbolAnalyzerTest.ROWS);
        lines.add("Disassembly of section .text:");
        listing = tempDir.resolve("dis.txt");
        Files.writeString(listing, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    }

    @Test
    void defaultPrintsSectionAnalysis() {
        assertThat(run("--file=" + listing)).isZero();
        assertThat(out()).contains(
                "Avatar OS Symbol Table Section Analysis",
                "Total symbols: 7",
                ".text           |        4 | 0x0000000040080000 | 0x0000000040082000 |       8.0 KB");
        assertThat(err()).contains("WARN: skipped malformed rows: 1");
    }

    @Test
    void sectionListingHonoursSortKey() {
        assertThat(run("-f", listing.toString(), "--section=.text", "--sort=size")).isZero();
        final String out = out();
        assertThat(out).contains("Symbols in Section: .text", "Sorted by: size", "Found 4 symbols in section '.text'");
        assertThat(out.indexOf("Kernel_Main")).isLessThan(out.indexOf("uart_putc"));
        assertThat(out).contains("0x0000000040082000 | g        | F      | 2.0 KB       | Kernel_Main");
    }

    @Test
    void unknownSectionIsReportedNotFailed() {
        assertThat(run("--file=" + listing, "--section=.rodata")).isZero();
        assertThat(out()).contains("No symbols found in section '.rodata'");
    }

    @Test
    void listSections() {
        assertThat(run("--file=" + listing, "-l")).isZero();
        assertThat(out()).contains("Available sections:", "   1. .bss", "(4 symbols)");
    }

    @Test
    void missingListingFails() {
        assertThat(run("--file=" + tempDir.resolve("nope.txt"))).isEqualTo(1);
        assertThat(err()).contains("ERROR: cannot read symbol table");
    }

    @Test
    void badSortKeyFails() {
        assertThat(run("--file=" + listing, "--sort=colour")).isEqualTo(1);
        assertThat(err()).contains("unknown sort key: colour");
    }

    private int run(String... args) {
        return SymbolsMain.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }
}
