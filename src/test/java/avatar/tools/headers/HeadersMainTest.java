package avatar.tools.headers;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class HeadersMainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException {
        write("main.c", "int main(void) { return 0; }\n");
        write("mem/mm.h", "/* Copyright (c) 2024 Avatar Project */\n");
        write("boot/boot.S", "_start:\n");
        write("build/kernel.c", "int generated;\n");
        write("guest/payload.c", "int guest;\n");
        write("boot/boot.o", "object\n");
        write("README.md", "# readme\n");
    }

    @Test
    void addsHeadersOutsideExcludedDirectories() throws IOException {
        assertThat(run(tempDir.toString())).isZero();

        assertThat(read("main.c")).startsWith("/*\n * Copyright (c) 2024 Avatar Project");
        assertThat(read("boot/boot.S")).startsWith("/*\n * Copyright (c) 2024 Avatar Project");
        assertThat(read("build/kernel.c")).isEqualTo("int generated;\n");
        assertThat(read("guest/payload.c")).isEqualTo("int guest;\n");
        assertThat(read("boot/boot.o")).isEqualTo("object\n");

        assertThat(out()).contains(
                "Files processed (headers added): 2",
                "Files already with headers: 1",
                "Files skipped: 2",
                "Total files examined: 5");
    }

    @Test
    void dryRunReportsWithoutWriting() throws IOException {
        assertThat(run("--dry-run", tempDir.toString())).isZero();

        assertThat(read("main.c")).isEqualTo("int main(void) { return 0; }\n");
        assertThat(out()).contains("DRY RUN MODE", "Would add header to: ", "Files that would be processed: 2");
    }

    @Test
    void extraExcludePattern() {
        assertThat(run("--dry-run", "--exclude=*.S", tempDir.toString())).isZero();

        assertThat(out()).contains("Files that would be processed: 1", "Files skipped: 3");
    }

    @Test
    void explicitFileIsProcessedEvenInsideExcludedDirectory() throws IOException {
        assertThat(run(tempDir.resolve("guest/payload.c").toString())).isZero();

        assertThat(read("guest/payload.c")).startsWith("/*\n * Copyright");
    }

    @Test
    void missingPathWarns() {
        assertThat(run(tempDir.resolve("nope").toString())).isZero();
        assertThat(err()).contains("WARN: no such file or directory");
    }

    @Test
    void unknownOptionIsUsageError() {
        assertThat(run("--frobnicate")).isEqualTo(2);
        assertThat(err()).contains("unknown argument: --frobnicate", "Usage:");
    }

    private int run(String... args) {
        return HeadersMain.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private void write(String rel, String content) throws IOException {
        final Path p = tempDir.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content, StandardCharsets.UTF_8);
    }

    private String read(String rel) throws IOException {
        return Files.readString(tempDir.resolve(rel), StandardCharsets.UTF_8);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }
}
