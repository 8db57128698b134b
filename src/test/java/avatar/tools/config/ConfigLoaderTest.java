package avatar.tools.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsMirrorTheHypervisorTree() {
        final AnalyzerConfig config = AnalyzerConfig.defaults();

        assertThat(config.sourceRoots()).startsWith(".", "boot", "exception").contains("vmm", "guest");
        assertThat(config.includeDirs()).containsExactly("include", "guest");
        assertThat(config.systemPrefixes()).containsExactly("sys/", "linux/", "asm/");
        assertThat(config.guestAllowedFiles()).containsExactlyInAnyOrder(
                "test_guest.S", "guest_manifests.c", "guest_manifest.h");
        assertThat(config.appExcludedFiles()).containsExactly("syscall.S");
    }

    @Test
    void presentPropertiesOverrideAndOthersKeepDefaults() throws IOException {
        final Path file = write("deps.json", """
                {
                  "sourceRoots": ["vmm", "hyper"],
                  "includeDirs": ["include"],
                  "guestRoot": "payload"
                }
                """);

        final AnalyzerConfig config = new ConfigLoader().load(file);

        assertThat(config.sourceRoots()).containsExactly("vmm", "hyper");
        assertThat(config.includeDirs()).containsExactly("include");
        assertThat(config.guestRoot()).isEqualTo("payload");
        assertThat(config.excludedDirs()).isEqualTo(AnalyzerConfig.defaults().excludedDirs());
        assertThat(config.appRoot()).isEqualTo("app");
    }

    @Test
    void unknownPropertyIsRejected() throws IOException {
        final Path file = write("deps.json", "{\"sourceDirs\": [\".\"]}");

        assertThatThrownBy(() -> new ConfigLoader().load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sourceDirs");
    }

    @Test
    void wrongShapesAreRejected() throws IOException {
        final Path notArray = write("a.json", "{\"includeDirs\": \"include\"}");
        final Path notStrings = write("b.json", "{\"excludedDirs\": [1, 2]}");
        final Path notObject = write("c.json", "[\"include\"]");
        final Path emptyRoots = write("d.json", "{\"sourceRoots\": []}");

        final ConfigLoader loader = new ConfigLoader();
        assertThatThrownBy(() -> loader.load(notArray)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.load(notStrings)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.load(notObject)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.load(emptyRoots)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void malformedJsonIsRejected() throws IOException {
        final Path file = write("deps.json", "{\"sourceRoots\": [");

        assertThatThrownBy(() -> new ConfigLoader().load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed config");
    }

    @Test
    void missingFileIsAnIOFailure() {
        assertThatThrownBy(() -> new ConfigLoader().load(tempDir.resolve("absent.json")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void configListsAreImmutableCopies() {
        final List<String> roots = new ArrayList<>(List.of("vmm"));
        final AnalyzerConfig config = AnalyzerConfig.defaults().withSourceRoots(roots);
        roots.add("io");

        assertThat(config.sourceRoots()).containsExactly("vmm");
        assertThatThrownBy(() -> config.sourceRoots().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    private Path write(String name, String content) throws IOException {
        final Path p = tempDir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }
}
