package com.layeredconfig.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader} and file-backed {@link Config}s.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read a YAML config file")
    void shouldReadYaml() throws IOException {
        Path file = write("storage.yaml", """
                storage:
                  root: /data
                  retries: 3
                  formats:
                    - fits
                    - json
                """);

        Config config = new Config(file);

        assertThat(config.get(".storage.root")).isEqualTo("/data");
        assertThat(config.getInt(".storage.retries")).isEqualTo(3);
        assertThat(config.get(".storage.formats.1")).isEqualTo("json");
        assertThat(config.getConfigFile()).contains(file);
    }

    @Test
    @DisplayName("Should read a JSON config file")
    void shouldReadJson() throws IOException {
        Path file = write("config.json", """
                {"a": {"b": [1, 2]}, "flag": true}
                """);

        Config config = new Config(file);

        assertThat(config.get(".a.b.1")).isEqualTo(2);
        assertThat(config.getBoolean("flag")).isTrue();
    }

    @Test
    @DisplayName("Should treat an empty YAML file as an empty config")
    void shouldReadEmptyFile() throws IOException {
        Path file = write("empty.yaml", "");

        assertThat(new Config(file).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should reject unsupported file types")
    void shouldRejectUnsupportedExtension() throws IOException {
        Path file = write("settings.ini", "a=1\n");

        assertThatThrownBy(() -> new Config(file))
                .isInstanceOf(UnsupportedDocumentException.class)
                .hasMessageContaining("Unhandled config file type");
        assertThat(ConfigLoader.isSupported(Path.of("x.YML"))).isTrue();
    }

    @Test
    @DisplayName("Should throw for a missing file")
    void shouldRejectMissingFile() {
        Path missing = tempDir.resolve("nope.yaml");

        assertThatThrownBy(() -> new Config(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject a document whose top level is not a mapping")
    void shouldRejectNonMappingDocument() throws IOException {
        Path file = write("list.yaml", "- a\n- b\n");

        assertThatThrownBy(() -> new Config(file))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("must contain a mapping");
    }

    @Test
    @DisplayName("Should reject duplicate keys in YAML and JSON")
    void shouldRejectDuplicateKeys() throws IOException {
        Path yaml = write("dup.yaml", "a: 1\na: 2\n");
        Path json = write("dup.json", "{\"a\": 1, \"a\": 2}");

        assertThatThrownBy(() -> new Config(yaml)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> new Config(json)).isInstanceOf(ConfigException.class);
    }

    // ---------------------------------------------------------------
    // !include
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should replace a scalar !include with the file content")
    void shouldIncludeSingleFile() throws IOException {
        Files.createDirectories(tempDir.resolve("sub"));
        write("sub/storage.yaml", """
                x: 1
                inner: !include inner.yaml
                """);
        write("sub/inner.yaml", "y: 2\n");
        Path main = write("main.yaml", "storage: !include sub/storage.yaml\n");

        Config config = new Config(main);

        assertThat(config.get(".storage.x")).isEqualTo(1);
        assertThat(config.get(".storage.inner.y")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should include every file of a sequence or mapping")
    void shouldIncludeSequenceAndMapping() throws IOException {
        write("a.yaml", "v: first\n");
        write("b.yaml", "v: second\n");
        Path main = write("main.yaml", """
                parts: !include [a.yaml, b.yaml]
                named: !include {one: a.yaml, two: b.yaml}
                """);

        Config config = new Config(main);

        assertThat(config.get(".parts.1.v")).isEqualTo("second");
        assertThat(config.get(".named.one.v")).isEqualTo("first");
    }

    @Test
    @DisplayName("Should fail when an !include target does not exist")
    void shouldFailForMissingIncludeTarget() throws IOException {
        Path main = write("main.yaml", "storage: !include missing.yaml\n");

        assertThatThrownBy(() -> new Config(main))
                .isInstanceOf(UnresolvedIncludeException.class)
                .hasMessageContaining("missing.yaml");
    }

    // ---------------------------------------------------------------
    // Writing
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should read back a dumped config unchanged")
    void shouldReadBackDumpedFile() {
        Config config = new Config(Map.of("registry", Map.of("db", "sqlite:///x"),
                "datastore", Map.of("root", "/data", "formats", List.of("a", "b"))));
        Path out = tempDir.resolve("out.yaml");

        config.dumpToFile(out, List.of("registry", "datastore"));

        assertThat(new Config(out)).isEqualTo(config);
        assertThat(config.prettyPrint()).contains("registry:", "  db: sqlite:///x");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
