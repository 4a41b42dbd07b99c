package com.layeredconfig.repository;

import com.layeredconfig.core.config.Config;
import com.layeredconfig.core.subset.MissingRequiredKeysException;
import com.layeredconfig.core.subset.SearchContext;
import com.layeredconfig.core.subset.UnknownConfigKindException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URL;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RepositoryConfigs} against the packaged defaults.
 */
class RepositoryConfigsTest {

    @TempDir
    Path tempDir;

    private RepositoryConfigs configs;

    @BeforeEach
    void setUp() {
        configs = RepositoryConfigs.create(Map.of());
    }

    // ---------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should compose the built-in defaults without a seed")
    void shouldLoadDefaults() {
        Config full = configs.load(null, null);

        assertThat(full.get(".registry.cls")).isEqualTo("sqlite");
        assertThat(full.get(".registry.db")).isEqualTo("sqlite:///:memory:");
        assertThat(full.get(".registry.poolSize")).isEqualTo(1);
        assertThat(full.get(".datastore.cls")).isEqualTo("posix");
        assertThat(full.get(".datastore.records.table")).isEqualTo("posix_datastore_records");
        assertThat(full.keySet()).containsExactly("registry", "datastore");
    }

    @Test
    @DisplayName("Should apply the defaults of the selected registry kind")
    void shouldSelectRegistryKind() {
        Config full = configs.load(Map.of("registry", Map.of("cls", "postgresql")), null);

        assertThat(full.get(".registry.db")).isEqualTo("postgresql://localhost:5432/repository");
        assertThat(full.get(".registry.namespace")).isEqualTo("public");
        assertThat(full.contains(".registry.foreignKeys")).isFalse();
    }

    @Test
    @DisplayName("Should let seed values win over every default")
    void shouldPreferSeedValues() {
        Config full = configs.load(Map.of(
                "registry", Map.of("cls", "postgresql", "db", "postgresql://db.example:5432/prod"),
                "custom", "kept"), null);

        assertThat(full.get(".registry.db")).isEqualTo("postgresql://db.example:5432/prod");
        assertThat(full.get("custom")).isEqualTo("kept");
    }

    @Test
    @DisplayName("Should compose each datastore of a chained datastore")
    void shouldExpandChainedDatastore() {
        Config full = configs.load(Map.of("datastore", Map.of("cls", "chained")), null);

        assertThat(full.get(".datastore.datastores.0.cls")).isEqualTo("inMemory");
        assertThat(full.get(".datastore.datastores.0.create")).isEqualTo(false);
        assertThat(full.get(".datastore.datastores.1.cls")).isEqualTo("posix");
        assertThat(full.get(".datastore.datastores.1.records.table")).isEqualTo("posix_datastore_records");
        assertThat(full.contains(".datastore.records")).isFalse();
    }

    @Test
    @DisplayName("Should reject an unknown datastore kind")
    void shouldRejectUnknownKind() {
        assertThatThrownBy(() -> configs.load(Map.of("datastore", Map.of("cls", "s3")), null))
                .isInstanceOf(UnknownConfigKindException.class)
                .hasMessageContaining("s3");
    }

    @Test
    @DisplayName("Should fail validation when a mandatory key is missing")
    void shouldValidateSections() {
        assertThatThrownBy(() -> configs.composer()
                .compose(RepositoryConfigKinds.DATASTORE, Map.of("cls", "posix"), true, false, null))
                .isInstanceOf(MissingRequiredKeysException.class)
                .hasMessageContaining("root");
    }

    // ---------------------------------------------------------------
    // Search path
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should let environment directories override the built-in defaults")
    void shouldReadEnvironmentDefaults() throws IOException {
        Path envDir = Files.createDirectories(tempDir.resolve("site"));
        Files.writeString(envDir.resolve("registry.yaml"), "registry:\n  db: 'sqlite:///site.db'\n");

        RepositoryConfigs site = RepositoryConfigs.create(Map.of(SearchContext.CONFIG_PATH_ENV, envDir.toString()));
        Config full = site.load(null, null);

        assertThat(site.searchContext().getPaths()).hasSize(2).startsWith(envDir);
        assertThat(full.get(".registry.db")).isEqualTo("sqlite:///site.db");
        assertThat(full.get(".registry.limited")).isEqualTo(false);
    }

    @Test
    @DisplayName("Should search explicit directories before the environment")
    void shouldPreferExplicitSearchPath() throws IOException {
        Path explicit = Files.createDirectories(tempDir.resolve("explicit"));
        Files.writeString(explicit.resolve("datastore.yaml"), "datastore:\n  create: false\n");

        Config full = configs.load(null, List.of(explicit));

        assertThat(full.get(".datastore.create")).isEqualTo(false);
    }

    @Test
    @DisplayName("Should locate the packaged defaults or the overriding directory")
    void shouldLocateBuiltinDirectory() {
        Path builtin = RepositoryConfigs.builtinConfigDir();

        assertThat(builtin.resolve("registry.yaml")).exists();
        assertThat(builtin.resolve("datastores/posixDatastore.yaml")).exists();

        System.setProperty(RepositoryConfigs.CONFIG_DIR_PROPERTY, tempDir.toString());
        try {
            assertThat(RepositoryConfigs.builtinConfigDir()).isEqualTo(tempDir);
        } finally {
            System.clearProperty(RepositoryConfigs.CONFIG_DIR_PROPERTY);
        }
    }

    @Test
    @DisplayName("Should read packaged defaults from inside a jar")
    void shouldOpenDefaultsInsideJar() throws IOException {
        Path jar = tempDir.resolve("defaults.jar");
        try (FileSystem zip = FileSystems.newFileSystem(jar, Map.of("create", "true"))) {
            Path dir = Files.createDirectories(zip.getPath("config"));
            Files.writeString(dir.resolve("registry.yaml"), "registry:\n  db: 'sqlite:///jar.db'\n");
        }
        URL resource = new URL("jar:" + jar.toUri() + "!/config/registry.yaml");

        Path first = RepositoryConfigs.resourceDirectory(resource);
        Path second = RepositoryConfigs.resourceDirectory(resource);

        assertThat(second).isEqualTo(first);
        assertThat(new Config(first.resolve("registry.yaml")).get(".registry.db")).isEqualTo("sqlite:///jar.db");
    }

    // ---------------------------------------------------------------
    // Repository creation
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should write a minimal repository config and read it back in full")
    void shouldMakeRepository() {
        Path root = tempDir.resolve("repo");

        Path file = configs.makeRepository(root, null);

        String rootPath = root.toAbsolutePath().normalize().toString();
        Config written = new Config(file);
        assertThat(file).isEqualTo(root.resolve(RepositoryConfigs.REPOSITORY_CONFIG_FILE));
        assertThat(written.get("root")).isEqualTo(rootPath);
        assertThat(written.get(".datastore.root")).isEqualTo(rootPath + "/datastore");
        assertThat(written.get(".datastore.cls")).isEqualTo("posix");
        assertThat(written.contains("registry")).isFalse();

        Config full = configs.loadRepository(root);
        assertThat(full.get(".datastore.root")).isEqualTo(rootPath + "/datastore");
        assertThat(full.get(".registry.cls")).isEqualTo("sqlite");
        assertThat(full.get("root")).isEqualTo(rootPath);
    }

    @Test
    @DisplayName("Should write the full config in registry, datastore order when standalone")
    void shouldMakeStandaloneRepository() throws IOException {
        Path root = tempDir.resolve("standalone");

        Path file = configs.makeRepository(root, Map.of("registry", Map.of("cls", "postgresql")), true);

        String content = Files.readString(file);
        assertThat(content).startsWith("registry:");
        assertThat(content.indexOf("\ndatastore:")).isGreaterThan(0);
        Config written = new Config(file);
        assertThat(written.get(".registry.db")).isEqualTo("postgresql://localhost:5432/repository");
        assertThat(written.get(".datastore.records.table")).isEqualTo("posix_datastore_records");
    }

    @Test
    @DisplayName("Should keep an explicit datastore root")
    void shouldKeepExplicitDatastoreRoot() {
        Path root = tempDir.resolve("explicit-root");

        Path file = configs.makeRepository(root, Map.of("datastore", Map.of("root", "/mnt/store")));

        assertThat(new Config(file).get(".datastore.root")).isEqualTo("/mnt/store");
    }
}
