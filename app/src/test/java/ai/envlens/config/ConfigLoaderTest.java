package ai.envlens.config;

import static org.junit.jupiter.api.Assertions.*;

import ai.envlens.analyzer.IndexingConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
    @TempDir
    Path root;

    @Test
    void missingFileGivesDefaults() {
        var config = ConfigLoader.load(root);
        assertEquals(300L, config.debounceMillis());
        assertEquals(5_000L, config.lookupTimeoutMillis());
        assertEquals(10_000L, config.refreshTimeoutMillis());
        assertEquals(List.of(".env"), config.envFiles());
        assertTrue(config.indexing().enabled());
        assertEquals(IndexingConfig.DEFAULT_EXCLUDES, config.indexing().excludedDirectories());
        assertTrue(config.features().diagnostics());
        assertFalse(config.masking().enabled());
        assertTrue(config.features().inlayHints());
        assertEquals(30, config.inlayHints().maxValueLength());
        assertFalse(config.inlayHints().bindingUsages());
    }

    @Test
    void partialFileKeepsDefaultsForTheRest() throws IOException {
        Files.writeString(root.resolve(ConfigLoader.CONFIG_FILE), """
                {
                  "debounceMillis": 50,
                  "envFiles": [".env", ".env.local"],
                  "indexing": { "excludedDirectories": ["generated"], "threads": 3 },
                  "features": { "completion": false },
                  "masking": { "enabled": true, "showPrefix": 2 },
                  "inlayHints": { "maxHintsPerLine": 0, "bindingUsages": true },
                  "somethingNew": true
                }
                """);
        var config = ConfigLoader.load(root);
        assertEquals(50L, config.debounceMillis());
        assertEquals(5_000L, config.lookupTimeoutMillis());
        assertEquals(List.of(".env", ".env.local"), config.envFiles());
        assertEquals(Set.of("generated"), config.indexing().excludedDirectories());
        assertEquals(3, config.indexing().threads());
        assertEquals(IndexingConfig.DEFAULT_MAX_FILE_BYTES, config.indexing().maxFileBytes());
        assertFalse(config.features().completion());
        assertTrue(config.features().hover());
        assertTrue(config.masking().enabled());
        assertEquals("*", config.masking().maskChar());
        assertEquals(2, config.masking().showPrefix());
        assertEquals(0, config.inlayHints().maxHintsPerLine());
        assertTrue(config.inlayHints().bindingUsages());
        assertTrue(config.inlayHints().directReferences());

        var indexing = config.indexing().toIndexingConfig(root);
        assertEquals(root, indexing.root());
        assertEquals(3, indexing.threads());
    }

    @Test
    void malformedFileFallsBackToDefaults() throws IOException {
        Files.writeString(root.resolve(ConfigLoader.CONFIG_FILE), "{ not json");
        assertEquals(EnvLensConfig.defaults(), ConfigLoader.load(root));
    }
}
