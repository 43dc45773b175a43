package org.stackgraphs.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("stack-graphs.indexer.threads");
        System.clearProperty("stack-graphs.stitcher.maxWorkPerPhase");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should merge the file over the reference configuration")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("stack-graphs-test.conf"));

        assertEquals(2, config.getInt("stack-graphs.indexer.threads"));
        assertEquals(50, config.getInt("stack-graphs.stitcher.maxWorkPerPhase"));
        assertTrue(config.getBoolean("stack-graphs.stitcher.collectStats"));
        // untouched by the file
        assertTrue(config.getBoolean("stack-graphs.stitcher.detectSimilarPaths"));
        assertEquals("org.stackgraphs.storage.InMemoryPartialPathStore",
            config.getString("stack-graphs.storage.className"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("stack-graphs.indexer.threads", "8");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("stack-graphs-test.conf"));

        assertEquals(8, config.getInt("stack-graphs.indexer.threads"));
        assertEquals(50, config.getInt("stack-graphs.stitcher.maxWorkPerPhase"));
    }

    @Test
    @DisplayName("Should resolve substitutions against overridden values")
    void loadFromFile_shouldResolveConfigurationReferences() {
        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals(3, config.getInt("stack-graphs.indexer.fileTimeoutSeconds"));
    }

    @Test
    @DisplayName("loadDefaults should return the reference configuration")
    void loadDefaults_shouldReturnValidConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(4, config.getInt("stack-graphs.indexer.threads"));
        assertFalse(config.getBoolean("stack-graphs.stitcher.filterShadowedPaths"));
    }

    @Test
    @DisplayName("resolve should prefer an explicit file and report it")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("stack-graphs-test.conf"),
            (level, message) -> messages.add(level + " " + message));

        assertEquals(2, config.getInt("stack-graphs.indexer.threads"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file"));
    }

    @Test
    @DisplayName("resolve should honour -Dconfig.file")
    void resolve_shouldUseSystemPropertyFile() {
        System.setProperty("config.file", testResource("stack-graphs-test.conf").getAbsolutePath());

        Config config = ConfigLoader.resolve(null, (level, message) -> { });

        assertEquals(50, config.getInt("stack-graphs.stitcher.maxWorkPerPhase"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingFile() {
        assertThrows(IllegalArgumentException.class,
            () -> ConfigLoader.resolve(new File("does/not/exist.conf"), (level, message) -> { }));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
