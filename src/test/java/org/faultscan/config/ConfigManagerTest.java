package org.faultscan.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadBundled_readsClasspathConfig() throws IOException {
        AppConfig config = ConfigManager.loadBundled();

        assertEquals(Path.of("data", "subset_500.csv"), config.inputFile());
        assertEquals(32, config.numThreads());
        assertEquals(10, config.chunkSize());
        assertEquals(100, config.progressInterval());
    }

    @Test
    void testLoad_partialFileFallsBackToDefaults() throws IOException {
        Path yaml = Files.write(tempDir.resolve("config.yaml"), List.of(
                "inputFile: /tmp/logs.csv",
                "numThreads: 4",
                "somethingUnknown: ignored"));

        AppConfig config = ConfigManager.load(yaml);

        assertEquals(Path.of("/tmp/logs.csv"), config.inputFile());
        assertEquals(4, config.numThreads());
        assertEquals(AppConfig.DEFAULT_OUTPUT_DIR, config.outputDir());
        assertEquals(AppConfig.DEFAULT_CHUNK_SIZE, config.chunkSize());
        assertEquals(AppConfig.DEFAULT_STATS_FILE, config.statsFile());
    }

    @Test
    void testLoad_emptyFileGivesDefaults() throws IOException {
        Path yaml = Files.createFile(tempDir.resolve("empty.yaml"));
        assertEquals(AppConfig.defaults(), ConfigManager.load(yaml));
    }

    @Test
    void testLoad_nonPositiveSettingNamesTheFile() throws IOException {
        Path yaml = Files.write(tempDir.resolve("bad.yaml"), List.of("numThreads: -4"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigManager.load(yaml));

        assertTrue(e.getMessage().startsWith(yaml.toString()), e.getMessage());
        assertTrue(e.getMessage().contains("numThreads"), e.getMessage());
    }

    @Test
    void testLoad_missingFileThrows() {
        assertThrows(IOException.class, () -> ConfigManager.load(tempDir.resolve("nope.yaml")));
    }
}
