package dev.badgersnacks.compendium.persistence;

import dev.badgersnacks.compendium.variants.ExpansionWorkerPool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileYieldsDefaults() {
        EngineSettings settings = EngineSettings.load(tempDir.resolve("absent.json"));
        assertEquals(EngineSettings.defaults(), settings);
        assertTrue(settings.databaseUrl().startsWith("jdbc:h2:file:"));
        assertEquals(ExpansionWorkerPool.defaultParallelism(), settings.parallelism());
    }

    @Test
    void readsValuesAndResolvesRelativeDatabasePath() throws IOException {
        Path config = tempDir.resolve("engine.json");
        Files.writeString(config, """
                {
                  "databaseUrl": "jdbc:h2:file:./data/catalog;AUTO_SERVER=TRUE",
                  "databaseUser": "compendium",
                  "parallelism": 3
                }
                """);

        EngineSettings settings = EngineSettings.load(config);

        String expectedPath = tempDir.resolve("data/catalog").toAbsolutePath().normalize().toString();
        assertEquals("jdbc:h2:file:" + expectedPath + ";AUTO_SERVER=TRUE", settings.databaseUrl());
        assertEquals("compendium", settings.databaseUser());
        assertEquals("", settings.databasePassword());
        assertEquals(3, settings.parallelism());
    }

    @Test
    void invalidParallelismKeepsDefault() throws IOException {
        Path config = tempDir.resolve("engine.json");
        Files.writeString(config, "{\"parallelism\": 0, \"databaseUrl\": \"jdbc:h2:mem:x\"}");

        EngineSettings settings = EngineSettings.load(config);

        assertEquals("jdbc:h2:mem:x", settings.databaseUrl());
        assertEquals(ExpansionWorkerPool.defaultParallelism(), settings.parallelism());
    }

    @Test
    void malformedFileFallsBackToDefaults() throws IOException {
        Path config = tempDir.resolve("engine.json");
        Files.writeString(config, "{ not json");
        assertEquals(EngineSettings.defaults(), EngineSettings.load(config));
    }

    @Test
    void absoluteAndHomePathsAreKept() {
        assertEquals("jdbc:h2:file:~/catalog", EngineSettings.resolveH2Path("jdbc:h2:file:~/catalog", tempDir));
        String absolute = "jdbc:h2:file:" + tempDir.toAbsolutePath().resolve("db");
        assertEquals(absolute, EngineSettings.resolveH2Path(absolute, tempDir));
    }
}
