package dev.badgersnacks.compendium.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.badgersnacks.compendium.variants.ExpansionWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Catalog database and worker settings.
 *
 * <p>Read from an optional JSON file with the properties {@code databaseUrl}, {@code databaseUser},
 * {@code databasePassword} and {@code parallelism}. Missing properties keep their defaults; a missing or malformed
 * file yields {@link #defaults()}. Relative H2 file paths in {@code databaseUrl} resolve against the directory of
 * the settings file.
 */
public record EngineSettings(String databaseUrl, String databaseUser, String databasePassword, int parallelism) {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineSettings.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String H2_FILE_PREFIX = "jdbc:h2:file:";

    public static EngineSettings defaults() {
        Path catalog = Path.of(System.getProperty("user.home"), ".compendium-variants", "catalog");
        return new EngineSettings(H2_FILE_PREFIX + catalog.toAbsolutePath(), "sa", "",
                ExpansionWorkerPool.defaultParallelism());
    }

    public static EngineSettings load(Path configFile) {
        EngineSettings defaults = defaults();
        if (configFile == null || !Files.isRegularFile(configFile)) {
            return defaults;
        }
        try {
            JsonNode node = MAPPER.readTree(configFile.toFile());
            if (node == null || !node.isObject()) {
                LOGGER.warn("Engine settings in {} are not a JSON object, using defaults", configFile);
                return defaults;
            }
            String url = textValue(node.get("databaseUrl"), defaults.databaseUrl());
            Path baseDir = configFile.toAbsolutePath().getParent();
            EngineSettings settings = new EngineSettings(
                    baseDir == null ? url : resolveH2Path(url, baseDir),
                    textValue(node.get("databaseUser"), defaults.databaseUser()),
                    textValue(node.get("databasePassword"), defaults.databasePassword()),
                    parallelismValue(node.get("parallelism"), defaults.parallelism(), configFile));
            LOGGER.info("Using catalog database {} from {}", settings.databaseUrl(), configFile);
            return settings;
        } catch (IOException e) {
            LOGGER.warn("Failed to load engine settings from {}", configFile, e);
            return defaults;
        }
    }

    static String resolveH2Path(String url, Path baseDir) {
        if (!url.startsWith(H2_FILE_PREFIX)) {
            return url;
        }
        String rest = url.substring(H2_FILE_PREFIX.length());
        int options = rest.indexOf(';');
        String location = options < 0 ? rest : rest.substring(0, options);
        String suffix = options < 0 ? "" : rest.substring(options);
        if (location.startsWith("~")) {
            return url;
        }
        Path candidate = Paths.get(location);
        if (candidate.isAbsolute()) {
            return url;
        }
        return H2_FILE_PREFIX + baseDir.resolve(candidate).toAbsolutePath().normalize() + suffix;
    }

    private static int parallelismValue(JsonNode node, int fallback, Path configFile) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.canConvertToInt() || node.asInt() < 1) {
            LOGGER.warn("Ignoring invalid parallelism {} in {}", node, configFile);
            return fallback;
        }
        return node.asInt();
    }

    private static String textValue(JsonNode node, String fallback) {
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : fallback;
    }
}
