package de.bsommerfeld.tscache.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.tscache.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link GlobalConfig} from a TOML file. A missing file is written out
 * with the defaults so operators have something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_FILE = "config.toml";

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /** Loads {@code config.toml} from the application data directory. */
    public static GlobalConfig loadDefault() {
        return load(StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve(CONFIG_FILE));
    }

    public static GlobalConfig load(Path configPath) {
        try {
            if (!Files.exists(configPath)) {
                GlobalConfig defaults = new GlobalConfig();
                Path parent = configPath.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                MAPPER.writeValue(configPath.toFile(), defaults);
                LOG.info("Created default configuration at {}", configPath.toAbsolutePath());
                return defaults;
            }

            LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
            GlobalConfig config = MAPPER.readValue(configPath.toFile(), GlobalConfig.class);
            validate(config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + configPath, e);
        }
    }

    static void validate(GlobalConfig config) {
        int window = config.getMigration().getWindowSeconds();
        if (window < MigrationConfig.MIN_WINDOW_SECONDS || window > MigrationConfig.MAX_WINDOW_SECONDS) {
            throw new IllegalArgumentException("migration.window-seconds must be within "
                    + MigrationConfig.MIN_WINDOW_SECONDS + ".." + MigrationConfig.MAX_WINDOW_SECONDS
                    + " but was " + window);
        }
        if (config.getRetrieval().getCooldownMinutes() < 0) {
            throw new IllegalArgumentException("retrieval.cooldown-minutes must not be negative");
        }
        if (config.getRetrieval().getMaxRateLimitRetries() < 0) {
            throw new IllegalArgumentException("retrieval.max-rate-limit-retries must not be negative");
        }
    }

    /** Resolves the database file, falling back to {@code <appData>/tscache.db}. */
    public static Path resolveDatabasePath(GlobalConfig config) {
        String path = config.getDatabase().getPath();
        if (path == null || path.isBlank()) {
            return StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve("tscache.db");
        }
        return Path.of(path);
    }

    /** Resolves the context definition directory, falling back to {@code <appData>/contexts}. */
    public static Path resolveDefinitionsDir(GlobalConfig config) {
        String dir = config.getAggregation().getDefinitionsDir();
        if (dir == null || dir.isBlank()) {
            return StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve("contexts");
        }
        return Path.of(dir);
    }
}
