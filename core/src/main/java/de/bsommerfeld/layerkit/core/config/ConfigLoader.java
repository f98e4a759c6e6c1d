package de.bsommerfeld.layerkit.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link GlobalConfig} as TOML. A missing file is created
 * with the defaults so users have something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    public static GlobalConfig load(Path path) throws IOException {
        if (Files.exists(path)) {
            LOG.info("Loading configuration from: {}", path.toAbsolutePath());
            return MAPPER.readValue(path.toFile(), GlobalConfig.class);
        }

        GlobalConfig defaults = new GlobalConfig();
        save(defaults, path);
        LOG.info("No configuration found, wrote defaults to: {}", path.toAbsolutePath());
        return defaults;
    }

    public static void save(GlobalConfig config, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
    }
}
