package de.bsommerfeld.quizbank.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link QuizbankConfig} from a TOML file. A missing file is created
 * with default values so the user has something to edit on the next start.
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String HEADER = "# Quizbank - Global Configuration\n";

    private final Path path;
    private final TomlMapper mapper;

    private ConfigurationLoader(Path path) {
        this.path = path;
        this.mapper = TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public static ConfigurationLoader from(Path path) {
        return new ConfigurationLoader(path);
    }

    /**
     * Loads the configuration, writing defaults first if the file is absent.
     *
     * @throws UncheckedIOException if the file cannot be read, parsed or
     *                              written
     */
    public QuizbankConfig load() {
        try {
            if (!Files.exists(path)) {
                QuizbankConfig defaults = new QuizbankConfig();
                save(defaults);
                LOG.info("Created default configuration at {}", path.toAbsolutePath());
                return defaults;
            }
            QuizbankConfig config = mapper.readValue(path.toFile(), QuizbankConfig.class);
            return config == null ? new QuizbankConfig() : config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + path, e);
        }
    }

    /**
     * Writes {@code config} to the file, creating parent directories as needed.
     */
    public void save(QuizbankConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        String toml = mapper.writeValueAsString(config);
        Files.writeString(path, HEADER + toml, StandardCharsets.UTF_8);
    }
}
