package com.guildsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Reads {@link ProtectionConfig} from YAML.
 *
 * <p>
 * {@link #load()} prefers the file named by {@value #ENV_CONFIG_PATH} and
 * falls back to the bundled {@value #DEFAULT_RESOURCE}. Every entry point
 * goes through the same pipeline: strict parse (duplicate keys rejected),
 * empty document replaced by defaults, then {@link ProtectionConfig#validate()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable naming a YAML file that replaces the bundled one. */
    public static final String ENV_CONFIG_PATH = "PROTECTION_CONFIG_PATH";

    /** Bundled configuration on the classpath. */
    public static final String DEFAULT_RESOURCE = "protection.yml";

    private ConfigLoader() {
    }

    /**
     * Resolve and load the active configuration.
     *
     * @throws IllegalStateException if the document is malformed or invalid
     */
    public static ProtectionConfig load() {
        return load(System::getenv);
    }

    static ProtectionConfig load(UnaryOperator<String> env) {
        String override = env.apply(ENV_CONFIG_PATH);
        if (override != null && !override.isBlank()) {
            Path path = Path.of(override.trim());
            if (Files.isRegularFile(path)) {
                return fromFile(path);
            }
            LOG.warn("{}={} is not a readable file, falling back to {}", ENV_CONFIG_PATH, path, DEFAULT_RESOURCE);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static ProtectionConfig fromFile(String path) {
        return fromFile(Path.of(Objects.requireNonNull(path, "Config file path must not be null")));
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if it cannot be read, parsed or validated
     */
    public static ProtectionConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if it cannot be read, parsed or validated
     */
    public static ProtectionConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream stream = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return read(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Load a document held in memory.
     *
     * @param yaml   document text
     * @param source label used in logs and error messages
     */
    public static ProtectionConfig fromString(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        return read(new StringReader(yaml), source);
    }

    private static ProtectionConfig read(Reader reader, String source) {
        ProtectionConfig config = parse(reader, source);
        if (config == null) {
            LOG.warn("{} holds no document, using built-in defaults", source);
            config = new ProtectionConfig();
        }
        config.validate();
        if (config.getRules().isEmpty()) {
            LOG.warn("{} defines no moderation rules; every message will pass", source);
        }
        LOG.info("Loaded {} rule(s) and {} guild override(s) from {}",
                config.getRules().size(), config.getGuilds().size(), source);
        return config;
    }

    /**
     * @return parsed document, or {@code null} when it is empty
     */
    private static ProtectionConfig parse(Reader reader, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ProtectionConfig.class, options));
        try {
            return yaml.load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed protection config in " + source + ": " + e.getMessage(), e);
        }
    }
}
