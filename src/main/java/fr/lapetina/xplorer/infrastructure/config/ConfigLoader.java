package fr.lapetina.xplorer.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads {@link XplorerConfig} from YAML.
 *
 * Supports:
 * - Loading from the file system, then from the classpath
 * - Validation of the loaded values
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(XplorerConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public XplorerConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private XplorerConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public XplorerConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private XplorerConfig parse(InputStream is, String source) {
        XplorerConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
        // An empty document yields the defaults
        if (config == null) {
            config = createDefault();
        }
        validate(config);
        return config;
    }

    static void validate(XplorerConfig config) {
        int ringBufferSize = config.getDispatch().getRingBufferSize();
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("dispatch.ringBufferSize must be a power of 2: " + ringBufferSize);
        }
        if (config.getDispatch().getTimeoutMs() < 0) {
            throw new ConfigurationException("dispatch.timeoutMs must not be negative");
        }
        checkPort("http.port", config.getHttp().getPort());
        checkPort("p2p.port", config.getP2p().getPort());
        if (config.getP2p().getStartupTimeoutMs() <= 0) {
            throw new ConfigurationException("p2p.startupTimeoutMs must be positive");
        }
    }

    private static void checkPort(String name, int port) {
        if (port < 0 || port > 65_535) {
            throw new ConfigurationException(name + " out of range: " + port);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static XplorerConfig createDefault() {
        return new XplorerConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
