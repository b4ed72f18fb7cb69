package fr.lapetina.tr064.infrastructure.config;

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
import java.util.Map;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system or classpath
 * - Environment overrides for credentials and cache settings
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_USERNAME = "FRITZ_USERNAME";
    public static final String ENV_PASSWORD = "FRITZ_PASSWORD";
    public static final String ENV_USE_CACHE = "FRITZ_USECACHE";
    public static final String ENV_CACHE_DIRECTORY = "FRITZ_CACHEDIRECTORY";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(RouterConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath and applies the process environment.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public RouterConfig load() {
        RouterConfig config = loadFromPath();
        applyEnvironment(config, System.getenv());
        return config;
    }

    private RouterConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
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

    private RouterConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream. The environment is not applied.
     */
    public RouterConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private RouterConfig parse(InputStream inputStream, String origin) {
        try {
            RouterConfig config = yaml.load(inputStream);
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    /**
     * Overrides credentials and cache settings from the given environment.
     * Values that are absent or blank leave the configuration untouched.
     */
    public static RouterConfig applyEnvironment(RouterConfig config, Map<String, String> environment) {
        String user = environment.get(ENV_USERNAME);
        if (user != null && !user.isBlank()) {
            config.getRouter().setUser(user);
        }

        String password = environment.get(ENV_PASSWORD);
        if (password != null && !password.isBlank()) {
            config.getRouter().setPassword(password);
        }

        Boolean useCache = BooleanValues.parseOrDefault(environment.get(ENV_USE_CACHE), null);
        if (useCache != null) {
            config.getCache().setEnabled(useCache);
        }

        String cacheDirectory = environment.get(ENV_CACHE_DIRECTORY);
        if (cacheDirectory != null && !cacheDirectory.isBlank()) {
            config.getCache().setDirectory(cacheDirectory);
        }
        return config;
    }

    /**
     * Creates a default configuration.
     */
    public static RouterConfig createDefault() {
        return new RouterConfig();
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
