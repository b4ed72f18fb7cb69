package fr.lapetina.tr064.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fr.lapetina.tr064.domain.error.RouterException;
import fr.lapetina.tr064.domain.model.DeviceDescription;
import fr.lapetina.tr064.infrastructure.discovery.BoxInfo;
import fr.lapetina.tr064.infrastructure.discovery.DocumentFetcher;
import fr.lapetina.tr064.infrastructure.discovery.RouterSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Local JSON cache of a discovered schema, one file per router address.
 *
 * A cached schema is only trusted after {@link #verify} has matched it against the
 * router's box info document, unless verification is switched off by the caller.
 */
public final class SchemaCache {

    private static final Logger log = LoggerFactory.getLogger(SchemaCache.class);

    static final String FILE_SUFFIX = "_cache.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public SchemaCache(Path directory, String address) {
        this.file = directory.resolve(fileName(address));
        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Default cache directory: {@code ~/.tr064}.
     */
    public static Path defaultDirectory() {
        return Paths.get(System.getProperty("user.home"), ".tr064");
    }

    /**
     * File name for an address, e.g. {@code 192_168_178_1_cache.json}.
     */
    public static String fileName(String address) {
        String host = address == null ? "" : address.trim();
        int schemeEnd = host.indexOf("://");
        if (schemeEnd >= 0) {
            host = host.substring(schemeEnd + 3);
        }
        return host.replaceAll("[^A-Za-z0-9-]", "_") + FILE_SUFFIX;
    }

    /**
     * Loads the cached schema. Returns empty when there is no cache file or it cannot be read.
     */
    public Optional<RouterSchema> load() {
        if (!Files.isRegularFile(file)) {
            log.debug("No schema cache: file={}", file);
            return Optional.empty();
        }
        try {
            CachedSchema cached = objectMapper.readValue(file.toFile(), CachedSchema.class);
            if (cached.descriptions() == null || cached.descriptions().isEmpty()) {
                log.warn("Schema cache is empty, ignoring: file={}", file);
                return Optional.empty();
            }
            log.info("Schema loaded from cache: file={}, model={}", file, cached.modelName());
            return Optional.of(RouterSchema.of(cached.descriptions()));
        } catch (IOException | RuntimeException e) {
            log.warn("Schema cache unreadable, ignoring: file={}, error={}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the schema, creating the cache directory when needed.
     *
     * @throws CacheException if the file cannot be written
     */
    public void save(RouterSchema schema) {
        CachedSchema cached = new CachedSchema(schema.modelName(), schema.systemDisplay(), schema.descriptions());
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), cached);
            log.info("Schema cache written: file={}, services={}", file, schema.registry().size());
        } catch (IOException e) {
            throw new CacheException("Failed to write schema cache: " + file, e);
        }
    }

    /**
     * Checks that a cached schema belongs to the router, comparing the model name and
     * firmware display version with the box info document.
     * Any failure to read the box info counts as a mismatch.
     *
     * @param webFetcher fetcher bound to the router's web interface
     */
    public boolean verify(RouterSchema schema, DocumentFetcher webFetcher) {
        try {
            Map<String, String> boxInfo = BoxInfo.read(webFetcher);
            String name = boxInfo.get("Name");
            String version = boxInfo.get("Version");

            boolean matches = Objects.equals(name, schema.modelName())
                    && Objects.equals(version, schema.systemDisplay());
            if (!matches) {
                log.info("Schema cache outdated: cachedModel={}, cachedVersion={}, model={}, version={}",
                        schema.modelName(), schema.systemDisplay(), name, version);
            }
            return matches;
        } catch (RouterException e) {
            log.warn("Schema cache verification failed: error={}", e.getMessage());
            return false;
        }
    }

    public Path getFile() {
        return file;
    }

    /**
     * On-disk form of a schema.
     */
    public record CachedSchema(
            String modelName,
            String systemDisplay,
            List<DeviceDescription> descriptions
    ) {
    }

    /**
     * Exception for cache write failures.
     */
    public static class CacheException extends RuntimeException {
        public CacheException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
