package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.error.ResourceUnavailableException;
import fr.lapetina.tr064.domain.error.RouterConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads documents from a local directory or, failing that, from the classpath.
 * Used for offline inspection of saved descriptors.
 */
public final class LocalDocumentFetcher implements DocumentFetcher {

    private static final Logger log = LoggerFactory.getLogger(LocalDocumentFetcher.class);

    private final Path directory;
    private final String classpathPrefix;

    /**
     * @param directory       directory to look in first, may be null
     * @param classpathPrefix classpath folder to look in next, e.g. "descriptors"
     */
    public LocalDocumentFetcher(Path directory, String classpathPrefix) {
        this.directory = directory;
        this.classpathPrefix = classpathPrefix == null ? "" : classpathPrefix;
    }

    public static LocalDocumentFetcher ofClasspath(String classpathPrefix) {
        return new LocalDocumentFetcher(null, classpathPrefix);
    }

    @Override
    public String fetch(String location) {
        String name = location.startsWith("/") ? location.substring(1) : location;

        if (directory != null) {
            Path file = directory.resolve(name);
            if (Files.isRegularFile(file)) {
                try {
                    return Files.readString(file, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new RouterConnectionException("Failed to read " + file, e);
                }
            }
        }

        String resource = classpathPrefix.isEmpty() ? name : classpathPrefix + "/" + name;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                log.debug("Document loaded from classpath: {}", resource);
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new RouterConnectionException("Failed to read classpath resource " + resource, e);
        }

        throw new ResourceUnavailableException("Document not found: " + location);
    }
}
