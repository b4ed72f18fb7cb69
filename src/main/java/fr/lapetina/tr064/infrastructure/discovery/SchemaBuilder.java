package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.error.MalformedDescriptorException;
import fr.lapetina.tr064.domain.error.ResourceUnavailableException;
import fr.lapetina.tr064.domain.error.RouterConnectionException;
import fr.lapetina.tr064.domain.error.RouterException;
import fr.lapetina.tr064.domain.model.DeviceDescription;
import fr.lapetina.tr064.domain.model.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Discovers the router's services.
 *
 * Loads the primary descriptor (mandatory), the secondary descriptors when
 * authenticated (optional), then every service's action schema. A service
 * whose schema cannot be loaded is kept with empty tables.
 */
public final class SchemaBuilder {

    private static final Logger log = LoggerFactory.getLogger(SchemaBuilder.class);

    public static final String DEFAULT_PRIMARY_DESCRIPTOR = "tr64desc.xml";
    public static final List<String> DEFAULT_SECONDARY_DESCRIPTORS = List.of("igddesc.xml");

    private final DocumentFetcher fetcher;
    private final String primaryDescriptor;
    private final List<String> secondaryDescriptors;
    private final DescriptionParser descriptionParser = new DescriptionParser();
    private final ScpdParser scpdParser = new ScpdParser();

    public SchemaBuilder(DocumentFetcher fetcher, String primaryDescriptor, List<String> secondaryDescriptors) {
        this.fetcher = fetcher;
        this.primaryDescriptor = primaryDescriptor;
        this.secondaryDescriptors = secondaryDescriptors != null ? List.copyOf(secondaryDescriptors) : List.of();
    }

    public SchemaBuilder(DocumentFetcher fetcher) {
        this(fetcher, DEFAULT_PRIMARY_DESCRIPTOR, DEFAULT_SECONDARY_DESCRIPTORS);
    }

    /**
     * Runs a full discovery pass.
     *
     * @param authenticated whether a password is configured; secondary descriptors are only read then
     * @return a new schema, never merged with an earlier one
     * @throws RouterConnectionException if the primary descriptor cannot be loaded
     */
    public RouterSchema discover(boolean authenticated) {
        Instant startTime = Instant.now();
        List<DeviceDescription> descriptions = new ArrayList<>();
        descriptions.add(loadPrimary());

        if (authenticated) {
            for (String location : secondaryDescriptors) {
                try {
                    descriptions.add(descriptionParser.parse(fetcher.fetch(location)));
                } catch (RouterException e) {
                    log.warn("Skipping secondary descriptor: location={}, error={}", location, e.getMessage());
                }
            }
        }

        List<DeviceDescription> loaded = descriptions.stream()
                .map(description -> description.mapServices(this::loadSchema))
                .toList();

        RouterSchema schema = RouterSchema.of(loaded);
        log.info("Discovery completed: model={}, descriptions={}, services={}, latencyMs={}",
                schema.modelName(), loaded.size(), schema.registry().size(),
                Duration.between(startTime, Instant.now()).toMillis());
        return schema;
    }

    private DeviceDescription loadPrimary() {
        try {
            return descriptionParser.parse(fetcher.fetch(primaryDescriptor));
        } catch (ResourceUnavailableException e) {
            log.error("Primary descriptor not available: location={}", primaryDescriptor);
            throw new RouterConnectionException("Unable to access the device description '" + primaryDescriptor
                    + "'. Is 'access for applications' enabled on the router?", e);
        } catch (MalformedDescriptorException e) {
            log.error("Primary descriptor is malformed: location={}, error={}", primaryDescriptor, e.getMessage());
            throw new RouterConnectionException("Malformed device description '" + primaryDescriptor + "': "
                    + e.getMessage(), e);
        }
    }

    private Service loadSchema(Service service) {
        String location = service.scpdUrl();
        if (location == null || location.isEmpty()) {
            log.warn("Service without action schema: service={}", service.name());
            return service;
        }
        try {
            ServiceSchema schema = scpdParser.parse(fetcher.fetch(location));
            return service.withSchema(schema.actions(), schema.stateVariables());
        } catch (RouterException e) {
            log.warn("Action schema not loaded, service has no actions: service={}, location={}, error={}",
                    service.name(), location, e.getMessage());
            return service;
        }
    }
}
