package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.model.DeviceDescription;
import fr.lapetina.tr064.domain.model.Service;
import fr.lapetina.tr064.domain.model.SystemVersion;

import java.util.List;

/**
 * Result of one discovery pass: the parsed descriptor documents, primary first,
 * and the registry of their services.
 */
public record RouterSchema(
        List<DeviceDescription> descriptions,
        ServiceRegistry registry
) {
    public RouterSchema {
        descriptions = List.copyOf(descriptions);
        if (descriptions.isEmpty()) {
            throw new IllegalArgumentException("At least one device description is required");
        }
    }

    /**
     * Builds the schema and its registry from descriptions whose services are already loaded.
     */
    public static RouterSchema of(List<DeviceDescription> descriptions) {
        return new RouterSchema(descriptions, ServiceRegistry.of(
                descriptions.stream()
                        .flatMap(description -> description.device().allServices().stream())
                        .toList()));
    }

    public DeviceDescription primary() {
        return descriptions.get(0);
    }

    /**
     * Model name of the root device of the primary descriptor.
     */
    public String modelName() {
        return primary().modelName();
    }

    /**
     * Firmware version as "minor.patch", or null when not reported.
     */
    public String systemVersion() {
        return primary().systemVersion().version();
    }

    public String systemDisplay() {
        SystemVersion version = primary().systemVersion();
        return version.display();
    }

    public List<Service> services() {
        return registry.getAllServices();
    }
}
