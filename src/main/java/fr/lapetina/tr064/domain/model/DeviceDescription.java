package fr.lapetina.tr064.domain.model;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One parsed descriptor document (e.g. tr64desc.xml or igddesc.xml).
 */
public record DeviceDescription(
        String specVersion,
        SystemVersion systemVersion,
        Device device
) {
    public DeviceDescription {
        Objects.requireNonNull(device, "Root device is required");
        if (systemVersion == null) {
            systemVersion = SystemVersion.UNKNOWN;
        }
    }

    public String modelName() {
        return device.modelName();
    }

    public DeviceDescription mapServices(UnaryOperator<Service> mapper) {
        return new DeviceDescription(specVersion, systemVersion, device.mapServices(mapper));
    }
}
