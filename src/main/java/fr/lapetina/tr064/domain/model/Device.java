package fr.lapetina.tr064.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A device node of a descriptor tree. Devices own services and sub-devices.
 */
public record Device(
        String deviceType,
        String friendlyName,
        String manufacturer,
        String manufacturerUrl,
        String modelDescription,
        String modelName,
        String modelNumber,
        String modelUrl,
        String udn,
        String presentationUrl,
        List<Service> services,
        List<Device> devices
) {
    public Device {
        services = services != null ? List.copyOf(services) : List.of();
        devices = devices != null ? List.copyOf(devices) : List.of();
    }

    /**
     * Returns the services of this device and of all nested sub-devices,
     * depth first, in document order.
     */
    public List<Service> allServices() {
        List<Service> result = new ArrayList<>(services);
        for (Device device : devices) {
            result.addAll(device.allServices());
        }
        return result;
    }

    /**
     * Returns a copy of this subtree with every service replaced by {@code mapper}'s result.
     */
    public Device mapServices(UnaryOperator<Service> mapper) {
        return new Device(deviceType, friendlyName, manufacturer, manufacturerUrl,
                modelDescription, modelName, modelNumber, modelUrl, udn, presentationUrl,
                services.stream().map(mapper).toList(),
                devices.stream().map(device -> device.mapServices(mapper)).toList());
    }
}
