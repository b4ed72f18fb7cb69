package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.model.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the discovered services, keyed by service name.
 *
 * Built once per discovery pass and never modified afterwards, so it can be
 * shared between threads. A later service with an already known name
 * replaces the earlier one.
 */
public final class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<String, Service> services;

    private ServiceRegistry(Map<String, Service> services) {
        this.services = Collections.unmodifiableMap(services);
    }

    /**
     * Builds a registry from services in discovery order.
     */
    public static ServiceRegistry of(Collection<Service> discovered) {
        Map<String, Service> byName = new LinkedHashMap<>();
        for (Service service : discovered) {
            Service previous = byName.put(service.name(), service);
            if (previous != null) {
                log.info("Service replaced by later descriptor: name={}, previousType={}, type={}",
                        service.name(), previous.serviceType(), service.serviceType());
            }
        }
        return new ServiceRegistry(byName);
    }

    /**
     * Gets a service by name.
     */
    public Optional<Service> getService(String name) {
        return Optional.ofNullable(services.get(name));
    }

    public boolean contains(String name) {
        return services.containsKey(name);
    }

    /**
     * Gets all registered services in discovery order.
     */
    public List<Service> getAllServices() {
        return new ArrayList<>(services.values());
    }

    public Set<String> getServiceNames() {
        return services.keySet();
    }

    /**
     * Gets the number of registered services.
     */
    public int size() {
        return services.size();
    }
}
