package com.meshgate.gateway.registry;

import com.meshgate.gateway.config.ServiceConfig;

import java.util.List;
import java.util.Optional;

/**
 * Registry of services known to this gateway instance.
 */
public interface IServiceRegistry {

    /**
     * @throws com.meshgate.core.error.DuplicateServiceException if the name is taken
     */
    ServiceHandle register(ServiceConfig config);

    /**
     * Removes the service; unknown names are ignored.
     *
     * @return whether a service was removed
     */
    boolean unregister(String name);

    /**
     * @throws com.meshgate.core.error.ServiceNotFoundException if the name is unknown
     */
    Service lookup(String name);

    Optional<Service> find(String name);

    /**
     * Longest route prefix match over all services; ties go to the earlier registration.
     *
     * @return the service name, or null when no route matches
     */
    String resolveByPath(String path);

    /**
     * All services in registration order.
     */
    List<Service> services();

    List<Service> findByTag(String tag);

    /**
     * Services matching both filters; a null filter matches everything.
     */
    List<Service> discover(String tag, String version);
}
