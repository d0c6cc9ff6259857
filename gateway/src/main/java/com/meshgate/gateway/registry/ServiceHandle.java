package com.meshgate.gateway.registry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a successful registration.
 */
public record ServiceHandle(String name, String version, List<String> endpointIds, List<String> routes) {

    static ServiceHandle of(Service service) {
        return new ServiceHandle(
            service.getName(),
            service.getVersion(),
            service.getEndpoints().stream().map(Endpoint::getId).collect(Collectors.toList()),
            service.getRoutes()
        );
    }
}
