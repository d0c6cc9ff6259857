package com.meshgate.core.error;

public class ServiceNotFoundException extends GatewayException {

    public ServiceNotFoundException(String serviceName) {
        super(serviceName, "Service " + serviceName + " not found");
    }

    /**
     * No registered route matched the request path.
     */
    public static ServiceNotFoundException forPath(String path) {
        return new ServiceNotFoundException(null, "No service registered for path " + path);
    }

    private ServiceNotFoundException(String serviceName, String message) {
        super(serviceName, message);
    }

    @Override
    public int getStatusCode() {
        return 404;
    }

    @Override
    public String getErrorLabel() {
        return "Not Found";
    }
}
