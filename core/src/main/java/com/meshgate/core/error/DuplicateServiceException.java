package com.meshgate.core.error;

public class DuplicateServiceException extends GatewayException {

    public DuplicateServiceException(String serviceName) {
        super(serviceName, "Service " + serviceName + " is already registered");
    }

    @Override
    public int getStatusCode() {
        return 409;
    }

    @Override
    public String getErrorLabel() {
        return "Conflict";
    }
}
