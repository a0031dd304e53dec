package com.nayem.courier.exception;

/**
 * A handler or middleware instance could not be created or resolved.
 */
public class ConstructionException extends CourierException {

    private final Class<?> instanceType;

    public ConstructionException(Class<?> instanceType, String reason) {
        super("Cannot create " + instanceType.getName() + ": " + reason);
        this.instanceType = instanceType;
    }

    public ConstructionException(Class<?> instanceType, Throwable cause) {
        super("Cannot create " + instanceType.getName() + ": " + cause.getMessage(), cause);
        this.instanceType = instanceType;
    }

    public Class<?> getInstanceType() {
        return instanceType;
    }
}
