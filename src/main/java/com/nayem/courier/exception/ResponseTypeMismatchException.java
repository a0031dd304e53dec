package com.nayem.courier.exception;

/**
 * A handler's result contains nothing assignable to the response type the caller asked for.
 */
public class ResponseTypeMismatchException extends CourierException {

    private final Class<?> expectedType;

    public ResponseTypeMismatchException(Class<?> messageType, Class<?> expectedType, Object actual) {
        super(String.format("Handler for %s returned %s which does not provide a %s response",
                messageType.getName(), actual, expectedType.getName()));
        this.expectedType = expectedType;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }
}
