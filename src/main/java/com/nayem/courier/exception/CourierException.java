package com.nayem.courier.exception;

/**
 * Base class for failures raised by Courier itself, as opposed to failures thrown by handler code.
 */
public class CourierException extends RuntimeException {

    public CourierException(String message) {
        super(message);
    }

    public CourierException(String message, Throwable cause) {
        super(message, cause);
    }
}
