package com.nayem.courier.exception;

/**
 * A synchronous dispatch reached a handler or middleware phase that is asynchronous.
 */
public class SyncPipelineViolationException extends CourierException {

    public SyncPipelineViolationException(String message) {
        super(message);
    }
}
