package com.nayem.courier.exception;

import java.util.List;

/**
 * Two or more handlers failed while a message was published.
 * <p>
 * The exceptions are listed in handler start order and are also attached as suppressed
 * exceptions so that they show up in stack traces.
 * </p>
 */
public class AggregatedHandlerException extends CourierException {

    private final List<Throwable> exceptions;

    public AggregatedHandlerException(Class<?> messageType, List<Throwable> exceptions) {
        super(String.format("%d handlers failed while publishing %s", exceptions.size(), messageType.getName()));
        this.exceptions = List.copyOf(exceptions);
        for (Throwable exception : this.exceptions) {
            addSuppressed(exception);
        }
    }

    public List<Throwable> getExceptions() {
        return exceptions;
    }
}
