package com.nayem.courier.exception;

import java.util.concurrent.CancellationException;

/**
 * The {@link com.nayem.courier.core.CancellationToken} of a dispatch fired before it completed.
 */
public class DispatchCancelledException extends CancellationException {

    public DispatchCancelledException() {
        super("Dispatch was cancelled");
    }
}
