package com.nayem.courier.registry;

import com.nayem.courier.pipeline.InvocationContext;

/**
 * Calls a handler for one message.
 * <p>
 * For asynchronous handlers the returned object is a {@link java.util.concurrent.CompletionStage}
 * that completes with the handler's result.
 * </p>
 */
@FunctionalInterface
public interface HandlerInvoker {

    Object invoke(Object handler, Object message, InvocationContext context) throws Exception;
}
