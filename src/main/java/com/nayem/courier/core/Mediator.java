package com.nayem.courier.core;

import com.nayem.courier.registry.HandlerRegistration;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for dispatching messages to their handlers.
 * <p>
 * {@code invoke} sends a message to exactly one handler and returns its response.
 * {@code publish} fans a message out to every applicable handler, which may be none.
 * Every call runs in this mediator's {@link #scope()}; use {@link #withScope(ScopeContext)} for another.
 * </p>
 */
public interface Mediator {

    // --- invoke ---

    /**
     * Sends {@code message} to its single handler on the calling thread.
     *
     * @throws com.nayem.courier.exception.HandlerNotFoundException if no handler is registered
     * @throws com.nayem.courier.exception.AmbiguousHandlerException if more than one handler is registered
     * @throws com.nayem.courier.exception.SyncPipelineViolationException if the handler or its middleware is asynchronous
     */
    <R> R invoke(Object message, Class<R> responseType, CancellationToken cancellationToken);

    default <R> R invoke(Object message, Class<R> responseType) {
        return invoke(message, responseType, CancellationToken.NONE);
    }

    default void invoke(Object message, CancellationToken cancellationToken) {
        invoke(message, Void.class, cancellationToken);
    }

    default void invoke(Object message) {
        invoke(message, Void.class, CancellationToken.NONE);
    }

    /**
     * Sends {@code message} to its single handler. Lookup failures are reported through the returned future.
     */
    <R> CompletableFuture<R> invokeAsync(Object message, Class<R> responseType, CancellationToken cancellationToken);

    default <R> CompletableFuture<R> invokeAsync(Object message, Class<R> responseType) {
        return invokeAsync(message, responseType, CancellationToken.NONE);
    }

    default CompletableFuture<Void> invokeAsync(Object message, CancellationToken cancellationToken) {
        return invokeAsync(message, Void.class, cancellationToken);
    }

    default CompletableFuture<Void> invokeAsync(Object message) {
        return invokeAsync(message, Void.class, CancellationToken.NONE);
    }

    // --- publish ---

    /**
     * Delivers {@code message} to every applicable handler. Completes once all of them have completed.
     * A single failure fails the future with that exception; several fail it with an
     * {@link com.nayem.courier.exception.AggregatedHandlerException}.
     */
    CompletableFuture<Void> publishAsync(Object message, PublishStrategy strategy, CancellationToken cancellationToken);

    CompletableFuture<Void> publishAsync(Object message, CancellationToken cancellationToken);

    default CompletableFuture<Void> publishAsync(Object message) {
        return publishAsync(message, CancellationToken.NONE);
    }

    default CompletableFuture<Void> publishAsync(Object message, PublishStrategy strategy) {
        return publishAsync(message, strategy, CancellationToken.NONE);
    }

    /**
     * Delivers {@code message} to every applicable handler, one after another, on the calling thread.
     *
     * @throws com.nayem.courier.exception.SyncPipelineViolationException if any participant is asynchronous;
     *                                                                     no handler runs in that case
     */
    void publish(Object message, CancellationToken cancellationToken);

    default void publish(Object message) {
        publish(message, CancellationToken.NONE);
    }

    // --- scope and introspection ---

    ScopeContext scope();

    /**
     * A mediator that runs every call, including cascaded publications, in {@code scope}.
     */
    Mediator withScope(ScopeContext scope);

    List<HandlerRegistration> registrations();
}
