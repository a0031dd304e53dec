package com.nayem.courier.registry;

import java.util.Objects;

/**
 * One phase of a middleware. An asynchronous phase returns a {@link java.util.concurrent.CompletionStage}.
 */
public record MiddlewarePhase<I>(I invoker, boolean async) {

    public MiddlewarePhase {
        Objects.requireNonNull(invoker, "invoker");
    }

    public static <I> MiddlewarePhase<I> sync(I invoker) {
        return new MiddlewarePhase<>(invoker, false);
    }

    public static <I> MiddlewarePhase<I> async(I invoker) {
        return new MiddlewarePhase<>(invoker, true);
    }
}
