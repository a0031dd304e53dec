package com.nayem.courier.core;

import com.nayem.courier.registry.HandlerRegistration;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A view of a {@link CourierEngine} bound to one scope. Cascaded publications inherit the scope.
 */
final class ScopedMediator implements Mediator {

    private final CourierEngine engine;
    private final ScopeContext scope;

    ScopedMediator(CourierEngine engine, ScopeContext scope) {
        this.engine = engine;
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    @Override
    public <R> R invoke(Object message, Class<R> responseType, CancellationToken cancellationToken) {
        return engine.invoke(message, responseType, scope, cancellationToken);
    }

    @Override
    public <R> CompletableFuture<R> invokeAsync(Object message, Class<R> responseType,
            CancellationToken cancellationToken) {
        return engine.invokeAsync(message, responseType, scope, cancellationToken);
    }

    @Override
    public CompletableFuture<Void> publishAsync(Object message, PublishStrategy strategy,
            CancellationToken cancellationToken) {
        return engine.publishAsync(message, strategy, scope, cancellationToken);
    }

    @Override
    public CompletableFuture<Void> publishAsync(Object message, CancellationToken cancellationToken) {
        return engine.publishAsync(message, engine.defaultPublishStrategy(), scope, cancellationToken);
    }

    @Override
    public void publish(Object message, CancellationToken cancellationToken) {
        engine.publish(message, scope, cancellationToken);
    }

    @Override
    public ScopeContext scope() {
        return scope;
    }

    @Override
    public Mediator withScope(ScopeContext scope) {
        return engine.withScope(scope);
    }

    @Override
    public List<HandlerRegistration> registrations() {
        return engine.registrations();
    }

    @Override
    public String toString() {
        return "ScopedMediator[" + scope.id() + "]";
    }
}
