package com.nayem.courier.core;

import com.nayem.courier.exception.AggregatedHandlerException;
import com.nayem.courier.exception.AmbiguousHandlerException;
import com.nayem.courier.exception.DispatchCancelledException;
import com.nayem.courier.exception.HandlerExecutionException;
import com.nayem.courier.exception.HandlerNotFoundException;
import com.nayem.courier.instance.InstanceCache;
import com.nayem.courier.pipeline.BoundMiddleware;
import com.nayem.courier.pipeline.MiddlewarePipeline;
import com.nayem.courier.pipeline.PipelineState;
import com.nayem.courier.registry.HandlerDescriptor;
import com.nayem.courier.registry.HandlerRegistration;
import com.nayem.courier.registry.HandlerRegistry;
import com.nayem.courier.registry.MiddlewareDescriptor;
import com.nayem.courier.registry.MiddlewareRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;

/**
 * The {@link Mediator} implementation: looks up handlers, acquires instances, runs the
 * middleware pipeline and publishes cascaded messages.
 * <p>
 * An engine is immutable after {@link Builder#build()} and safe to share between threads.
 * Asynchronous work continues on whatever thread completes the handler's future. Only
 * {@link PublishStrategy#FIRE_AND_FORGET} hands work to the configured executor.
 * </p>
 */
public class CourierEngine implements Mediator {

    private static final Logger log = LoggerFactory.getLogger(CourierEngine.class);

    private final HandlerRegistry handlers;
    private final MiddlewareRegistry middleware;
    private final InstanceCache instances;
    private final CascadingMessageResolver resolver;
    private final DispatchMetrics metrics;
    private final PublishStrategy defaultStrategy;
    private final ScopeContext defaultScope;
    private final Executor executor;

    private CourierEngine(Builder builder) {
        this.handlers = builder.handlers;
        this.middleware = builder.middleware;
        this.instances = new InstanceCache(builder.serviceLocator);
        this.resolver = new CascadingMessageResolver();
        this.metrics = new DispatchMetrics(builder.registry);
        this.defaultStrategy = builder.publishStrategy;
        this.defaultScope = builder.defaultScope;
        this.executor = builder.executor;

        // Resolve every chain up front so that a dangling middleware reference fails at startup.
        for (HandlerRegistration registration : handlers.registrations()) {
            middleware.chainFor(registration.descriptor());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- invoke ---

    @Override
    public <R> R invoke(Object message, Class<R> responseType, CancellationToken cancellationToken) {
        return invoke(message, responseType, defaultScope, cancellationToken);
    }

    public <R> R invoke(Object message, Class<R> responseType, ScopeContext scope,
            CancellationToken cancellationToken) {
        Objects.requireNonNull(message, "message");
        HandlerDescriptor handler = resolveSingle(message.getClass());
        MiddlewarePipeline.requireSynchronous(handler, middleware.chainFor(handler));

        long start = metrics.startTime();
        boolean success = false;
        try {
            Object response = dispatch(handler, message, responseType, scope, cancellationToken);
            success = true;
            return cast(responseType, response);
        } finally {
            metrics.recordInvoke(message.getClass(), start, success);
        }
    }

    @Override
    public <R> CompletableFuture<R> invokeAsync(Object message, Class<R> responseType,
            CancellationToken cancellationToken) {
        return invokeAsync(message, responseType, defaultScope, cancellationToken);
    }

    public <R> CompletableFuture<R> invokeAsync(Object message, Class<R> responseType, ScopeContext scope,
            CancellationToken cancellationToken) {
        Objects.requireNonNull(message, "message");
        HandlerDescriptor handler;
        try {
            handler = resolveSingle(message.getClass());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        long start = metrics.startTime();
        return dispatchAsync(handler, message, responseType, scope, cancellationToken)
                .whenComplete((response, error) -> metrics.recordInvoke(message.getClass(), start, error == null))
                .thenApply(response -> cast(responseType, response));
    }

    // --- publish ---

    @Override
    public CompletableFuture<Void> publishAsync(Object message, CancellationToken cancellationToken) {
        return publishAsync(message, defaultStrategy, defaultScope, cancellationToken);
    }

    @Override
    public CompletableFuture<Void> publishAsync(Object message, PublishStrategy strategy,
            CancellationToken cancellationToken) {
        return publishAsync(message, strategy, defaultScope, cancellationToken);
    }

    public CompletableFuture<Void> publishAsync(Object message, PublishStrategy strategy, ScopeContext scope,
            CancellationToken cancellationToken) {
        Objects.requireNonNull(message, "message");
        Class<?> messageType = message.getClass();
        List<HandlerDescriptor> applicable = handlers.lookupApplicable(messageType);
        if (applicable.isEmpty()) {
            log.debug("No handlers for published message {}", messageType.getSimpleName());
            return CompletableFuture.completedFuture(null);
        }
        metrics.recordPublish();
        log.debug("Publishing {} to {} handler(s) ({})", messageType.getSimpleName(), applicable.size(), strategy);

        if (strategy == PublishStrategy.FIRE_AND_FORGET) {
            for (HandlerDescriptor handler : applicable) {
                fireAndForget(handler, message, scope);
            }
            return CompletableFuture.completedFuture(null);
        }

        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> completion;

        if (strategy == PublishStrategy.SEQUENTIAL) {
            completion = CompletableFuture.completedFuture(null);
            for (HandlerDescriptor handler : applicable) {
                completion = completion.thenCompose(ignored ->
                        captureFailure(dispatchAsync(handler, message, null, scope, cancellationToken), failures, handler));
            }
        } else {
            // Started in handler order; each slot records its own failure so that start order is kept.
            List<CompletableFuture<Throwable>> started = new ArrayList<>(applicable.size());
            for (HandlerDescriptor handler : applicable) {
                started.add(dispatchAsync(handler, message, null, scope, cancellationToken)
                        .handle((ignored, error) -> error == null ? null : unwrap(error)));
            }
            completion = CompletableFuture.allOf(started.toArray(new CompletableFuture<?>[0]))
                    .thenAccept(ignored -> {
                        for (int i = 0; i < started.size(); i++) {
                            Throwable failure = started.get(i).join();
                            if (failure != null) {
                                logPublishFailure(applicable.get(i), failure);
                                failures.add(failure);
                            }
                        }
                    });
        }

        return completion.thenCompose(ignored -> {
            RuntimeException aggregated = aggregate(messageType, failures, cancellationToken);
            return aggregated == null
                    ? CompletableFuture.<Void>completedFuture(null)
                    : CompletableFuture.<Void>failedFuture(aggregated);
        });
    }

    @Override
    public void publish(Object message, CancellationToken cancellationToken) {
        publish(message, defaultScope, cancellationToken);
    }

    public void publish(Object message, ScopeContext scope, CancellationToken cancellationToken) {
        Objects.requireNonNull(message, "message");
        Class<?> messageType = message.getClass();
        List<HandlerDescriptor> applicable = handlers.lookupApplicable(messageType);
        if (applicable.isEmpty()) {
            log.debug("No handlers for published message {}", messageType.getSimpleName());
            return;
        }
        for (HandlerDescriptor handler : applicable) {
            MiddlewarePipeline.requireSynchronous(handler, middleware.chainFor(handler));
        }
        metrics.recordPublish();

        List<Throwable> failures = new ArrayList<>();
        for (HandlerDescriptor handler : applicable) {
            try {
                dispatch(handler, message, null, scope, cancellationToken);
            } catch (RuntimeException | Error e) {
                Throwable failure = e instanceof HandlerExecutionException && e.getCause() != null ? e.getCause() : e;
                logPublishFailure(handler, failure);
                failures.add(failure);
            }
        }

        RuntimeException aggregated = aggregate(messageType, failures, cancellationToken);
        if (aggregated != null) {
            throw aggregated;
        }
    }

    // --- scope and introspection ---

    @Override
    public ScopeContext scope() {
        return defaultScope;
    }

    @Override
    public Mediator withScope(ScopeContext scope) {
        Objects.requireNonNull(scope, "scope");
        return scope.equals(defaultScope) ? this : new ScopedMediator(this, scope);
    }

    @Override
    public List<HandlerRegistration> registrations() {
        return handlers.registrations();
    }

    public HandlerRegistry handlerRegistry() {
        return handlers;
    }

    public MiddlewareRegistry middlewareRegistry() {
        return middleware;
    }

    public PublishStrategy defaultPublishStrategy() {
        return defaultStrategy;
    }

    // --- dispatch of one handler ---

    private Object dispatch(HandlerDescriptor handler, Object message, Class<?> expected, ScopeContext scope,
            CancellationToken cancellationToken) {
        Class<?> messageType = message.getClass();
        PipelineState state = newState(handler, message, scope, cancellationToken);
        log.debug("Processing message {} with {}", messageType.getSimpleName(), handler.name());

        Object result;
        try {
            result = MiddlewarePipeline.run(state);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerExecutionException(messageType, e);
        }

        CascadingMessageResolver.Resolution resolution = complete(handler, state, result, expected);
        for (Object cascaded : resolution.cascades()) {
            publish(cascaded, scope, cancellationToken);
        }
        return resolution.response();
    }

    private CompletableFuture<Object> dispatchAsync(HandlerDescriptor handler, Object message, Class<?> expected,
            ScopeContext scope, CancellationToken cancellationToken) {
        Class<?> messageType = message.getClass();
        PipelineState state;
        try {
            state = newState(handler, message, scope, cancellationToken);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Processing message {} with {}", messageType.getSimpleName(), handler.name());

        return MiddlewarePipeline.runAsync(state).thenCompose(result -> {
            CascadingMessageResolver.Resolution resolution = complete(handler, state, result, expected);
            CompletableFuture<Void> cascades = CompletableFuture.completedFuture(null);
            for (Object cascaded : resolution.cascades()) {
                cascades = cascades.thenCompose(ignored ->
                        publishAsync(cascaded, cascadeStrategy(), scope, cancellationToken));
            }
            return cascades.thenApply(ignored -> resolution.response());
        });
    }

    // Cascades finish before the originating call completes, so they are never detached.
    private PublishStrategy cascadeStrategy() {
        return defaultStrategy == PublishStrategy.FIRE_AND_FORGET ? PublishStrategy.PARALLEL : defaultStrategy;
    }

    private void fireAndForget(HandlerDescriptor handler, Object message, ScopeContext scope) {
        CompletableFuture
                .supplyAsync(() -> dispatchAsync(handler, message, null, scope, CancellationToken.NONE), executor)
                .thenCompose(Function.identity())
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        metrics.recordPublishFailures(1);
                        logPublishFailure(handler, unwrap(error));
                    }
                });
    }

    private CascadingMessageResolver.Resolution complete(HandlerDescriptor handler, PipelineState state,
            Object result, Class<?> expected) {
        Class<?> messageType = state.message().getClass();
        if (state.isShortCircuited()) {
            metrics.recordShortCircuit();
            log.debug("Message {} was short-circuited by middleware", messageType.getSimpleName());
        } else {
            log.debug("Completed message {} with {}", messageType.getSimpleName(), handler.name());
        }
        CascadingMessageResolver.Resolution resolution = resolver.resolve(messageType, result, expected,
                handler.isCascading(), state.isShortCircuited());
        if (resolution.hasCascades()) {
            log.debug("Cascading {} message(s) from {}", resolution.cascades().size(), handler.name());
        }
        return resolution;
    }

    private PipelineState newState(HandlerDescriptor handler, Object message, ScopeContext scope,
            CancellationToken cancellationToken) {
        List<MiddlewareDescriptor> chain = middleware.chainFor(handler);
        List<BoundMiddleware> bound = new ArrayList<>(chain.size());
        for (MiddlewareDescriptor descriptor : chain) {
            bound.add(new BoundMiddleware(descriptor, instances.acquire(descriptor, scope)));
        }
        return new PipelineState(message, handler, bound, cancellationToken, scope, () -> withScope(scope),
                instances.locator(), () -> instances.acquire(handler, scope));
    }

    private HandlerDescriptor resolveSingle(Class<?> messageType) {
        List<HandlerDescriptor> found = handlers.lookup(messageType);
        if (found.isEmpty()) {
            throw new HandlerNotFoundException(messageType);
        }
        if (found.size() > 1) {
            throw new AmbiguousHandlerException(messageType, found.stream().map(HandlerDescriptor::name).toList());
        }
        return found.get(0);
    }

    private RuntimeException aggregate(Class<?> messageType, List<Throwable> failures,
            CancellationToken cancellationToken) {
        if (failures.isEmpty()) {
            return null;
        }
        metrics.recordPublishFailures(failures.size());
        if (cancellationToken != null && cancellationToken.isCancellationRequested()) {
            DispatchCancelledException cancelled = firstCancellation(failures);
            if (cancelled != null) {
                for (Throwable failure : failures) {
                    if (failure != cancelled) {
                        cancelled.addSuppressed(failure);
                    }
                }
                return cancelled;
            }
        }
        if (failures.size() == 1) {
            Throwable only = failures.get(0);
            if (only instanceof RuntimeException runtime) {
                return runtime;
            }
            if (only instanceof Error error) {
                throw error;
            }
            return new HandlerExecutionException(messageType, only);
        }
        return new AggregatedHandlerException(messageType, failures);
    }

    private static DispatchCancelledException firstCancellation(List<Throwable> failures) {
        for (Throwable failure : failures) {
            if (failure instanceof DispatchCancelledException cancelled) {
                return cancelled;
            }
        }
        return null;
    }

    private CompletableFuture<Void> captureFailure(CompletableFuture<Object> future, List<Throwable> failures,
            HandlerDescriptor handler) {
        return future.handle((ignored, error) -> {
            if (error != null) {
                Throwable failure = unwrap(error);
                logPublishFailure(handler, failure);
                failures.add(failure);
            }
            return null;
        });
    }

    private static void logPublishFailure(HandlerDescriptor handler, Throwable failure) {
        log.warn("Handler {} failed while handling {}: {}", handler.name(),
                handler.messageType().getSimpleName(), failure.toString());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    private static <R> R cast(Class<R> responseType, Object response) {
        if (responseType == null || responseType == Void.class) {
            return null;
        }
        return (R) response;
    }

    /**
     * Builder for creating a {@link CourierEngine} instance.
     * <p>
     * Only the handler registry is required. Without a service locator, container-managed
     * lifetimes and constructor parameters cannot be resolved.
     * </p>
     */
    public static class Builder {
        private HandlerRegistry handlers = HandlerRegistry.empty();
        private MiddlewareRegistry middleware = MiddlewareRegistry.empty();
        private ServiceLocator serviceLocator = ServiceLocator.NONE;
        private MeterRegistry registry;
        private PublishStrategy publishStrategy = PublishStrategy.PARALLEL;
        private ScopeContext defaultScope = ScopeContext.ROOT;
        private Executor executor = ForkJoinPool.commonPool();

        private Builder() {
        }

        /**
         * Sets the handlers this engine dispatches to.
         *
         * @param handlers the immutable handler registry
         * @return this builder
         */
        public Builder handlers(HandlerRegistry handlers) {
            this.handlers = Objects.requireNonNull(handlers, "handlers");
            return this;
        }

        /**
         * Sets the middleware that wraps handler invocations.
         *
         * @param middleware the immutable middleware registry
         * @return this builder
         */
        public Builder middleware(MiddlewareRegistry middleware) {
            this.middleware = Objects.requireNonNull(middleware, "middleware");
            return this;
        }

        /**
         * Sets the container used for container-managed lifetimes and constructor injection.
         *
         * @param serviceLocator the service locator
         * @return this builder
         */
        public Builder serviceLocator(ServiceLocator serviceLocator) {
            this.serviceLocator = Objects.requireNonNull(serviceLocator, "serviceLocator");
            return this;
        }

        /**
         * Enables Micrometer metrics.
         *
         * @param registry the meter registry, or {@code null} to disable metrics
         * @return this builder
         */
        public Builder metrics(MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the strategy used by {@code publishAsync} calls that do not name one, and by cascades.
         * Defaults to {@link PublishStrategy#PARALLEL}.
         *
         * @param publishStrategy the default strategy
         * @return this builder
         */
        public Builder publishStrategy(PublishStrategy publishStrategy) {
            this.publishStrategy = Objects.requireNonNull(publishStrategy, "publishStrategy");
            return this;
        }

        /**
         * Sets the scope used by calls made without an explicit scope.
         *
         * @param defaultScope the scope
         * @return this builder
         */
        public Builder defaultScope(ScopeContext defaultScope) {
            this.defaultScope = Objects.requireNonNull(defaultScope, "defaultScope");
            return this;
        }

        /**
         * Sets the executor that runs {@link PublishStrategy#FIRE_AND_FORGET} handlers.
         * Defaults to the common fork-join pool.
         *
         * @param executor the executor
         * @return this builder
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        /**
         * Builds the engine.
         *
         * @return the engine
         * @throws IllegalStateException if a handler references middleware that is not registered
         */
        public CourierEngine build() {
            return new CourierEngine(this);
        }
    }
}
