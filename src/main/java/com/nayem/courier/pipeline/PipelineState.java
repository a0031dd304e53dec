package com.nayem.courier.pipeline;

import com.nayem.courier.core.CancellationToken;
import com.nayem.courier.core.HandlerResult;
import com.nayem.courier.core.Mediator;
import com.nayem.courier.core.ScopeContext;
import com.nayem.courier.core.ServiceLocator;
import com.nayem.courier.core.Tuple;
import com.nayem.courier.registry.HandlerDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Mutable state of one invocation. Owned by a single call and never shared between calls.
 * <p>
 * The handler instance is created lazily the first time the handler is about to run, so a
 * short-circuit skips its construction. Per-attempt fields are reset by {@link #beginAttempt()}
 * whenever an {@code execute} phase runs the pipeline again.
 * </p>
 */
public final class PipelineState {

    private final Object message;
    private final HandlerDescriptor handler;
    private final HandlerExecutionInfo handlerInfo;
    private final List<BoundMiddleware> chain;
    private final CancellationToken cancellationToken;
    private final ScopeContext scope;
    private final Supplier<Mediator> mediatorFactory;
    private final ServiceLocator locator;
    private final Supplier<Object> handlerActivator;

    private Object handlerInstance;
    private Mediator mediator;

    private final List<List<Object>> beforeOutputs;
    private Object result;
    private Throwable exception;
    private boolean shortCircuited;

    public PipelineState(Object message,
            HandlerDescriptor handler,
            List<BoundMiddleware> chain,
            CancellationToken cancellationToken,
            ScopeContext scope,
            Supplier<Mediator> mediatorFactory,
            ServiceLocator locator,
            Supplier<Object> handlerActivator) {
        this.message = Objects.requireNonNull(message, "message");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.handlerInfo = HandlerExecutionInfo.of(handler);
        this.chain = List.copyOf(chain);
        this.cancellationToken = cancellationToken != null ? cancellationToken : CancellationToken.NONE;
        this.scope = scope;
        this.mediatorFactory = Objects.requireNonNull(mediatorFactory, "mediatorFactory");
        this.locator = locator;
        this.handlerActivator = Objects.requireNonNull(handlerActivator, "handlerActivator");
        this.beforeOutputs = new ArrayList<>(this.chain.size());
        for (int i = 0; i < this.chain.size(); i++) {
            beforeOutputs.add(new ArrayList<>());
        }
    }

    public Object message() {
        return message;
    }

    public HandlerDescriptor handler() {
        return handler;
    }

    public HandlerExecutionInfo handlerInfo() {
        return handlerInfo;
    }

    public List<BoundMiddleware> chain() {
        return chain;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public ScopeContext scope() {
        return scope;
    }

    /**
     * The mediator bound to this call's scope, created on first use.
     */
    public Mediator mediator() {
        if (mediator == null) {
            mediator = mediatorFactory.get();
        }
        return mediator;
    }

    public ServiceLocator locator() {
        return locator;
    }

    public Object result() {
        return result;
    }

    public Throwable exception() {
        return exception;
    }

    public boolean isShortCircuited() {
        return shortCircuited;
    }

    Object handlerInstance() {
        if (handlerInstance == null) {
            handlerInstance = handlerActivator.get();
        }
        return handlerInstance;
    }

    void beginAttempt() {
        beforeOutputs.forEach(List::clear);
        result = null;
        exception = null;
        shortCircuited = false;
    }

    void recordResult(Object value) {
        this.result = value;
    }

    void recordException(Throwable failure) {
        this.exception = failure;
    }

    /**
     * Stores what a {@code before} phase returned: a {@link HandlerResult} may short-circuit or carry
     * state, a {@link Tuple} contributes each non-null element, anything else is stored as-is.
     */
    void recordBefore(int position, Object output) {
        if (output == null) {
            return;
        }
        if (output instanceof HandlerResult handlerResult) {
            if (handlerResult.isShortCircuited()) {
                shortCircuited = true;
                result = handlerResult.getValue();
            } else {
                recordBefore(position, handlerResult.getValue());
            }
            return;
        }
        List<Object> outputs = beforeOutputs.get(position);
        if (output instanceof Tuple tuple) {
            for (Object item : tuple.items()) {
                if (item != null) {
                    outputs.add(item);
                }
            }
        } else {
            outputs.add(output);
        }
    }

    <T> T lookupState(int position, Class<T> type) {
        T own = firstAssignable(beforeOutputs.get(position), type);
        if (own != null) {
            return own;
        }
        for (List<Object> outputs : beforeOutputs) {
            T found = firstAssignable(outputs, type);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static <T> T firstAssignable(List<Object> values, Class<T> type) {
        for (Object value : values) {
            if (type.isInstance(value)) {
                return type.cast(value);
            }
        }
        return null;
    }
}
