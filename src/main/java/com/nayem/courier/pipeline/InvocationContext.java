package com.nayem.courier.pipeline;

import com.nayem.courier.core.CancellationToken;
import com.nayem.courier.core.Mediator;
import com.nayem.courier.core.ScopeContext;

/**
 * What a handler can see of the call it is serving.
 */
public class InvocationContext {

    protected final PipelineState state;

    InvocationContext(PipelineState state) {
        this.state = state;
    }

    public Object message() {
        return state.message();
    }

    public CancellationToken cancellationToken() {
        return state.cancellationToken();
    }

    public ScopeContext scope() {
        return state.scope();
    }

    /**
     * A mediator bound to this call's scope, for dispatching further messages.
     */
    public Mediator mediator() {
        return state.mediator();
    }

    public HandlerExecutionInfo handler() {
        return state.handlerInfo();
    }

    /**
     * Resolves a service from the container within this call's scope.
     */
    public <T> T resolve(Class<T> type) {
        return state.locator().resolve(type, state.scope());
    }
}
