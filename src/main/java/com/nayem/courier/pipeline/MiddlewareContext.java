package com.nayem.courier.pipeline;

import java.util.Optional;

/**
 * What a middleware phase can see of the call it is wrapping.
 * <p>
 * State produced by {@code before} phases is looked up by type: values returned by this
 * middleware's own {@code before} are searched first, then values from every {@code before}
 * in the order they ran. The first assignable value wins.
 * </p>
 */
public class MiddlewareContext extends InvocationContext {

    private final int position;

    MiddlewareContext(PipelineState state, int position) {
        super(state);
        this.position = position;
    }

    public <T> Optional<T> state(Class<T> type) {
        return Optional.ofNullable(state.lookupState(position, type));
    }

    /**
     * The handler result, or the short-circuit value. {@code null} before the handler has run.
     */
    public Object result() {
        return state.result();
    }

    /**
     * The failure being propagated, visible to {@code onFinally} phases. {@code null} on success.
     */
    public Throwable exception() {
        return state.exception();
    }

    public boolean isShortCircuited() {
        return state.isShortCircuited();
    }
}
