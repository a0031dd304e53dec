package com.nayem.courier.core;

/**
 * Outcome of a middleware {@code before} phase.
 * <p>
 * {@link #proceed(Object)} lets the pipeline continue and records the value as state for the
 * later {@code after} and {@code onFinally} phases. {@link #shortCircuit(Object)} stops the
 * pipeline: the handler is skipped and the value becomes the result of the call.
 * </p>
 */
public final class HandlerResult {

    private static final HandlerResult PROCEED = new HandlerResult(null, false);

    private final Object value;
    private final boolean shortCircuited;

    private HandlerResult(Object value, boolean shortCircuited) {
        this.value = value;
        this.shortCircuited = shortCircuited;
    }

    public static HandlerResult proceed() {
        return PROCEED;
    }

    public static HandlerResult proceed(Object state) {
        return state == null ? PROCEED : new HandlerResult(state, false);
    }

    public static HandlerResult shortCircuit(Object value) {
        return new HandlerResult(value, true);
    }

    public Object getValue() {
        return value;
    }

    public boolean isShortCircuited() {
        return shortCircuited;
    }

    @Override
    public String toString() {
        return (shortCircuited ? "ShortCircuit[" : "Proceed[") + value + "]";
    }
}
