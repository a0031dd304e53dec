package com.nayem.courier.core;

import com.nayem.courier.exception.ResponseTypeMismatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits a handler result into the response returned to the caller and the messages to cascade.
 * <p>
 * Only {@link Tuple} results of cascading handlers are split. The first element that is an
 * instance of the expected response type becomes the response; every other non-null element
 * is cascaded in tuple order. Without an expected type every non-null element is cascaded.
 * A short-circuited result yields its response but never cascades anything.
 * </p>
 */
public final class CascadingMessageResolver {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class);

    public record Resolution(Object response, List<Object> cascades) {

        public boolean hasCascades() {
            return !cascades.isEmpty();
        }
    }

    /**
     * @param expected the caller's response type, or {@code null} / {@code Void} when the caller ignores the response
     * @throws ResponseTypeMismatchException if a response is expected but the result cannot provide one
     */
    public Resolution resolve(Class<?> messageType, Object result, Class<?> expected,
            boolean cascading, boolean shortCircuited) {
        boolean ignoresResponse = expected == null || expected == Void.class || expected == void.class;

        if (cascading && result instanceof Tuple tuple && expected != Tuple.class) {
            return ignoresResponse
                    ? cascadeAll(tuple, shortCircuited)
                    : splitTuple(messageType, tuple, wrap(expected), shortCircuited);
        }

        if (ignoresResponse || result == null) {
            return new Resolution(null, List.of());
        }
        if (!wrap(expected).isInstance(result)) {
            throw new ResponseTypeMismatchException(messageType, expected, result);
        }
        return new Resolution(result, List.of());
    }

    private static Resolution cascadeAll(Tuple tuple, boolean shortCircuited) {
        if (shortCircuited) {
            return new Resolution(null, List.of());
        }
        List<Object> cascades = new ArrayList<>();
        for (Object item : tuple.items()) {
            if (item != null) {
                cascades.add(item);
            }
        }
        return new Resolution(null, List.copyOf(cascades));
    }

    private static Resolution splitTuple(Class<?> messageType, Tuple tuple, Class<?> expected, boolean shortCircuited) {
        int match = -1;
        for (int i = 0; i < tuple.size(); i++) {
            if (expected.isInstance(tuple.get(i))) {
                match = i;
                break;
            }
        }
        if (match < 0) {
            throw new ResponseTypeMismatchException(messageType, expected, tuple);
        }
        if (shortCircuited) {
            return new Resolution(tuple.get(match), List.of());
        }

        List<Object> cascades = new ArrayList<>();
        for (int i = 0; i < tuple.size(); i++) {
            Object item = tuple.get(i);
            if (i != match && item != null) {
                cascades.add(item);
            }
        }
        return new Resolution(tuple.get(match), List.copyOf(cascades));
    }

    private static Class<?> wrap(Class<?> type) {
        return type.isPrimitive() ? WRAPPERS.getOrDefault(type, type) : type;
    }
}
