package com.nayem.courier.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, immutable group of values returned by a handler.
 * <p>
 * When a cascading handler returns a tuple, the first element matching the caller's
 * expected response type becomes the response and every other non-null element is
 * published as a message of its own. Elements may be {@code null}.
 * </p>
 *
 * <pre>{@code
 * public Tuple handle(CreateOrder command) {
 *     Order order = orders.create(command);
 *     return Tuple.of(order, new OrderCreated(order.id()));
 * }
 * }</pre>
 */
public final class Tuple {

    private final List<Object> items;

    private Tuple(Object[] items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(items)));
    }

    public static Tuple of(Object... items) {
        Objects.requireNonNull(items, "items");
        return new Tuple(items);
    }

    public int size() {
        return items.size();
    }

    public Object get(int index) {
        return items.get(index);
    }

    public List<Object> items() {
        return items;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Tuple other && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "Tuple" + items;
    }
}
