package com.nayem.courier.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable map from message type to the handlers registered for it.
 * <p>
 * Built once at startup and shared by every dispatch. Lookups never mutate the registry;
 * the only internal state is a memo of publish resolutions per message class.
 * </p>
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private static final long MAX_CACHED_RESOLUTIONS = 10_000;

    private final Map<Class<?>, List<HandlerDescriptor>> handlers;
    private final Cache<Class<?>, List<HandlerDescriptor>> applicable;

    private HandlerRegistry(Map<Class<?>, List<HandlerDescriptor>> handlers) {
        Map<Class<?>, List<HandlerDescriptor>> copy = new LinkedHashMap<>();
        handlers.forEach((type, list) -> copy.put(type, List.copyOf(list)));
        this.handlers = Collections.unmodifiableMap(copy);
        this.applicable = Caffeine.newBuilder()
                .maximumSize(MAX_CACHED_RESOLUTIONS)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HandlerRegistry empty() {
        return new HandlerRegistry(Map.of());
    }

    /**
     * Handlers registered for exactly {@code messageType}, in registration order.
     */
    public List<HandlerDescriptor> lookup(Class<?> messageType) {
        return handlers.getOrDefault(messageType, List.of());
    }

    /**
     * Handlers that receive a published message of {@code messageType}: those registered for the
     * type itself, for any interface it implements, and for any superclass other than {@code Object}.
     * The result is distinct and sorted by handler order; handlers with equal order keep their
     * resolution order.
     */
    public List<HandlerDescriptor> lookupApplicable(Class<?> messageType) {
        Objects.requireNonNull(messageType, "messageType");
        return applicable.get(messageType, this::resolveApplicable);
    }

    private List<HandlerDescriptor> resolveApplicable(Class<?> messageType) {
        Set<HandlerDescriptor> found = new LinkedHashSet<>(lookup(messageType));

        for (Class<?> iface : allInterfaces(messageType)) {
            found.addAll(lookup(iface));
        }

        Class<?> superclass = messageType.getSuperclass();
        while (superclass != null && superclass != Object.class) {
            found.addAll(lookup(superclass));
            superclass = superclass.getSuperclass();
        }

        List<HandlerDescriptor> sorted = new ArrayList<>(found);
        sorted.sort(Comparator.comparingInt(HandlerDescriptor::order));
        return List.copyOf(sorted);
    }

    private static Set<Class<?>> allInterfaces(Class<?> type) {
        Set<Class<?>> result = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            Collections.addAll(pending, current.getInterfaces());
        }
        while (!pending.isEmpty()) {
            Class<?> iface = pending.poll();
            if (result.add(iface)) {
                Collections.addAll(pending, iface.getInterfaces());
            }
        }
        return result;
    }

    public List<HandlerRegistration> registrations() {
        List<HandlerRegistration> result = new ArrayList<>();
        handlers.forEach((type, list) -> list.forEach(d -> result.add(new HandlerRegistration(type, d))));
        return Collections.unmodifiableList(result);
    }

    public Set<Class<?>> messageTypes() {
        return handlers.keySet();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    /**
     * Logs every registration at INFO.
     */
    public void describe() {
        List<HandlerRegistration> all = registrations();
        if (all.isEmpty()) {
            log.info("Courier registry is empty, no message handlers were registered");
            return;
        }
        log.info("Courier registry: {} handler(s) for {} message type(s)", all.size(), handlers.size());
        for (HandlerRegistration registration : all) {
            log.info("  {}", registration);
        }
    }

    public static class Builder {
        private final Map<Class<?>, List<HandlerDescriptor>> handlers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(HandlerDescriptor descriptor) {
            Objects.requireNonNull(descriptor, "descriptor");
            handlers.computeIfAbsent(descriptor.messageType(), k -> new ArrayList<>()).add(descriptor);
            return this;
        }

        public Builder registerAll(Iterable<HandlerDescriptor> descriptors) {
            descriptors.forEach(this::register);
            return this;
        }

        public HandlerRegistry build() {
            return new HandlerRegistry(handlers);
        }
    }
}
