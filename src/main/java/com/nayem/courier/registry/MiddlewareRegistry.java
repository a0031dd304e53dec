package com.nayem.courier.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable list of registered middleware and the ordered chain each handler runs through.
 */
public final class MiddlewareRegistry {

    private final List<MiddlewareDescriptor> middleware;
    private final Cache<HandlerDescriptor, List<MiddlewareDescriptor>> chains = Caffeine.newBuilder()
            .maximumSize(10_000)
            .build();

    private MiddlewareRegistry(List<MiddlewareDescriptor> middleware) {
        this.middleware = List.copyOf(middleware);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MiddlewareRegistry empty() {
        return new MiddlewareRegistry(List.of());
    }

    public List<MiddlewareDescriptor> all() {
        return middleware;
    }

    /**
     * The middleware that wraps {@code handler}, in {@code before} order.
     * <p>
     * Applicable middleware are those whose message type the handler's message is assignable to,
     * unless they are explicit-only, plus every middleware the handler references explicitly.
     * Sorted by order, then by how specifically the middleware targets the message type, then by
     * registration order.
     * </p>
     *
     * @throws IllegalStateException if the handler references a middleware type that is not registered
     */
    public List<MiddlewareDescriptor> chainFor(HandlerDescriptor handler) {
        return chains.get(handler, this::resolveChain);
    }

    private List<MiddlewareDescriptor> resolveChain(HandlerDescriptor handler) {
        Class<?> messageType = handler.messageType();
        List<Integer> selected = new ArrayList<>();

        for (int i = 0; i < middleware.size(); i++) {
            MiddlewareDescriptor candidate = middleware.get(i);
            boolean referenced = handler.middleware().contains(candidate.middlewareType());
            if (referenced || (!candidate.isExplicitOnly() && candidate.appliesTo(messageType))) {
                selected.add(i);
            }
        }

        for (Class<?> reference : handler.middleware()) {
            boolean registered = middleware.stream().anyMatch(m -> m.middlewareType() == reference);
            if (!registered) {
                throw new IllegalStateException("Handler " + handler.name() + " references middleware "
                        + reference.getName() + " which is not registered");
            }
        }

        selected.sort(Comparator
                .<Integer>comparingInt(i -> middleware.get(i).order())
                .thenComparingInt(i -> middleware.get(i).specificity(messageType))
                .thenComparingInt(i -> i));

        List<MiddlewareDescriptor> chain = new ArrayList<>(selected.size());
        for (Integer index : selected) {
            chain.add(middleware.get(index));
        }
        return List.copyOf(chain);
    }

    public static class Builder {
        private final List<MiddlewareDescriptor> middleware = new ArrayList<>();

        private Builder() {
        }

        public Builder register(MiddlewareDescriptor descriptor) {
            middleware.add(Objects.requireNonNull(descriptor, "descriptor"));
            return this;
        }

        public Builder registerAll(Iterable<MiddlewareDescriptor> descriptors) {
            descriptors.forEach(this::register);
            return this;
        }

        public MiddlewareRegistry build() {
            return new MiddlewareRegistry(middleware);
        }
    }
}
