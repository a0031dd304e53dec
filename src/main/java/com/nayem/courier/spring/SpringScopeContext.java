package com.nayem.courier.spring;

import com.nayem.courier.core.ScopeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A dependency scope backed by the Spring bean factory. Each {@link com.nayem.courier.core.Lifetime#SCOPED}
 * type gets one instance per scope, created with full autowiring and destroyed when the scope closes.
 * <p>
 * Whoever opens a scope closes it; Courier only passes it along.
 * </p>
 *
 * <pre>{@code
 * try (SpringScopeContext scope = locator.openScope()) {
 *     mediator.withScope(scope).invoke(new PlaceOrder(cart), Order.class);
 * }
 * }</pre>
 */
public class SpringScopeContext implements ScopeContext, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SpringScopeContext.class);

    private final String id;
    private final AutowireCapableBeanFactory beanFactory;
    private final Map<Class<?>, Object> instances = new LinkedHashMap<>();
    private boolean closed;

    SpringScopeContext(String id, AutowireCapableBeanFactory beanFactory) {
        this.id = id;
        this.beanFactory = beanFactory;
    }

    static SpringScopeContext open(AutowireCapableBeanFactory beanFactory) {
        return new SpringScopeContext("scope-" + UUID.randomUUID(), beanFactory);
    }

    @Override
    public String id() {
        return id;
    }

    /**
     * The instance of {@code type} for this scope, created on first request.
     *
     * @throws IllegalStateException if the scope has been closed
     */
    public synchronized <T> T get(Class<T> type) {
        if (closed) {
            throw new IllegalStateException("Scope " + id + " is closed");
        }
        Object instance = instances.get(type);
        if (instance == null) {
            instance = beanFactory.createBean(type);
            instances.put(type, instance);
            log.debug("Created scoped instance of {} in {}", type.getName(), id);
        }
        return type.cast(instance);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Destroys every instance created in this scope, most recent first.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<Object> created = new ArrayList<>(instances.values());
        instances.clear();
        for (int i = created.size() - 1; i >= 0; i--) {
            Object instance = created.get(i);
            try {
                beanFactory.destroyBean(instance);
            } catch (RuntimeException e) {
                log.warn("Failed to destroy scoped instance {} in {}: {}", instance.getClass().getName(), id, e.getMessage());
            }
        }
        log.debug("Closed {} ({} instance(s))", id, created.size());
    }

    @Override
    public String toString() {
        return "SpringScopeContext[" + id + "]";
    }
}
