package com.nayem.courier.instance;

import com.nayem.courier.core.Lifetime;
import com.nayem.courier.core.ScopeContext;
import com.nayem.courier.core.ServiceLocator;
import com.nayem.courier.exception.ConstructionException;
import com.nayem.courier.registry.ComponentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Produces handler and middleware instances according to their {@link Lifetime}.
 * <p>
 * {@link Lifetime#DEFAULT} instances are built once and then reused by every call. The slot
 * uses double-checked locking, so after the first successful construction reads take no lock.
 * A failed construction leaves the slot empty and the next call tries again.
 * Container-managed lifetimes go to the {@link ServiceLocator} on every call.
 * </p>
 */
public class InstanceCache {

    private static final Logger log = LoggerFactory.getLogger(InstanceCache.class);

    private final ServiceLocator locator;
    private final Map<ComponentDescriptor, InstanceProvider> providers = new ConcurrentHashMap<>();

    public InstanceCache(ServiceLocator locator) {
        this.locator = Objects.requireNonNull(locator, "locator");
    }

    /**
     * Returns the instance to use for {@code descriptor} in the given scope.
     *
     * @throws ConstructionException if the instance cannot be created or resolved
     */
    public Object acquire(ComponentDescriptor descriptor, ScopeContext scope) {
        return providers.computeIfAbsent(descriptor, this::providerFor).get(scope);
    }

    /**
     * Whether a {@link Lifetime#DEFAULT} instance has been built for {@code descriptor}.
     */
    public boolean isCached(ComponentDescriptor descriptor) {
        return providers.get(descriptor) instanceof CachedOnce cached && cached.instance != null;
    }

    public ServiceLocator locator() {
        return locator;
    }

    private InstanceProvider providerFor(ComponentDescriptor descriptor) {
        if (descriptor.lifetime().isContainerManaged()) {
            return new ResolveEveryCall(descriptor);
        }
        return new CachedOnce(descriptor);
    }

    private interface InstanceProvider {
        Object get(ScopeContext scope);
    }

    private final class CachedOnce implements InstanceProvider {
        private final ComponentDescriptor descriptor;
        private final Object lock = new Object();
        private volatile Object instance;

        private CachedOnce(ComponentDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        @Override
        public Object get(ScopeContext scope) {
            Object current = instance;
            if (current != null) {
                return current;
            }
            synchronized (lock) {
                if (instance == null) {
                    instance = construct(scope);
                    log.debug("Created {} instance of {}", descriptor.lifetime(), descriptor.instanceType().getName());
                }
                return instance;
            }
        }

        private Object construct(ScopeContext scope) {
            Object created;
            try {
                created = descriptor.instanceFactory().create(locator, scope);
            } catch (ConstructionException e) {
                throw e;
            } catch (Exception e) {
                throw new ConstructionException(descriptor.instanceType(), e);
            }
            if (created == null) {
                throw new ConstructionException(descriptor.instanceType(), "factory returned null");
            }
            return created;
        }
    }

    private final class ResolveEveryCall implements InstanceProvider {
        private final ComponentDescriptor descriptor;

        private ResolveEveryCall(ComponentDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        @Override
        public Object get(ScopeContext scope) {
            Class<?> type = descriptor.instanceType();
            Object resolved;
            try {
                resolved = descriptor.lifetime() == Lifetime.SCOPED
                        ? locator.resolveScoped(type, scope)
                        : locator.resolve(type, scope);
            } catch (ConstructionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConstructionException(type, e);
            }
            if (resolved == null) {
                throw new ConstructionException(type, "service locator returned null");
            }
            return resolved;
        }
    }
}
