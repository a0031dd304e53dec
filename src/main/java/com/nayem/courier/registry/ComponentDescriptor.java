package com.nayem.courier.registry;

import com.nayem.courier.core.Lifetime;
import com.nayem.courier.instance.InstanceFactory;

/**
 * What the instance cache needs to know to produce a handler or middleware instance.
 */
public interface ComponentDescriptor {

    Class<?> instanceType();

    Lifetime lifetime();

    /**
     * Factory used for {@link Lifetime#DEFAULT} instances. Ignored for container-managed lifetimes.
     */
    InstanceFactory instanceFactory();
}
