package com.nayem.courier.core;

/**
 * How handler and middleware instances are obtained for each dispatch.
 */
public enum Lifetime {

    /**
     * Constructed once by Courier on first use and reused for every later call.
     */
    DEFAULT,

    /**
     * Resolved from the service locator on every call; the container creates a new instance each time.
     */
    TRANSIENT,

    /**
     * Resolved from the active scope on every call; one instance per scope.
     */
    SCOPED,

    /**
     * Resolved from the service locator on every call; the container shares one instance.
     */
    SINGLETON;

    public boolean isContainerManaged() {
        return this != DEFAULT;
    }
}
