package com.nayem.courier.core;

/**
 * Handle to a dependency-resolution scope.
 * <p>
 * Courier only borrows scopes: it never opens or closes one. Whoever created the
 * scope owns its lifecycle.
 * </p>
 */
public interface ScopeContext {

    /**
     * The scope used when a caller does not supply one.
     */
    ScopeContext ROOT = named("root");

    String id();

    static ScopeContext named(String id) {
        return new SimpleScopeContext(id);
    }

    record SimpleScopeContext(String id) implements ScopeContext {
    }
}
