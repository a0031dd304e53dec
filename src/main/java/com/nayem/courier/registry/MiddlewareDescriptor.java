package com.nayem.courier.registry;

import com.nayem.courier.core.Lifetime;
import com.nayem.courier.instance.InstanceFactory;

import java.util.Objects;

/**
 * A registered middleware: which messages it applies to, where it sits in the pipeline,
 * and which of its phases exist.
 * <p>
 * A middleware may define any combination of {@code before}, {@code after}, {@code onFinally}
 * and {@code execute}. Each phase is independently synchronous or asynchronous.
 * </p>
 */
public final class MiddlewareDescriptor implements ComponentDescriptor {

    public static final int DEFAULT_ORDER = Integer.MAX_VALUE;

    private final Class<?> middlewareType;
    private final Class<?> messageType;
    private final String name;
    private final int order;
    private final Lifetime lifetime;
    private final boolean explicitOnly;
    private final InstanceFactory instanceFactory;
    private final MiddlewarePhase<PhaseInvoker> before;
    private final MiddlewarePhase<PhaseInvoker> after;
    private final MiddlewarePhase<PhaseInvoker> onFinally;
    private final MiddlewarePhase<ExecuteInvoker> execute;

    private MiddlewareDescriptor(Builder builder) {
        this.middlewareType = builder.middlewareType;
        this.messageType = builder.messageType;
        this.name = builder.name != null ? builder.name : builder.middlewareType.getName();
        this.order = builder.order;
        this.lifetime = builder.lifetime;
        this.explicitOnly = builder.explicitOnly;
        this.instanceFactory = builder.instanceFactory != null
                ? builder.instanceFactory
                : InstanceFactory.reflective(builder.middlewareType);
        this.before = builder.before;
        this.after = builder.after;
        this.onFinally = builder.onFinally;
        this.execute = builder.execute;
    }

    public static Builder builder(Class<?> middlewareType) {
        return new Builder(middlewareType);
    }

    public Class<?> middlewareType() {
        return middlewareType;
    }

    /**
     * The message type this middleware targets. {@code Object} means every message.
     */
    public Class<?> messageType() {
        return messageType;
    }

    public String name() {
        return name;
    }

    public int order() {
        return order;
    }

    @Override
    public Lifetime lifetime() {
        return lifetime;
    }

    /**
     * Whether this middleware only runs for handlers that reference it explicitly.
     */
    public boolean isExplicitOnly() {
        return explicitOnly;
    }

    @Override
    public Class<?> instanceType() {
        return middlewareType;
    }

    @Override
    public InstanceFactory instanceFactory() {
        return instanceFactory;
    }

    public MiddlewarePhase<PhaseInvoker> before() {
        return before;
    }

    public MiddlewarePhase<PhaseInvoker> after() {
        return after;
    }

    public MiddlewarePhase<PhaseInvoker> onFinally() {
        return onFinally;
    }

    public MiddlewarePhase<ExecuteInvoker> execute() {
        return execute;
    }

    public boolean hasBefore() {
        return before != null;
    }

    public boolean hasAfter() {
        return after != null;
    }

    public boolean hasFinally() {
        return onFinally != null;
    }

    public boolean hasExecute() {
        return execute != null;
    }

    /**
     * True if any phase returns a completion stage.
     */
    public boolean isAsync() {
        return (before != null && before.async())
                || (after != null && after.async())
                || (onFinally != null && onFinally.async())
                || (execute != null && execute.async());
    }

    /**
     * Whether this middleware applies to messages of the given type.
     */
    public boolean appliesTo(Class<?> type) {
        return messageType.isAssignableFrom(type);
    }

    /**
     * How closely this middleware targets {@code type}. Lower is more specific:
     * 0 for the exact type, 1 for an interface, 2 for a base class, 3 for {@code Object}.
     */
    public int specificity(Class<?> type) {
        if (messageType == type) {
            return 0;
        }
        if (messageType == Object.class) {
            return 3;
        }
        return messageType.isInterface() ? 1 : 2;
    }

    @Override
    public String toString() {
        return "MiddlewareDescriptor[" + name + " -> " + messageType.getName() + ", order=" + order + "]";
    }

    public static class Builder {
        private final Class<?> middlewareType;
        private Class<?> messageType = Object.class;
        private String name;
        private int order = DEFAULT_ORDER;
        private Lifetime lifetime = Lifetime.DEFAULT;
        private boolean explicitOnly;
        private InstanceFactory instanceFactory;
        private MiddlewarePhase<PhaseInvoker> before;
        private MiddlewarePhase<PhaseInvoker> after;
        private MiddlewarePhase<PhaseInvoker> onFinally;
        private MiddlewarePhase<ExecuteInvoker> execute;

        private Builder(Class<?> middlewareType) {
            this.middlewareType = Objects.requireNonNull(middlewareType, "middlewareType");
        }

        /**
         * Restricts the middleware to messages assignable to {@code messageType}.
         * Defaults to {@code Object}, which matches every message.
         */
        public Builder messageType(Class<?> messageType) {
            this.messageType = Objects.requireNonNull(messageType, "messageType");
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Lower values run their {@code before} phase earlier and their {@code after} and
         * {@code onFinally} phases later.
         */
        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder lifetime(Lifetime lifetime) {
            this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
            return this;
        }

        public Builder explicitOnly(boolean explicitOnly) {
            this.explicitOnly = explicitOnly;
            return this;
        }

        public Builder instanceFactory(InstanceFactory instanceFactory) {
            this.instanceFactory = instanceFactory;
            return this;
        }

        public Builder instance(Object instance) {
            this.instanceFactory = InstanceFactory.constant(instance);
            return this;
        }

        public Builder before(PhaseInvoker invoker) {
            this.before = MiddlewarePhase.sync(invoker);
            return this;
        }

        public Builder beforeAsync(PhaseInvoker invoker) {
            this.before = MiddlewarePhase.async(invoker);
            return this;
        }

        public Builder after(PhaseInvoker invoker) {
            this.after = MiddlewarePhase.sync(invoker);
            return this;
        }

        public Builder afterAsync(PhaseInvoker invoker) {
            this.after = MiddlewarePhase.async(invoker);
            return this;
        }

        public Builder onFinally(PhaseInvoker invoker) {
            this.onFinally = MiddlewarePhase.sync(invoker);
            return this;
        }

        public Builder onFinallyAsync(PhaseInvoker invoker) {
            this.onFinally = MiddlewarePhase.async(invoker);
            return this;
        }

        public Builder execute(ExecuteInvoker invoker) {
            this.execute = MiddlewarePhase.sync(invoker);
            return this;
        }

        public Builder executeAsync(ExecuteInvoker invoker) {
            this.execute = MiddlewarePhase.async(invoker);
            return this;
        }

        public MiddlewareDescriptor build() {
            if (before == null && after == null && onFinally == null && execute == null) {
                throw new IllegalStateException("Middleware " + middlewareType.getName() + " defines no phases");
            }
            return new MiddlewareDescriptor(this);
        }
    }
}
