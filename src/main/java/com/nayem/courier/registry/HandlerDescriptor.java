package com.nayem.courier.registry;

import com.nayem.courier.core.Lifetime;
import com.nayem.courier.instance.InstanceFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Everything Courier needs to dispatch one message type to one handler.
 * <p>
 * Descriptors are created once during registration and are immutable afterwards, so they
 * can be shared by all concurrent dispatches without synchronization.
 * </p>
 */
public final class HandlerDescriptor implements ComponentDescriptor {

    public static final int DEFAULT_ORDER = Integer.MAX_VALUE;

    private final Class<?> messageType;
    private final Class<?> handlerType;
    private final String name;
    private final HandlerInvoker invoker;
    private final boolean async;
    private final int order;
    private final Lifetime lifetime;
    private final boolean cascading;
    private final InstanceFactory instanceFactory;
    private final List<Class<?>> middleware;

    private HandlerDescriptor(Builder builder) {
        this.messageType = builder.messageType;
        this.handlerType = builder.handlerType;
        this.name = builder.name != null ? builder.name : builder.handlerType.getName();
        this.invoker = builder.invoker;
        this.async = builder.async;
        this.order = builder.order;
        this.lifetime = builder.lifetime;
        this.cascading = builder.cascading;
        this.instanceFactory = builder.instanceFactory != null
                ? builder.instanceFactory
                : InstanceFactory.reflective(builder.handlerType);
        this.middleware = List.copyOf(builder.middleware);
    }

    public static Builder builder(Class<?> messageType, Class<?> handlerType) {
        return new Builder(messageType, handlerType);
    }

    /**
     * Describes a synchronous handler backed by a function. The function itself is the handler instance.
     */
    @SuppressWarnings("unchecked")
    public static <M> HandlerDescriptor function(Class<M> messageType, Function<? super M, ?> function) {
        return builder(messageType, function.getClass())
                .name(messageType.getSimpleName() + "Handler")
                .instanceFactory(InstanceFactory.constant(function))
                .invoker((handler, message, context) -> ((Function<Object, ?>) handler).apply(message))
                .build();
    }

    /**
     * Describes an asynchronous handler backed by a function. The function itself is the handler instance.
     */
    @SuppressWarnings("unchecked")
    public static <M> HandlerDescriptor asyncFunction(Class<M> messageType,
            Function<? super M, ? extends CompletionStage<?>> function) {
        return builder(messageType, function.getClass())
                .name(messageType.getSimpleName() + "Handler")
                .async(true)
                .instanceFactory(InstanceFactory.constant(function))
                .invoker((handler, message, context) -> ((Function<Object, ?>) handler).apply(message))
                .build();
    }

    public Class<?> messageType() {
        return messageType;
    }

    public Class<?> handlerType() {
        return handlerType;
    }

    public String name() {
        return name;
    }

    public HandlerInvoker invoker() {
        return invoker;
    }

    public boolean isAsync() {
        return async;
    }

    /**
     * Lower values run first when several handlers receive a published message.
     */
    public int order() {
        return order;
    }

    @Override
    public Lifetime lifetime() {
        return lifetime;
    }

    /**
     * Whether a {@link com.nayem.courier.core.Tuple} returned by this handler is split into a
     * response and cascaded messages.
     */
    public boolean isCascading() {
        return cascading;
    }

    @Override
    public Class<?> instanceType() {
        return handlerType;
    }

    @Override
    public InstanceFactory instanceFactory() {
        return instanceFactory;
    }

    /**
     * Middleware types this handler opts into explicitly, in addition to the middleware that
     * applies to its message type.
     */
    public List<Class<?>> middleware() {
        return middleware;
    }

    @Override
    public String toString() {
        return "HandlerDescriptor[" + name + " <- " + messageType.getName() + "]";
    }

    public static class Builder {
        private final Class<?> messageType;
        private final Class<?> handlerType;
        private String name;
        private HandlerInvoker invoker;
        private boolean async;
        private int order = DEFAULT_ORDER;
        private Lifetime lifetime = Lifetime.DEFAULT;
        private boolean cascading;
        private InstanceFactory instanceFactory;
        private final List<Class<?>> middleware = new ArrayList<>();

        private Builder(Class<?> messageType, Class<?> handlerType) {
            this.messageType = Objects.requireNonNull(messageType, "messageType");
            this.handlerType = Objects.requireNonNull(handlerType, "handlerType");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder invoker(HandlerInvoker invoker) {
            this.invoker = invoker;
            return this;
        }

        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder lifetime(Lifetime lifetime) {
            this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
            return this;
        }

        public Builder cascading(boolean cascading) {
            this.cascading = cascading;
            return this;
        }

        public Builder instanceFactory(InstanceFactory instanceFactory) {
            this.instanceFactory = instanceFactory;
            return this;
        }

        public Builder useMiddleware(Class<?> middlewareType) {
            this.middleware.add(Objects.requireNonNull(middlewareType, "middlewareType"));
            return this;
        }

        public HandlerDescriptor build() {
            if (invoker == null) {
                throw new IllegalStateException("Handler invoker is required for " + handlerType.getName());
            }
            return new HandlerDescriptor(this);
        }
    }
}
