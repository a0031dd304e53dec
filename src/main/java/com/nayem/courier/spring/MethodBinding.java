package com.nayem.courier.spring;

import com.nayem.courier.core.CancellationToken;
import com.nayem.courier.core.HandlerResult;
import com.nayem.courier.core.Mediator;
import com.nayem.courier.core.ScopeContext;
import com.nayem.courier.core.Tuple;
import com.nayem.courier.pipeline.HandlerExecutionInfo;
import com.nayem.courier.pipeline.InvocationContext;
import com.nayem.courier.pipeline.MiddlewareContext;
import com.nayem.courier.pipeline.PipelineExecution;
import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.concurrent.CompletionStage;

/**
 * Calls a handler or middleware method, binding each parameter from the current invocation.
 * <p>
 * The first parameter always receives the message. The rest are bound by type; see
 * {@link MessageHandler} and {@link MessageMiddleware} for the supported kinds.
 * </p>
 */
final class MethodBinding {

    @FunctionalInterface
    private interface ArgumentResolver {
        Object resolve(Object message, InvocationContext context, PipelineExecution next);
    }

    private final Method method;
    private final boolean isStatic;
    private final ArgumentResolver[] resolvers;

    private MethodBinding(Method method, ArgumentResolver[] resolvers) {
        this.method = method;
        this.isStatic = Modifier.isStatic(method.getModifiers());
        this.resolvers = resolvers;
        ReflectionUtils.makeAccessible(method);
    }

    static MethodBinding forHandler(Method method) {
        return bind(method, false, null);
    }

    /**
     * @param beforeOutputType declared output type of the middleware's {@code before} phase, or
     *                         {@code null} when it has none. Parameters that could hold that output
     *                         are bound to {@code null} instead of being resolved as services when
     *                         no state was recorded.
     */
    static MethodBinding forMiddleware(Method method, Class<?> beforeOutputType) {
        return bind(method, true, beforeOutputType);
    }

    private static MethodBinding bind(Method method, boolean middleware, Class<?> beforeOutputType) {
        Parameter[] parameters = method.getParameters();
        if (parameters.length == 0) {
            throw new IllegalStateException("Method " + describe(method) + " must take the message as its first parameter");
        }
        ArgumentResolver[] resolvers = new ArgumentResolver[parameters.length];
        resolvers[0] = (message, context, next) -> message;
        for (int i = 1; i < parameters.length; i++) {
            resolvers[i] = resolverFor(method, parameters[i], middleware, beforeOutputType);
        }
        return new MethodBinding(method, resolvers);
    }

    private static ArgumentResolver resolverFor(Method method, Parameter parameter, boolean middleware,
            Class<?> beforeOutputType) {
        Class<?> type = parameter.getType();

        if (parameter.isAnnotationPresent(Response.class)) {
            if (!middleware) {
                throw new IllegalStateException("@Response is only supported on middleware: " + describe(method));
            }
            return (message, context, next) -> ((MiddlewareContext) context).result();
        }
        if (type == CancellationToken.class) {
            return (message, context, next) -> context.cancellationToken();
        }
        if (type == ScopeContext.class) {
            return (message, context, next) -> context.scope();
        }
        if (type == Mediator.class) {
            return (message, context, next) -> context.mediator();
        }
        if (type == HandlerExecutionInfo.class) {
            return (message, context, next) -> context.handler();
        }
        if (type == InvocationContext.class) {
            return (message, context, next) -> context;
        }
        if (type == MiddlewareContext.class && middleware) {
            return (message, context, next) -> context;
        }
        if (type == PipelineExecution.class) {
            return (message, context, next) -> next;
        }
        if (!middleware) {
            return (message, context, next) -> context.resolve(type);
        }

        if (Throwable.class.isAssignableFrom(type)) {
            return (message, context, next) -> {
                Throwable failure = ((MiddlewareContext) context).exception();
                return type.isInstance(failure) ? failure : null;
            };
        }

        Class<?> stateType = ClassUtils.resolvePrimitiveIfNecessary(type);
        boolean mayHoldBeforeOutput = beforeOutputType != null
                && (stateType.isAssignableFrom(beforeOutputType)
                        || beforeOutputType == Object.class
                        || beforeOutputType == Tuple.class
                        || beforeOutputType == HandlerResult.class);
        return (message, context, next) -> {
            Object state = ((MiddlewareContext) context).state(stateType).orElse(null);
            if (state != null || mayHoldBeforeOutput) {
                return state;
            }
            return context.resolve(type);
        };
    }

    Object invoke(Object target, Object message, InvocationContext context, PipelineExecution next) throws Exception {
        Object[] args = new Object[resolvers.length];
        for (int i = 0; i < resolvers.length; i++) {
            args[i] = resolvers[i].resolve(message, context, next);
        }
        try {
            return method.invoke(isStatic ? null : target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    Class<?> messageType() {
        return ClassUtils.resolvePrimitiveIfNecessary(method.getParameterTypes()[0]);
    }

    boolean isAsync() {
        return CompletionStage.class.isAssignableFrom(method.getReturnType());
    }

    boolean isStatic() {
        return isStatic;
    }

    /**
     * The declared result type, looking through a completion stage for asynchronous methods.
     */
    Class<?> outputType() {
        if (!isAsync()) {
            return method.getReturnType();
        }
        Class<?> resolved = ResolvableType.forMethodReturnType(method).as(CompletionStage.class).getGeneric(0).resolve();
        return resolved != null ? resolved : Object.class;
    }

    boolean returnsTuple() {
        return outputType() == Tuple.class;
    }

    Method method() {
        return method;
    }

    static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }
}
