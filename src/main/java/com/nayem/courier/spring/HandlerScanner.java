package com.nayem.courier.spring;

import com.nayem.courier.core.Lifetime;
import com.nayem.courier.instance.InstanceFactory;
import com.nayem.courier.registry.HandlerDescriptor;
import com.nayem.courier.registry.MiddlewareDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.core.annotation.Order;
import org.springframework.core.type.filter.AnnotationTypeFilter;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Finds {@link MessageHandler} and {@link MessageMiddleware} classes and turns them into descriptors.
 * <p>
 * Discovery happens once at startup. The descriptors it produces carry invokers that call the
 * annotated classes' methods reflectively; nothing is scanned or looked up per message.
 * Instances with the {@code DEFAULT} lifetime come from the factory function given at
 * construction, which builds them reflectively unless a container supplies its own.
 * </p>
 */
public class HandlerScanner {

    private static final Logger log = LoggerFactory.getLogger(HandlerScanner.class);

    private static final Set<String> HANDLER_METHODS = Set.of("handle", "handleAsync", "consume", "consumeAsync");

    private static final Comparator<Method> METHOD_ORDER = Comparator
            .comparing(Method::getName)
            .thenComparing(m -> Arrays.toString(m.getParameterTypes()));

    private final Function<Class<?>, InstanceFactory> instanceFactories;

    public HandlerScanner() {
        this(InstanceFactory::reflective);
    }

    public HandlerScanner(Function<Class<?>, InstanceFactory> instanceFactories) {
        this.instanceFactories = instanceFactories;
    }

    public ScannedComponents scan(Collection<String> basePackages, ClassLoader classLoader) {
        ClassPathScanningCandidateComponentProvider provider = new ClassPathScanningCandidateComponentProvider(false);
        provider.addIncludeFilter(new AnnotationTypeFilter(MessageHandler.class));
        provider.addIncludeFilter(new AnnotationTypeFilter(MessageMiddleware.class));

        Set<Class<?>> handlers = new LinkedHashSet<>();
        Set<Class<?>> middleware = new LinkedHashSet<>();
        for (String basePackage : basePackages) {
            List<BeanDefinition> candidates = new ArrayList<>(provider.findCandidateComponents(basePackage));
            candidates.sort(Comparator.comparing(BeanDefinition::getBeanClassName));
            for (BeanDefinition candidate : candidates) {
                Class<?> type = ClassUtils.resolveClassName(candidate.getBeanClassName(), classLoader);
                if (type.isAnnotationPresent(MessageHandler.class)) {
                    handlers.add(type);
                }
                if (type.isAnnotationPresent(MessageMiddleware.class)) {
                    middleware.add(type);
                }
            }
        }
        log.debug("Scanned {}: {} handler class(es), {} middleware class(es)",
                basePackages, handlers.size(), middleware.size());
        return new ScannedComponents(new ArrayList<>(handlers), new ArrayList<>(middleware));
    }

    /**
     * One descriptor per handler method of {@code type}.
     *
     * @throws IllegalStateException if {@code type} is not a {@link MessageHandler} or declares none
     */
    public List<HandlerDescriptor> describeHandlers(Class<?> type) {
        MessageHandler annotation = type.getAnnotation(MessageHandler.class);
        if (annotation == null) {
            throw new IllegalStateException(type.getName() + " is not annotated with @MessageHandler");
        }

        List<Method> methods = new ArrayList<>(Arrays.asList(ReflectionUtils.getUniqueDeclaredMethods(type,
                m -> HANDLER_METHODS.contains(m.getName())
                        && Modifier.isPublic(m.getModifiers())
                        && !m.isBridge()
                        && !m.isSynthetic()
                        && m.getDeclaringClass() != Object.class)));
        if (methods.isEmpty()) {
            throw new IllegalStateException("@MessageHandler " + type.getName()
                    + " declares no public handle, handleAsync, consume or consumeAsync method");
        }
        methods.sort(METHOD_ORDER);

        Order classOrder = AnnotationUtils.findAnnotation(type, Order.class);
        UseMiddleware classMiddleware = AnnotationUtils.findAnnotation(type, UseMiddleware.class);

        List<HandlerDescriptor> descriptors = new ArrayList<>(methods.size());
        for (Method method : methods) {
            MethodBinding binding = MethodBinding.forHandler(method);

            Order methodOrder = AnnotationUtils.findAnnotation(method, Order.class);
            int order = methodOrder != null ? methodOrder.value()
                    : classOrder != null ? classOrder.value()
                    : annotation.order();

            HandlerDescriptor.Builder builder = HandlerDescriptor.builder(binding.messageType(), type)
                    .name(type.getSimpleName() + "." + method.getName())
                    .invoker((handler, message, context) -> binding.invoke(handler, message, context, null))
                    .async(binding.isAsync())
                    .cascading(binding.returnsTuple())
                    .order(order);

            if (binding.isStatic()) {
                // Static handlers never touch their instance.
                builder.lifetime(Lifetime.DEFAULT).instanceFactory(InstanceFactory.constant(type));
            } else {
                builder.lifetime(annotation.lifetime()).instanceFactory(instanceFactories.apply(type));
            }

            if (classMiddleware != null) {
                Arrays.stream(classMiddleware.value()).forEach(builder::useMiddleware);
            }
            UseMiddleware methodMiddleware = AnnotationUtils.findAnnotation(method, UseMiddleware.class);
            if (methodMiddleware != null) {
                Arrays.stream(methodMiddleware.value()).forEach(builder::useMiddleware);
            }

            descriptors.add(builder.build());
        }
        return descriptors;
    }

    /**
     * @throws IllegalStateException if {@code type} is not a {@link MessageMiddleware}, declares no
     *                               phase, declares a phase twice, or its phases disagree on the message type
     */
    public MiddlewareDescriptor describeMiddleware(Class<?> type) {
        MessageMiddleware annotation = type.getAnnotation(MessageMiddleware.class);
        if (annotation == null) {
            throw new IllegalStateException(type.getName() + " is not annotated with @MessageMiddleware");
        }

        Method before = findPhase(type, "before");
        Method after = findPhase(type, "after");
        Method onFinally = findPhase(type, "onFinally");
        Method execute = findPhase(type, "execute");

        Class<?> messageType = null;
        for (Method phase : Arrays.asList(before, after, onFinally, execute)) {
            if (phase == null) {
                continue;
            }
            if (phase.getParameterCount() == 0) {
                throw new IllegalStateException("Middleware method " + MethodBinding.describe(phase)
                        + " must take the message as its first parameter");
            }
            Class<?> declared = ClassUtils.resolvePrimitiveIfNecessary(phase.getParameterTypes()[0]);
            if (messageType != null && messageType != declared) {
                throw new IllegalStateException("Middleware " + type.getName()
                        + " phases disagree on the message type: " + messageType.getName() + " and " + declared.getName());
            }
            messageType = declared;
        }
        if (messageType == null) {
            throw new IllegalStateException("@MessageMiddleware " + type.getName()
                    + " declares none of before, after, onFinally or execute");
        }

        Order classOrder = AnnotationUtils.findAnnotation(type, Order.class);
        MiddlewareDescriptor.Builder builder = MiddlewareDescriptor.builder(type)
                .messageType(messageType)
                .name(type.getSimpleName())
                .order(classOrder != null ? classOrder.value() : annotation.order())
                .lifetime(annotation.lifetime())
                .instanceFactory(instanceFactories.apply(type))
                .explicitOnly(annotation.explicitOnly());

        Class<?> beforeOutputType = null;
        if (before != null) {
            MethodBinding binding = MethodBinding.forMiddleware(before, null);
            if (binding.isAsync()) {
                builder.beforeAsync((middleware, context) -> binding.invoke(middleware, context.message(), context, null));
            } else {
                builder.before((middleware, context) -> binding.invoke(middleware, context.message(), context, null));
            }
            Class<?> output = binding.outputType();
            beforeOutputType = output == void.class || output == Void.class ? null : output;
        }
        if (after != null) {
            MethodBinding binding = MethodBinding.forMiddleware(after, beforeOutputType);
            if (binding.isAsync()) {
                builder.afterAsync((middleware, context) -> binding.invoke(middleware, context.message(), context, null));
            } else {
                builder.after((middleware, context) -> binding.invoke(middleware, context.message(), context, null));
            }
        }
        if (onFinally != null) {
            MethodBinding binding = MethodBinding.forMiddleware(onFinally, beforeOutputType);
            if (binding.isAsync()) {
                builder.onFinallyAsync((middleware, context) -> binding.invoke(middleware, context.message(), context, null));
            } else {
                builder.onFinally((middleware, context) -> binding.invoke(middleware, context.message(), context, null));
            }
        }
        if (execute != null) {
            MethodBinding binding = MethodBinding.forMiddleware(execute, beforeOutputType);
            if (binding.isAsync()) {
                builder.executeAsync((middleware, context, next) -> binding.invoke(middleware, context.message(), context, next));
            } else {
                builder.execute((middleware, context, next) -> binding.invoke(middleware, context.message(), context, next));
            }
        }
        return builder.build();
    }

    private static Method findPhase(Class<?> type, String phase) {
        Method[] candidates = ReflectionUtils.getUniqueDeclaredMethods(type,
                m -> (m.getName().equals(phase) || m.getName().equals(phase + "Async"))
                        && Modifier.isPublic(m.getModifiers())
                        && !m.isBridge()
                        && !m.isSynthetic());
        if (candidates.length > 1) {
            throw new IllegalStateException("Middleware " + type.getName() + " declares more than one " + phase + " method");
        }
        return candidates.length == 1 ? candidates[0] : null;
    }
}
