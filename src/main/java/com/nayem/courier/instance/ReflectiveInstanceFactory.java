package com.nayem.courier.instance;

import com.nayem.courier.core.ScopeContext;
import com.nayem.courier.core.ServiceLocator;
import com.nayem.courier.exception.ConstructionException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;

final class ReflectiveInstanceFactory implements InstanceFactory {

    private final Class<?> type;

    ReflectiveInstanceFactory(Class<?> type) {
        this.type = type;
    }

    @Override
    public Object create(ServiceLocator locator, ScopeContext scope) throws Exception {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new ConstructionException(type, "type is not instantiable");
        }

        Constructor<?> constructor = selectConstructor();
        Class<?>[] parameterTypes = constructor.getParameterTypes();
        Object[] args = new Object[parameterTypes.length];
        for (int i = 0; i < parameterTypes.length; i++) {
            args[i] = resolveArgument(parameterTypes[i], locator, scope);
        }

        constructor.setAccessible(true);
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    // Public constructors win over non-public ones; among those, the one with the most parameters.
    private Constructor<?> selectConstructor() {
        Constructor<?>[] constructors = type.getDeclaredConstructors();
        if (constructors.length == 0) {
            throw new ConstructionException(type, "no constructor found");
        }
        return Arrays.stream(constructors)
                .max(Comparator
                        .<Constructor<?>>comparingInt(c -> Modifier.isPublic(c.getModifiers()) ? 1 : 0)
                        .thenComparingInt(Constructor::getParameterCount))
                .orElseThrow();
    }

    private static Object resolveArgument(Class<?> parameterType, ServiceLocator locator, ScopeContext scope) {
        if (parameterType == ServiceLocator.class) {
            return locator;
        }
        if (parameterType == ScopeContext.class) {
            return scope;
        }
        return locator.resolve(parameterType, scope);
    }

    @Override
    public String toString() {
        return "ReflectiveInstanceFactory[" + type.getName() + "]";
    }
}
