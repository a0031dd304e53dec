package com.nayem.courier.spring;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Adds middleware to a handler class or a single handler method, including middleware declared
 * {@link MessageMiddleware#explicitOnly() explicit-only}.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface UseMiddleware {

    Class<?>[] value();
}
