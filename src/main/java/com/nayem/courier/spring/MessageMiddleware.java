package com.nayem.courier.spring;

import com.nayem.courier.core.Lifetime;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as middleware. Its phases are the methods named {@code before}, {@code after},
 * {@code onFinally} and {@code execute}, each optionally with an {@code Async} suffix.
 * <p>
 * The first parameter of every phase is the message. Its declared type decides which messages
 * the middleware applies to; {@code Object} applies to all of them. In {@code after} and
 * {@code onFinally}, a parameter annotated {@link Response} receives the handler result, a
 * {@link Throwable} parameter receives the failure, and other parameters receive the state
 * returned by {@code before}. {@code execute} takes a
 * {@link com.nayem.courier.pipeline.PipelineExecution} to run the rest of the pipeline.
 * </p>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MessageMiddleware {

    /**
     * Lower values run {@code before} earlier and {@code after} and {@code onFinally} later.
     */
    int order() default Integer.MAX_VALUE;

    Lifetime lifetime() default Lifetime.DEFAULT;

    /**
     * When set, the middleware only runs for handlers that name it in {@link UseMiddleware}.
     */
    boolean explicitOnly() default false;
}
