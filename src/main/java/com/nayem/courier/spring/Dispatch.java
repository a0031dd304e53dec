package com.nayem.courier.spring;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Publishes the message returned by the annotated method.
 * <p>
 * The method body runs as usual and builds the message. Courier then publishes it to every
 * applicable handler and the caller receives the message unchanged. A {@code null} return
 * publishes nothing.
 * </p>
 *
 * <pre>{@code
 * @Service
 * public class AccountService {
 *
 *     @Dispatch
 *     public AccountOpened open(String owner) {
 *         return new AccountOpened(UUID.randomUUID(), owner);
 *     }
 * }
 * }</pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Dispatch {

    /**
     * Whether the caller waits for every handler to complete. When {@code false} the method returns
     * immediately and handler failures are logged.
     */
    boolean await() default true;
}
