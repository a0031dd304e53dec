package com.nayem.courier.spring;

import com.nayem.courier.core.Lifetime;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class whose {@code handle}, {@code handleAsync}, {@code consume} and {@code consumeAsync}
 * methods handle messages.
 * <p>
 * The first parameter of each such method is the message; its declared type is the message type
 * the method is registered for. Further parameters are bound from the call: a
 * {@link com.nayem.courier.core.CancellationToken}, the {@link com.nayem.courier.core.ScopeContext},
 * the {@link com.nayem.courier.core.Mediator}, the
 * {@link com.nayem.courier.pipeline.InvocationContext}, or any bean from the application context.
 * </p>
 *
 * <pre>{@code
 * @MessageHandler
 * public class OrderHandler {
 *
 *     public Tuple handle(CreateOrder command, OrderRepository orders) {
 *         Order order = orders.save(command);
 *         return Tuple.of(order, new OrderCreated(order.id()));
 *     }
 * }
 * }</pre>
 *
 * A method returning a {@link java.util.concurrent.CompletionStage} is asynchronous. A method
 * returning a {@link com.nayem.courier.core.Tuple} cascades the elements the caller did not ask for.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MessageHandler {

    /**
     * Position among the handlers of a published message; lower runs first.
     * Spring's {@link org.springframework.core.annotation.Order} on a method takes precedence.
     */
    int order() default Integer.MAX_VALUE;

    Lifetime lifetime() default Lifetime.DEFAULT;
}
