package com.nayem.courier.pipeline;

import com.nayem.courier.core.CancellationToken;
import com.nayem.courier.core.CourierEngine;
import com.nayem.courier.core.HandlerResult;
import com.nayem.courier.core.Tuple;
import com.nayem.courier.exception.DispatchCancelledException;
import com.nayem.courier.registry.HandlerDescriptor;
import com.nayem.courier.registry.HandlerRegistry;
import com.nayem.courier.registry.MiddlewareDescriptor;
import com.nayem.courier.registry.MiddlewareRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MiddlewarePipelineTest {

    record Order(String id) {
    }

    record Stopwatch(long startedAt) {
    }

    private final List<String> trace = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger handlerCalls = new AtomicInteger();

    private HandlerRegistry orderHandler(String result) {
        return HandlerRegistry.builder()
                .register(HandlerDescriptor.function(Order.class, order -> {
                    handlerCalls.incrementAndGet();
                    trace.add("Handler");
                    return result;
                }))
                .build();
    }

    private MiddlewareDescriptor tracing(String name, int order) {
        return MiddlewareDescriptor.builder(Object.class)
                .name(name)
                .order(order)
                .instance(new Object())
                .before((middleware, context) -> {
                    trace.add("Before(" + name + ")");
                    return null;
                })
                .after((middleware, context) -> {
                    trace.add("After(" + name + ")");
                    return null;
                })
                .onFinally((middleware, context) -> {
                    trace.add("Finally(" + name + ")");
                    return null;
                })
                .build();
    }

    @Test
    void testPhasesRunAsAStack() {
        CourierEngine engine = CourierEngine.builder()
                .handlers(orderHandler("ok"))
                .middleware(MiddlewareRegistry.builder()
                        .register(tracing("m2", 2))
                        .register(tracing("m1", 1))
                        .build())
                .build();

        assertEquals("ok", engine.invoke(new Order("1"), String.class));
        assertThat(trace).containsExactly(
                "Before(m1)", "Before(m2)", "Handler", "After(m2)", "After(m1)", "Finally(m2)", "Finally(m1)");
    }

    @Test
    void testAsyncPipelineKeepsTheSameOrder() {
        CompletableFuture<Object> slowBefore = new CompletableFuture<>();
        MiddlewareDescriptor asyncMiddleware = MiddlewareDescriptor.builder(Object.class)
                .name("async")
                .order(1)
                .instance(new Object())
                .beforeAsync((middleware, context) -> {
                    trace.add("Before(async)");
                    return slowBefore;
                })
                .afterAsync((middleware, context) -> {
                    trace.add("After(async)");
                    return CompletableFuture.completedFuture(null);
                })
                .onFinallyAsync((middleware, context) -> {
                    trace.add("Finally(async)");
                    return CompletableFuture.completedFuture(null);
                })
                .build();

        CourierEngine engine = CourierEngine.builder()
                .handlers(orderHandler("ok"))
                .middleware(MiddlewareRegistry.builder()
                        .register(asyncMiddleware)
                        .register(tracing("sync", 2))
                        .build())
                .build();

        CompletableFuture<String> result = engine.invokeAsync(new Order("1"), String.class);
        assertThat(trace).containsExactly("Before(async)");

        slowBefore.complete(null);

        assertEquals("ok", result.join());
        assertThat(trace).containsExactly("Before(async)", "Before(sync)", "Handler",
                "After(sync)", "After(async)", "Finally(sync)", "Finally(async)");
    }

    @Test
    void testFinallyRunsOnceWithTheHandlerFailure() {
        IllegalStateException failure = new IllegalStateException("handler broke");
        AtomicInteger finallyCalls = new AtomicInteger();
        AtomicReference<Throwable> seen = new AtomicReference<>();

        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.function(Order.class, order -> {
                            throw failure;
                        }))
                        .build())
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .instance(new Object())
                                .onFinally((middleware, context) -> {
                                    finallyCalls.incrementAndGet();
                                    seen.set(context.exception());
                                    return null;
                                })
                                .build())
                        .build())
                .build();

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> engine.invoke(new Order("1"), String.class));

        assertSame(failure, thrown);
        assertEquals(1, finallyCalls.get());
        assertSame(failure, seen.get());
    }

    @Test
    void testAfterIsSkippedWhenHandlerFails() {
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.function(Order.class, order -> {
                            trace.add("Handler");
                            throw new IllegalArgumentException("no");
                        }))
                        .build())
                .middleware(MiddlewareRegistry.builder().register(tracing("m", 1)).build())
                .build();

        assertThrows(IllegalArgumentException.class, () -> engine.invoke(new Order("1"), String.class));
        assertThat(trace).containsExactly("Before(m)", "Handler", "Finally(m)");
    }

    @Test
    void testShortCircuitSkipsHandlerAndAfter() {
        AtomicInteger afterCalls = new AtomicInteger();
        AtomicInteger finallyCalls = new AtomicInteger();
        AtomicReference<Throwable> finallyException = new AtomicReference<>(new RuntimeException("unset"));

        CourierEngine engine = CourierEngine.builder()
                .handlers(orderHandler("ok"))
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .order(1)
                                .instance(new Object())
                                .before((middleware, context) -> HandlerResult.shortCircuit("blocked"))
                                .after((middleware, context) -> afterCalls.incrementAndGet())
                                .onFinally((middleware, context) -> {
                                    finallyCalls.incrementAndGet();
                                    finallyException.set(context.exception());
                                    return null;
                                })
                                .build())
                        .register(tracing("later", 2))
                        .build())
                .build();

        assertEquals("blocked", engine.invoke(new Order("1"), String.class));
        assertEquals(0, handlerCalls.get());
        assertEquals(0, afterCalls.get());
        assertEquals(1, finallyCalls.get());
        assertNull(finallyException.get());
        // the later middleware never ran its before, but its finally still runs
        assertThat(trace).containsExactly("Finally(later)");
    }

    @Test
    void testShortCircuitDoesNotConstructHandler() {
        AtomicInteger constructed = new AtomicInteger();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.builder(Order.class, Object.class)
                                .instanceFactory((locator, scope) -> {
                                    constructed.incrementAndGet();
                                    return new Object();
                                })
                                .invoker((handler, message, context) -> "ok")
                                .build())
                        .build())
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .instance(new Object())
                                .before((middleware, context) -> HandlerResult.shortCircuit("cached"))
                                .build())
                        .build())
                .build();

        assertEquals("cached", engine.invoke(new Order("1"), String.class));
        assertEquals(0, constructed.get());
    }

    @Test
    void testFailingFinallyIsSuppressedOntoOriginalFailure() {
        IllegalStateException original = new IllegalStateException("handler broke");
        IllegalArgumentException cleanup = new IllegalArgumentException("cleanup broke");
        AtomicInteger outerFinally = new AtomicInteger();

        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.function(Order.class, order -> {
                            throw original;
                        }))
                        .build())
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .order(1)
                                .instance(new Object())
                                .onFinally((middleware, context) -> outerFinally.incrementAndGet())
                                .build())
                        .register(MiddlewareDescriptor.builder(String.class)
                                .messageType(Object.class)
                                .order(2)
                                .instance("inner")
                                .onFinally((middleware, context) -> {
                                    throw cleanup;
                                })
                                .build())
                        .build())
                .build();

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> engine.invoke(new Order("1"), String.class));

        assertSame(original, thrown);
        assertThat(thrown.getSuppressed()).containsExactly(cleanup);
        assertEquals(1, outerFinally.get());
    }

    @Test
    void testFailingFinallyAfterSuccessSurfaces() {
        IllegalArgumentException cleanup = new IllegalArgumentException("cleanup broke");
        CourierEngine engine = CourierEngine.builder()
                .handlers(orderHandler("ok"))
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .instance(new Object())
                                .onFinally((middleware, context) -> {
                                    throw cleanup;
                                })
                                .build())
                        .build())
                .build();

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> engine.invoke(new Order("1"), String.class));
        assertSame(cleanup, thrown);
        assertEquals(1, handlerCalls.get());
    }

    @Test
    void testStateFromBeforeReachesAfterAndFinally() {
        AtomicReference<Stopwatch> afterSaw = new AtomicReference<>();
        AtomicReference<String> finallySaw = new AtomicReference<>();
        Stopwatch stopwatch = new Stopwatch(42L);

        CourierEngine engine = CourierEngine.builder()
                .handlers(orderHandler("ok"))
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .instance(new Object())
                                .before((middleware, context) -> Tuple.of(stopwatch, "trace-7", null))
                                .after((middleware, context) -> {
                                    afterSaw.set(context.state(Stopwatch.class).orElseThrow());
                                    return null;
                                })
                                .onFinally((middleware, context) -> {
                                    finallySaw.set(context.state(String.class).orElse(null));
                                    return null;
                                })
                                .build())
                        .build())
                .build();

        engine.invoke(new Order("1"), String.class);

        assertSame(stopwatch, afterSaw.get());
        assertEquals("trace-7", finallySaw.get());
    }

    @Test
    void testOwnStateWinsOverEarlierMiddlewareState() {
        AtomicReference<String> innerSaw = new AtomicReference<>();
        AtomicReference<String> outerSaw = new AtomicReference<>();

        CourierEngine engine = CourierEngine.builder()
                .handlers(orderHandler("ok"))
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .order(1)
                                .instance(new Object())
                                .before((middleware, context) -> HandlerResult.proceed("outer"))
                                .after((middleware, context) -> {
                                    outerSaw.set(context.state(String.class).orElseThrow());
                                    return null;
                                })
                                .build())
                        .register(MiddlewareDescriptor.builder(StringBuilder.class)
                                .messageType(Object.class)
                                .order(2)
                                .instance(new StringBuilder())
                                .before((middleware, context) -> "inner")
                                .after((middleware, context) -> {
                                    innerSaw.set(context.state(String.class).orElseThrow());
                                    return null;
                                })
                                .build())
                        .build())
                .build();

        engine.invoke(new Order("1"), String.class);

        assertEquals("inner", innerSaw.get());
        assertEquals("outer", outerSaw.get());
    }

    @Test
    void testExecuteRetriesTheWholePipeline() {
        AtomicInteger attempts = new AtomicInteger();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.function(Order.class, order -> {
                            trace.add("Handler");
                            if (attempts.incrementAndGet() < 3) {
                                throw new IllegalStateException("transient");
                            }
                            return "ok";
                        }))
                        .build())
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .order(1)
                                .instance(new Object())
                                .execute((middleware, context, next) -> {
                                    for (int attempt = 1; ; attempt++) {
                                        try {
                                            return next.proceed();
                                        } catch (IllegalStateException e) {
                                            if (attempt == 5) {
                                                throw e;
                                            }
                                        }
                                    }
                                })
                                .build())
                        .register(tracing("m", 2))
                        .build())
                .build();

        assertEquals("ok", engine.invoke(new Order("1"), String.class));
        assertEquals(3, attempts.get());
        assertThat(trace).containsExactly(
                "Before(m)", "Handler", "Finally(m)",
                "Before(m)", "Handler", "Finally(m)",
                "Before(m)", "Handler", "After(m)", "Finally(m)");
    }

    @Test
    void testAsyncExecuteWrapsAsyncPipeline() {
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.asyncFunction(Order.class,
                                order -> CompletableFuture.completedFuture("ok")))
                        .build())
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .instance(new Object())
                                .executeAsync((middleware, context, next) -> {
                                    trace.add("enter");
                                    return next.proceedAsync().thenApply(result -> {
                                        trace.add("exit");
                                        return result + "!";
                                    });
                                })
                                .build())
                        .build())
                .build();

        assertEquals("ok!", engine.invokeAsync(new Order("1"), String.class).join());
        assertThat(trace).containsExactly("enter", "exit");
    }

    @Test
    void testCancelledTokenStopsBeforeHandler() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger finallyCalls = new AtomicInteger();

        CourierEngine engine = CourierEngine.builder()
                .handlers(orderHandler("ok"))
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .instance(new Object())
                                .before((middleware, context) -> {
                                    token.cancel();
                                    return null;
                                })
                                .onFinally((middleware, context) -> {
                                    finallyCalls.incrementAndGet();
                                    assertThat(context.exception()).isInstanceOf(DispatchCancelledException.class);
                                    return null;
                                })
                                .build())
                        .build())
                .build();

        assertThrows(DispatchCancelledException.class, () -> engine.invoke(new Order("1"), String.class, token));
        assertEquals(0, handlerCalls.get());
        assertEquals(1, finallyCalls.get());
    }

    @Test
    void testAsyncCancellationFailsTheFuture() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        CourierEngine engine = CourierEngine.builder().handlers(orderHandler("ok")).build();

        CompletableFuture<String> result = engine.invokeAsync(new Order("1"), String.class, token);

        Throwable failure = result.handle((value, error) -> error).join();
        Throwable cause = failure instanceof CompletionException ? failure.getCause() : failure;
        assertThat(cause).isInstanceOf(DispatchCancelledException.class);
        assertEquals(0, handlerCalls.get());
    }

    @Test
    void testExactTypeMiddlewareRunsBeforeUniversalWithEqualOrder() {
        MiddlewareDescriptor universal = MiddlewareDescriptor.builder(Object.class)
                .name("universal")
                .instance(new Object())
                .before((middleware, context) -> trace.add("universal"))
                .build();
        MiddlewareDescriptor specific = MiddlewareDescriptor.builder(StringBuilder.class)
                .name("specific")
                .messageType(Order.class)
                .instance(new StringBuilder())
                .before((middleware, context) -> trace.add("specific"))
                .build();

        CourierEngine engine = CourierEngine.builder()
                .handlers(orderHandler("ok"))
                .middleware(MiddlewareRegistry.builder().register(universal).register(specific).build())
                .build();

        engine.invoke(new Order("1"), String.class);

        assertThat(trace).containsExactly("specific", "universal", "Handler");
    }

    @Test
    void testAsyncFailingFinallyIsSuppressedOntoOriginalFailure() {
        IllegalStateException original = new IllegalStateException("handler broke");
        IllegalArgumentException cleanup = new IllegalArgumentException("cleanup broke");
        AtomicInteger outerFinally = new AtomicInteger();

        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.asyncFunction(Order.class,
                                order -> CompletableFuture.failedFuture(original)))
                        .build())
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .order(1)
                                .instance(new Object())
                                .onFinallyAsync((middleware, context) -> {
                                    outerFinally.incrementAndGet();
                                    return CompletableFuture.completedFuture(null);
                                })
                                .build())
                        .register(MiddlewareDescriptor.builder(String.class)
                                .messageType(Object.class)
                                .order(2)
                                .instance("inner")
                                .onFinallyAsync((middleware, context) -> CompletableFuture.failedFuture(cleanup))
                                .build())
                        .build())
                .build();

        Throwable failure = engine.invokeAsync(new Order("1"), String.class).handle((value, error) -> error).join();
        Throwable cause = failure instanceof CompletionException ? failure.getCause() : failure;

        assertSame(original, cause);
        assertThat(cause.getSuppressed()).containsExactly(cleanup);
        assertEquals(1, outerFinally.get());
    }

    @Test
    void testAsyncExecuteRetriesTheWholePipeline() {
        AtomicInteger attempts = new AtomicInteger();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.asyncFunction(Order.class, order -> {
                            trace.add("Handler");
                            if (attempts.incrementAndGet() < 3) {
                                return CompletableFuture.failedFuture(new IllegalStateException("transient"));
                            }
                            return CompletableFuture.completedFuture("ok");
                        }))
                        .build())
                .middleware(MiddlewareRegistry.builder()
                        .register(MiddlewareDescriptor.builder(Object.class)
                                .order(1)
                                .instance(new Object())
                                .executeAsync((middleware, context, next) -> retry(next, 5))
                                .build())
                        .register(tracing("m", 2))
                        .build())
                .build();

        assertEquals("ok", engine.invokeAsync(new Order("1"), String.class).join());
        assertEquals(3, attempts.get());
        assertThat(trace).containsExactly(
                "Before(m)", "Handler", "Finally(m)",
                "Before(m)", "Handler", "Finally(m)",
                "Before(m)", "Handler", "After(m)", "Finally(m)");
    }

    private static CompletableFuture<Object> retry(PipelineExecution next, int remaining) {
        return next.proceedAsync().exceptionallyCompose(error -> remaining > 1
                ? retry(next, remaining - 1)
                : CompletableFuture.failedFuture(error));
    }
}
