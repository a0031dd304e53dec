package com.nayem.courier.core;

import com.nayem.courier.exception.AggregatedHandlerException;
import com.nayem.courier.exception.DispatchCancelledException;
import com.nayem.courier.exception.SyncPipelineViolationException;
import com.nayem.courier.registry.HandlerDescriptor;
import com.nayem.courier.registry.HandlerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CourierEnginePublishTest {

    interface DomainEvent {
    }

    static class AccountEvent implements DomainEvent {
    }

    static class AccountOpened extends AccountEvent {
    }

    private final List<String> trace = Collections.synchronizedList(new ArrayList<>());

    private static HandlerDescriptor ordered(Class<?> messageType, int order, Function<Object, Object> body) {
        return HandlerDescriptor.builder(messageType, Function.class)
                .name(messageType.getSimpleName() + "#" + order)
                .order(order)
                .instanceFactory(com.nayem.courier.instance.InstanceFactory.constant(body))
                .invoker((handler, message, context) -> body.apply(message))
                .build();
    }

    @Test
    void testAllHandlersRunAndFailuresAreAggregated() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        AtomicInteger third = new AtomicInteger();
        IllegalStateException boom = new IllegalStateException("boom");
        IllegalArgumentException bang = new IllegalArgumentException("bang");

        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(ordered(AccountOpened.class, 1, message -> {
                            first.incrementAndGet();
                            throw boom;
                        }))
                        .register(ordered(AccountOpened.class, 2, message -> second.incrementAndGet()))
                        .register(ordered(AccountOpened.class, 3, message -> {
                            third.incrementAndGet();
                            throw bang;
                        }))
                        .build())
                .build();

        CompletableFuture<Void> published = engine.publishAsync(new AccountOpened());

        CompletionException failure = assertThrows(CompletionException.class, published::join);
        AggregatedHandlerException aggregated = (AggregatedHandlerException) failure.getCause();
        assertThat(aggregated.getExceptions()).containsExactly(boom, bang);
        assertEquals(1, first.get());
        assertEquals(1, second.get());
        assertEquals(1, third.get());
    }

    @Test
    void testSingleFailureIsRethrownAsIs() {
        IllegalStateException boom = new IllegalStateException("boom");
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(ordered(AccountOpened.class, 1, message -> {
                            throw boom;
                        }))
                        .register(ordered(AccountOpened.class, 2, message -> "fine"))
                        .build())
                .build();

        assertThatThrownBy(() -> engine.publishAsync(new AccountOpened(), PublishStrategy.SEQUENTIAL).join())
                .isInstanceOf(CompletionException.class)
                .cause().isSameAs(boom);

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> engine.publish(new AccountOpened()));
        assertSame(boom, thrown);
    }

    @Test
    void testPublishWithoutHandlersIsANoOp() {
        CourierEngine engine = CourierEngine.builder().build();

        CompletableFuture<Void> published = engine.publishAsync(new AccountOpened());

        assertTrue(published.isDone());
        assertThat(published).isNotCompletedExceptionally();
        engine.publish(new AccountOpened());
    }

    @Test
    void testHandlersForInterfacesAndBaseClassesReceivePublishedMessage() {
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(ordered(DomainEvent.class, 3, message -> trace.add("interface")))
                        .register(ordered(AccountEvent.class, 2, message -> trace.add("base")))
                        .register(ordered(AccountOpened.class, 1, message -> trace.add("exact")))
                        .build())
                .build();

        engine.publishAsync(new AccountOpened(), PublishStrategy.SEQUENTIAL).join();

        assertThat(trace).containsExactly("exact", "base", "interface");
    }

    @Test
    void testSequentialWaitsForEachHandler() {
        CompletableFuture<Object> slow = new CompletableFuture<>();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.builder(AccountOpened.class, Object.class)
                                .order(1)
                                .async(true)
                                .instanceFactory(com.nayem.courier.instance.InstanceFactory.constant(new Object()))
                                .invoker((handler, message, context) -> slow.thenApply(v -> trace.add("slow")))
                                .build())
                        .register(ordered(AccountOpened.class, 2, message -> trace.add("fast")))
                        .build())
                .build();

        CompletableFuture<Void> published = engine.publishAsync(new AccountOpened(), PublishStrategy.SEQUENTIAL);
        assertThat(trace).isEmpty();

        slow.complete(null);
        published.join();

        assertThat(trace).containsExactly("slow", "fast");
    }

    @Test
    void testParallelStartsEveryHandlerWithoutWaiting() {
        CompletableFuture<Object> slow = new CompletableFuture<>();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.builder(AccountOpened.class, Object.class)
                                .order(1)
                                .async(true)
                                .instanceFactory(com.nayem.courier.instance.InstanceFactory.constant(new Object()))
                                .invoker((handler, message, context) -> slow.thenApply(v -> trace.add("slow")))
                                .build())
                        .register(ordered(AccountOpened.class, 2, message -> trace.add("fast")))
                        .build())
                .build();

        CompletableFuture<Void> published = engine.publishAsync(new AccountOpened(), PublishStrategy.PARALLEL);
        assertThat(trace).containsExactly("fast");
        assertThat(published).isNotDone();

        slow.complete(null);
        published.join();

        assertThat(trace).containsExactly("fast", "slow");
    }

    @Test
    void testSyncPublishRejectsAsyncParticipantsBeforeRunningAny() {
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(ordered(AccountOpened.class, 1, message -> trace.add("sync")))
                        .register(HandlerDescriptor.asyncFunction(AccountOpened.class,
                                message -> CompletableFuture.completedFuture(trace.add("async"))))
                        .build())
                .build();

        assertThrows(SyncPipelineViolationException.class, () -> engine.publish(new AccountOpened()));
        assertThat(trace).isEmpty();
    }

    @Test
    void testPublishCountsMessagesAndFailures() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(ordered(AccountOpened.class, 1, message -> "ok"))
                        .build())
                .metrics(meters)
                .publishStrategy(PublishStrategy.SEQUENTIAL)
                .build();

        engine.publishAsync(new AccountOpened()).join();
        engine.publish(new AccountOpened());

        assertEquals(2.0, meters.get("courier.publish").counter().count());
        assertEquals(PublishStrategy.SEQUENTIAL, engine.defaultPublishStrategy());
    }

    @Test
    void testCancelledParallelPublishFailsWithCancellation() {
        AtomicInteger calls = new AtomicInteger();
        CancellationToken token = CancellationToken.create();
        token.cancel();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(ordered(AccountOpened.class, 1, message -> calls.incrementAndGet()))
                        .register(ordered(AccountOpened.class, 2, message -> calls.incrementAndGet()))
                        .build())
                .build();

        CompletionException failure = assertThrows(CompletionException.class,
                () -> engine.publishAsync(new AccountOpened(), PublishStrategy.PARALLEL, token).join());

        assertThat(failure.getCause()).isInstanceOf(DispatchCancelledException.class);
        assertThat(failure.getCause().getSuppressed()).hasSize(1);
        assertEquals(0, calls.get());
    }

    @Test
    void testCancelledSequentialAndSyncPublishFailWithCancellation() {
        AtomicInteger calls = new AtomicInteger();
        CancellationToken token = CancellationToken.create();
        token.cancel();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(ordered(AccountOpened.class, 1, message -> calls.incrementAndGet()))
                        .register(ordered(AccountOpened.class, 2, message -> calls.incrementAndGet()))
                        .build())
                .build();

        assertThatThrownBy(() -> engine.publishAsync(new AccountOpened(), PublishStrategy.SEQUENTIAL, token).join())
                .isInstanceOf(CompletionException.class)
                .cause().isInstanceOf(DispatchCancelledException.class);
        assertThrows(DispatchCancelledException.class, () -> engine.publish(new AccountOpened(), token));
        assertEquals(0, calls.get());
    }

    @Test
    void testCancellationMidPublishKeepsOtherFailuresAsSuppressed() {
        CancellationToken token = CancellationToken.create();
        IllegalStateException boom = new IllegalStateException("boom");
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(ordered(AccountOpened.class, 1, message -> {
                            token.cancel();
                            throw boom;
                        }))
                        .register(ordered(AccountOpened.class, 2, message -> "never"))
                        .build())
                .build();

        DispatchCancelledException thrown = assertThrows(DispatchCancelledException.class,
                () -> engine.publish(new AccountOpened(), token));
        assertThat(thrown.getSuppressed()).containsExactly(boom);
    }

    @Test
    void testFireAndForgetReturnsBeforeHandlersRun() {
        List<Runnable> queued = new ArrayList<>();
        Executor deferred = queued::add;
        AtomicInteger calls = new AtomicInteger();
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(ordered(AccountOpened.class, 1, message -> {
                            calls.incrementAndGet();
                            throw new IllegalStateException("ignored");
                        }))
                        .register(ordered(AccountOpened.class, 2, message -> calls.incrementAndGet()))
                        .build())
                .executor(deferred)
                .metrics(meters)
                .build();

        CompletableFuture<Void> published = engine.publishAsync(new AccountOpened(), PublishStrategy.FIRE_AND_FORGET);

        assertThat(published).isCompleted();
        assertEquals(0, calls.get());
        assertThat(queued).hasSize(2);

        queued.forEach(Runnable::run);

        assertEquals(2, calls.get());
        assertThat(published).isNotCompletedExceptionally();
        assertEquals(1.0, meters.get("courier.publish.failures").counter().count());
    }

    @Test
    void testCascadesStayAttachedWhenDefaultIsFireAndForget() {
        List<Runnable> queued = new ArrayList<>();
        AtomicInteger opened = new AtomicInteger();
        CourierEngine engine = CourierEngine.builder()
                .handlers(HandlerRegistry.builder()
                        .register(HandlerDescriptor.builder(String.class, Function.class)
                                .cascading(true)
                                .instanceFactory(com.nayem.courier.instance.InstanceFactory.constant(new Object()))
                                .invoker((handler, message, context) -> Tuple.of("opened", new AccountOpened()))
                                .build())
                        .register(ordered(AccountOpened.class, 1, message -> opened.incrementAndGet()))
                        .build())
                .executor(queued::add)
                .publishStrategy(PublishStrategy.FIRE_AND_FORGET)
                .build();

        assertEquals("opened", engine.invokeAsync("open", String.class).join());
        assertEquals(1, opened.get());
        assertThat(queued).isEmpty();
    }
}
