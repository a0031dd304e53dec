package com.nayem.courier.pipeline;

import com.nayem.courier.exception.SyncPipelineViolationException;
import com.nayem.courier.registry.ExecuteInvoker;
import com.nayem.courier.registry.HandlerDescriptor;
import com.nayem.courier.registry.MiddlewareDescriptor;
import com.nayem.courier.registry.MiddlewarePhase;
import com.nayem.courier.registry.PhaseInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Runs one handler inside its middleware chain.
 * <p>
 * {@code execute} phases wrap everything else, outermost first. Inside them, {@code before}
 * phases run in ascending order, then the handler, then {@code after} phases in descending
 * order, then {@code onFinally} phases in descending order. A short-circuit skips the handler
 * and every {@code after}. A failure skips every remaining {@code after}. Every {@code onFinally}
 * runs in all cases.
 * </p>
 */
public final class MiddlewarePipeline {

    private static final Logger log = LoggerFactory.getLogger(MiddlewarePipeline.class);

    private MiddlewarePipeline() {
    }

    /**
     * Fails fast when a synchronous call would have to wait on an asynchronous participant.
     *
     * @throws SyncPipelineViolationException if the handler or any middleware phase is asynchronous
     */
    public static void requireSynchronous(HandlerDescriptor handler, List<MiddlewareDescriptor> chain) {
        if (handler.isAsync()) {
            throw new SyncPipelineViolationException("Handler " + handler.name() + " for "
                    + handler.messageType().getName() + " is asynchronous; use invokeAsync or publishAsync");
        }
        for (MiddlewareDescriptor middleware : chain) {
            if (middleware.isAsync()) {
                throw new SyncPipelineViolationException("Middleware " + middleware.name() + " used by "
                        + handler.name() + " has asynchronous phases; use invokeAsync or publishAsync");
            }
        }
    }

    /**
     * Runs the pipeline on the calling thread. Every participant must be synchronous.
     *
     * @return the handler result, the short-circuit value, or what the outermost {@code execute} returned
     */
    public static Object run(PipelineState state) throws Exception {
        return runExecute(state, executePositions(state), 0);
    }

    /**
     * Runs the pipeline, awaiting asynchronous participants without blocking.
     * Synchronous phases run on whichever thread completes the previous step.
     */
    public static CompletableFuture<Object> runAsync(PipelineState state) {
        return runExecuteAsync(state, executePositions(state), 0);
    }

    private static List<Integer> executePositions(PipelineState state) {
        List<Integer> positions = new ArrayList<>();
        List<BoundMiddleware> chain = state.chain();
        for (int i = 0; i < chain.size(); i++) {
            if (chain.get(i).descriptor().hasExecute()) {
                positions.add(i);
            }
        }
        return positions;
    }

    // --- synchronous ---

    private static Object runExecute(PipelineState state, List<Integer> executes, int index) throws Exception {
        if (index == executes.size()) {
            return runCore(state);
        }
        int position = executes.get(index);
        BoundMiddleware middleware = state.chain().get(position);
        PipelineExecution next = new PipelineExecution() {
            @Override
            public Object proceed() throws Exception {
                return runExecute(state, executes, index + 1);
            }

            @Override
            public CompletableFuture<Object> proceedAsync() {
                try {
                    return CompletableFuture.completedFuture(runExecute(state, executes, index + 1));
                } catch (Exception e) {
                    return CompletableFuture.failedFuture(e);
                }
            }
        };
        return middleware.descriptor().execute().invoker()
                .invoke(middleware.instance(), new MiddlewareContext(state, position), next);
    }

    private static Object runCore(PipelineState state) throws Exception {
        state.beginAttempt();
        List<BoundMiddleware> chain = state.chain();
        try {
            for (int i = 0; i < chain.size() && !state.isShortCircuited(); i++) {
                state.cancellationToken().throwIfCancellationRequested();
                BoundMiddleware middleware = chain.get(i);
                if (middleware.descriptor().hasBefore()) {
                    Object output = middleware.descriptor().before().invoker()
                            .invoke(middleware.instance(), new MiddlewareContext(state, i));
                    state.recordBefore(i, output);
                }
            }

            if (!state.isShortCircuited()) {
                state.cancellationToken().throwIfCancellationRequested();
                Object result = state.handler().invoker()
                        .invoke(state.handlerInstance(), state.message(), new InvocationContext(state));
                state.recordResult(result);

                state.cancellationToken().throwIfCancellationRequested();
                for (int i = chain.size() - 1; i >= 0; i--) {
                    BoundMiddleware middleware = chain.get(i);
                    if (middleware.descriptor().hasAfter()) {
                        middleware.descriptor().after().invoker()
                                .invoke(middleware.instance(), new MiddlewareContext(state, i));
                    }
                }
            }
        } catch (Throwable t) {
            state.recordException(unwrap(t));
        }

        Throwable failure = state.exception();
        for (int i = chain.size() - 1; i >= 0; i--) {
            BoundMiddleware middleware = chain.get(i);
            if (!middleware.descriptor().hasFinally()) {
                continue;
            }
            try {
                middleware.descriptor().onFinally().invoker()
                        .invoke(middleware.instance(), new MiddlewareContext(state, i));
            } catch (Throwable t) {
                failure = mergeFinallyFailure(failure, unwrap(t), middleware);
            }
        }

        if (failure != null) {
            throw rethrow(failure);
        }
        return state.result();
    }

    // --- asynchronous ---

    private static CompletableFuture<Object> runExecuteAsync(PipelineState state, List<Integer> executes, int index) {
        if (index == executes.size()) {
            return runCoreAsync(state);
        }
        int position = executes.get(index);
        BoundMiddleware middleware = state.chain().get(position);
        PipelineExecution next = new PipelineExecution() {
            @Override
            public Object proceed() throws Exception {
                try {
                    return runExecuteAsync(state, executes, index + 1).join();
                } catch (CompletionException e) {
                    throw rethrow(unwrap(e));
                }
            }

            @Override
            public CompletableFuture<Object> proceedAsync() {
                return runExecuteAsync(state, executes, index + 1);
            }
        };
        MiddlewarePhase<ExecuteInvoker> phase = middleware.descriptor().execute();
        try {
            Object output = phase.invoker().invoke(middleware.instance(), new MiddlewareContext(state, position), next);
            return phase.async() ? toFuture(output) : CompletableFuture.completedFuture(output);
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(unwrap(t));
        }
    }

    private static CompletableFuture<Object> runCoreAsync(PipelineState state) {
        state.beginAttempt();
        int size = state.chain().size();

        CompletableFuture<Object> main = runBeforesAsync(state, 0)
                .thenCompose(ignored -> state.isShortCircuited()
                        ? CompletableFuture.<Object>completedFuture(null)
                        : invokeHandlerAsync(state).thenCompose(result -> {
                            state.recordResult(result);
                            state.cancellationToken().throwIfCancellationRequested();
                            return runAftersAsync(state, size - 1);
                        }));

        return main
                .handle((ignored, error) -> {
                    if (error != null) {
                        state.recordException(unwrap(error));
                    }
                    return state.exception();
                })
                .thenCompose(failure -> runFinallyAsync(state, size - 1, failure))
                .thenCompose(failure -> failure != null
                        ? CompletableFuture.<Object>failedFuture(failure)
                        : CompletableFuture.<Object>completedFuture(state.result()));
    }

    private static CompletableFuture<Object> runBeforesAsync(PipelineState state, int position) {
        if (position >= state.chain().size() || state.isShortCircuited()) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            state.cancellationToken().throwIfCancellationRequested();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        BoundMiddleware middleware = state.chain().get(position);
        if (!middleware.descriptor().hasBefore()) {
            return runBeforesAsync(state, position + 1);
        }
        return invokePhaseAsync(middleware.descriptor().before(), middleware, state, position)
                .thenCompose(output -> {
                    state.recordBefore(position, output);
                    return runBeforesAsync(state, position + 1);
                });
    }

    private static CompletableFuture<Object> invokeHandlerAsync(PipelineState state) {
        try {
            state.cancellationToken().throwIfCancellationRequested();
            Object output = state.handler().invoker()
                    .invoke(state.handlerInstance(), state.message(), new InvocationContext(state));
            return state.handler().isAsync() ? toFuture(output) : CompletableFuture.completedFuture(output);
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(unwrap(t));
        }
    }

    private static CompletableFuture<Object> runAftersAsync(PipelineState state, int position) {
        if (position < 0) {
            return CompletableFuture.completedFuture(null);
        }
        BoundMiddleware middleware = state.chain().get(position);
        if (!middleware.descriptor().hasAfter()) {
            return runAftersAsync(state, position - 1);
        }
        return invokePhaseAsync(middleware.descriptor().after(), middleware, state, position)
                .thenCompose(ignored -> runAftersAsync(state, position - 1));
    }

    private static CompletableFuture<Throwable> runFinallyAsync(PipelineState state, int position, Throwable failure) {
        if (position < 0) {
            return CompletableFuture.completedFuture(failure);
        }
        BoundMiddleware middleware = state.chain().get(position);
        if (!middleware.descriptor().hasFinally()) {
            return runFinallyAsync(state, position - 1, failure);
        }
        return invokePhaseAsync(middleware.descriptor().onFinally(), middleware, state, position)
                .handle((ignored, error) -> error == null
                        ? failure
                        : mergeFinallyFailure(failure, unwrap(error), middleware))
                .thenCompose(merged -> runFinallyAsync(state, position - 1, merged));
    }

    private static CompletableFuture<Object> invokePhaseAsync(MiddlewarePhase<PhaseInvoker> phase,
            BoundMiddleware middleware, PipelineState state, int position) {
        try {
            Object output = phase.invoker().invoke(middleware.instance(), new MiddlewareContext(state, position));
            return phase.async() ? toFuture(output) : CompletableFuture.completedFuture(output);
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(unwrap(t));
        }
    }

    // --- helpers ---

    @SuppressWarnings("unchecked")
    private static CompletableFuture<Object> toFuture(Object output) {
        if (output == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (output instanceof CompletionStage<?> stage) {
            return ((CompletionStage<Object>) stage).toCompletableFuture();
        }
        return CompletableFuture.completedFuture(output);
    }

    private static Throwable mergeFinallyFailure(Throwable primary, Throwable finallyFailure,
            BoundMiddleware middleware) {
        log.warn("onFinally of middleware {} failed: {}", middleware.descriptor().name(), finallyFailure.toString());
        if (primary == null) {
            return finallyFailure;
        }
        if (primary != finallyFailure) {
            primary.addSuppressed(finallyFailure);
        }
        return primary;
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Exception rethrow(Throwable failure) {
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure instanceof Exception exception) {
            return exception;
        }
        return new IllegalStateException(failure);
    }
}
