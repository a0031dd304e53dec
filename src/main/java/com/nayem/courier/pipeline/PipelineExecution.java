package com.nayem.courier.pipeline;

import java.util.concurrent.CompletableFuture;

/**
 * The remainder of the pipeline, as seen by an {@code execute} phase.
 * <p>
 * Each call runs the inner {@code execute} phases, every {@code before}, the handler, every
 * {@code after} and every {@code onFinally} again from scratch, so an {@code execute} phase
 * may call it more than once to retry.
 * </p>
 */
public interface PipelineExecution {

    Object proceed() throws Exception;

    CompletableFuture<Object> proceedAsync();
}
