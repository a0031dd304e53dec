package com.nayem.courier.registry;

import com.nayem.courier.pipeline.MiddlewareContext;
import com.nayem.courier.pipeline.PipelineExecution;

/**
 * Calls the {@code execute} phase of a middleware, which wraps the rest of the pipeline.
 * The phase decides whether and how often to call {@code next}.
 */
@FunctionalInterface
public interface ExecuteInvoker {

    Object invoke(Object middleware, MiddlewareContext context, PipelineExecution next) throws Exception;
}
