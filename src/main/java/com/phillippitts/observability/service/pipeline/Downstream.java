package com.phillippitts.observability.service.pipeline;

/**
 * The wrapped handler invoked by {@link InstrumentationPipeline#instrument}.
 *
 * @param <R> response type
 */
@FunctionalInterface
public interface Downstream<R> {

    /**
     * Handles the request.
     *
     * @return the response
     * @throws Exception whatever the handler throws; rethrown unchanged by the pipeline
     */
    R call() throws Exception;
}
