/**
 * Request instrumentation pipeline.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.observability.service.pipeline.InstrumentationPipeline} - blocking
 *       and asynchronous entry points sharing one lifecycle</li>
 *   <li>{@link com.phillippitts.observability.service.pipeline.InstrumentedAsyncHandler} - decorator
 *       for function-style async transports</li>
 *   <li>{@link com.phillippitts.observability.service.pipeline.MiddlewareConfig} - immutable
 *       per-pipeline configuration</li>
 * </ul>
 *
 * <p>Request log entry attributes:
 * <ul>
 *   <li>{@code request_id}, {@code method}, {@code path}, {@code route}</li>
 *   <li>{@code status_code}, {@code duration_ms}</li>
 *   <li>{@code exception}, {@code exception_type} - only when the handler threw</li>
 * </ul>
 *
 * @see com.phillippitts.observability.config.logging.InstrumentationFilter
 * @since 1.0
 */
package com.phillippitts.observability.service.pipeline;
