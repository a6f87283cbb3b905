/**
 * Ambient request context: a per-request correlation id and attribute map that nested code can
 * reach without passing it as a parameter.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.observability.service.context.RequestContextHolder} - thread-bound
 *       begin/current/end lifecycle with nested restore</li>
 *   <li>{@link com.phillippitts.observability.service.context.LogContext} - application-facing
 *       get/update API</li>
 *   <li>{@link com.phillippitts.observability.service.context.RequestContextTaskDecorator} -
 *       propagation into executor threads</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - correlation id of the request bound to the logging thread</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.observability.service.context;
