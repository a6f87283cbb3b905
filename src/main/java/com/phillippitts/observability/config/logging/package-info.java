/**
 * Logging infrastructure: the servlet instrumentation filter and the Log4j2 bridge into log
 * storage.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.observability.config.logging.InstrumentationFilter} - Servlet filter
 *       running every HTTP request through the instrumentation pipeline</li>
 *   <li>{@link com.phillippitts.observability.config.logging.LogStorageAppender} - Log4j2 appender
 *       copying application logs, with the request context, into log storage</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - correlation id of the request (client supplied or UUID)</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.observability.config.logging;
