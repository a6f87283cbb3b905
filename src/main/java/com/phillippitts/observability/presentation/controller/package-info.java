/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.observability.presentation.controller.PingController}
 *       - {@code GET /ping}, logs through Log4j2 with the request's log context</li>
 *   <li>{@link com.phillippitts.observability.presentation.controller.UserController}
 *       - {@code GET /users/{id}}, exercises context propagation into the application pool</li>
 *   <li>{@link com.phillippitts.observability.presentation.controller.LogsController}
 *       - {@code GET /logs?since=&level=}, reads the log storage</li>
 * </ul>
 *
 * <p>All endpoints except {@code /logs} run inside the instrumentation filter.
 *
 * @see com.phillippitts.observability.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.observability.presentation.controller;
