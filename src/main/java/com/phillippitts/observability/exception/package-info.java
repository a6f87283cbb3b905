/**
 * Exception hierarchy of the observability layer.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.observability.exception.ObservabilityException} - Base exception
 *       for errors raised by instrumentation code</li>
 *   <li>{@link com.phillippitts.observability.exception.StorageWriteException} - Thrown by
 *       storage adapters when a log entry or metric sample cannot be written</li>
 *   <li>{@link com.phillippitts.observability.exception.ContextCleanupException} - Wraps a
 *       failure while releasing a request context</li>
 * </ul>
 *
 * <p>None of these exceptions ever reach the caller of an instrumented request: storage and
 * cleanup failures are reported on the {@code observability.diagnostics} logger instead.
 * Exceptions thrown by the wrapped handler are rethrown unchanged and are not wrapped here.
 *
 * @see com.phillippitts.observability.service.write.WriteDiagnostics
 * @since 1.0
 */
package com.phillippitts.observability.exception;
