/**
 * Value types produced by request instrumentation: log entries, metric samples and the
 * fixed histogram bucket boundaries.
 *
 * <p>All types are immutable and safe to hand to storage adapters on any thread.
 *
 * @since 1.0
 */
package com.phillippitts.observability.domain;
