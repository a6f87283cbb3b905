/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.observability.config.ObservabilityConfig} - storage adapters,
 *       timed writer and the instrumentation pipeline</li>
 *   <li>{@link com.phillippitts.observability.config.ThreadPoolConfig} - telemetry and application
 *       executors</li>
 *   <li>{@link com.phillippitts.observability.config.ThreadPoolMetricsConfig} - telemetry pool gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - servlet filter and Log4j2 appender</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.observability.config;
