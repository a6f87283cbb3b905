/**
 * Storage ports and the bundled adapters.
 *
 * <p>Adapters:
 * <ul>
 *   <li>{@link com.phillippitts.observability.service.storage.RingBufferLogStorage} - bounded,
 *       default for the application</li>
 *   <li>{@link com.phillippitts.observability.service.storage.InMemoryLogStorage} - unbounded</li>
 *   <li>{@link com.phillippitts.observability.service.storage.MicrometerMetricsStorage} - default
 *       metrics backend, scraped via {@code /actuator/prometheus}</li>
 *   <li>{@link com.phillippitts.observability.service.storage.InMemoryMetricsStorage} - raw samples</li>
 * </ul>
 */
package com.phillippitts.observability.service.storage;
