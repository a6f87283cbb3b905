/**
 * Time-boxed storage writes and the diagnostics channel for writes that did not complete.
 *
 * @since 1.0
 */
package com.phillippitts.observability.service.write;
