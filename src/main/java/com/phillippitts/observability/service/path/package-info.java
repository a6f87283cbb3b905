/**
 * Path exclusion and route normalization for metric labels.
 */
package com.phillippitts.observability.service.path;
