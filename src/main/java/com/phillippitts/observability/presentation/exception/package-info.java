/**
 * Translation of exceptions into HTTP error responses.
 */
package com.phillippitts.observability.presentation.exception;
