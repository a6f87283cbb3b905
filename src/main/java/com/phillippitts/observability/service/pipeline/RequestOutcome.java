package com.phillippitts.observability.service.pipeline;

import com.phillippitts.observability.service.context.RequestContext;

/**
 * What the pipeline observed about one finished request.
 *
 * @param request the inbound request
 * @param context the request's context (still live during finalization)
 * @param statusCode response status, {@code 500} when the handler threw
 * @param durationNanos elapsed handler time
 * @param error handler exception, or {@code null} on success
 */
record RequestOutcome(InboundRequest request,
                      RequestContext context,
                      int statusCode,
                      long durationNanos,
                      Throwable error) {

    double durationMillis() {
        return durationNanos / 1_000_000.0;
    }

    double durationSeconds() {
        return durationNanos / 1_000_000_000.0;
    }
}
