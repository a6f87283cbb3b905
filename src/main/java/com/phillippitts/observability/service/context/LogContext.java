package com.phillippitts.observability.service.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ambient log context API for application code.
 *
 * <p>Operates on whatever {@link RequestContext} is bound to the calling thread. Outside an
 * active request every method is a no-op and {@link #get()} returns an empty map; none of them
 * ever throws because no request is active.
 *
 * <pre>{@code
 * LogContext.update("user_id", userId);
 * Map<String, Object> fields = LogContext.get(); // {request_id=..., user_id=...}
 * }</pre>
 */
public final class LogContext {

    /** Attribute name under which the correlation id is exposed. */
    public static final String REQUEST_ID = "request_id";

    private LogContext() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns a snapshot of the current log context: {@code request_id} followed by all
     * attributes set during the request.
     *
     * @return unmodifiable snapshot, empty outside a request
     */
    public static Map<String, Object> get() {
        return RequestContextHolder.current()
                .map(LogContext::snapshot)
                .orElse(Map.of());
    }

    /**
     * Adds or replaces attributes of the current request; no-op outside a request.
     *
     * @param attributes attributes to merge
     */
    public static void update(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return;
        }
        RequestContextHolder.current().ifPresent(context -> attributes.forEach(context::set));
    }

    /**
     * Adds or replaces one attribute of the current request; no-op outside a request.
     */
    public static void update(String key, Object value) {
        RequestContextHolder.set(key, value);
    }

    /**
     * Removes all custom attributes of the current request; the correlation id is kept.
     */
    public static void clear() {
        RequestContextHolder.current().ifPresent(RequestContext::clearAttributes);
    }

    static Map<String, Object> snapshot(RequestContext context) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(REQUEST_ID, context.id());
        context.attributes().forEach(fields::putIfAbsent);
        return Collections.unmodifiableMap(fields);
    }
}
