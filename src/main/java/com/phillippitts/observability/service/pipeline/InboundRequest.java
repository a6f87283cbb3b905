package com.phillippitts.observability.service.pipeline;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Transport-neutral view of an inbound request.
 *
 * @param method HTTP method
 * @param path concrete request path
 * @param headers request headers, looked up case-insensitively
 * @param routeTemplate supplies the route template matched by the framework, evaluated after the
 *                      handler ran; returns {@code null} when unknown
 */
public record InboundRequest(String method,
                             String path,
                             Map<String, String> headers,
                             Supplier<String> routeTemplate) {

    public InboundRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null) {
                    copy.put(name, value);
                }
            });
        }
        headers = Collections.unmodifiableMap(copy);
        routeTemplate = routeTemplate == null ? () -> null : routeTemplate;
    }

    public static InboundRequest of(String method, String path) {
        return new InboundRequest(method, path, Map.of(), null);
    }

    public static InboundRequest of(String method, String path, Map<String, String> headers) {
        return new InboundRequest(method, path, headers, null);
    }

    /**
     * Returns a header value.
     *
     * @param name header name, case-insensitive
     * @return value, or empty when absent or blank
     */
    public Optional<String> header(String name) {
        String value = headers.get(name);
        return (value == null || value.isBlank()) ? Optional.empty() : Optional.of(value);
    }

    /**
     * Returns a copy of this request with a framework route template source.
     */
    public InboundRequest withRouteTemplate(Supplier<String> source) {
        return new InboundRequest(method, path, headers, source);
    }
}
