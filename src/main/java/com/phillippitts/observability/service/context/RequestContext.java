package com.phillippitts.observability.service.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable per-request record: a correlation id plus ordered key/value attributes.
 *
 * <p>Instances are created by {@link RequestContextHolder#begin(String)} and act as the handle
 * for the request's lifetime. Once {@link #release() released}, a context drops its attributes,
 * ignores further writes and is never returned by {@link RequestContextHolder#current()}.
 *
 * <p><b>Thread Safety:</b> attribute access is synchronized so that work handed to other
 * threads of the same request (see {@link RequestContextTaskDecorator}) can read and write
 * attributes safely.
 */
public final class RequestContext {

    private final String id;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private volatile boolean released;

    RequestContext(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    /**
     * Returns the correlation id of this request.
     */
    public String id() {
        return id;
    }

    /**
     * Stores an attribute. Ignored once the context has been released.
     *
     * @param key attribute name
     * @param value attribute value, may be {@code null}
     */
    public synchronized void set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (!released) {
            attributes.put(key, value);
        }
    }

    /**
     * Returns an attribute value.
     *
     * @param key attribute name
     * @return value, or empty when absent, null or released
     */
    public synchronized Optional<Object> get(String key) {
        return released ? Optional.empty() : Optional.ofNullable(attributes.get(key));
    }

    /**
     * Removes all custom attributes, keeping the id.
     */
    public synchronized void clearAttributes() {
        attributes.clear();
    }

    /**
     * Returns a copy of the custom attributes in insertion order.
     */
    public synchronized Map<String, Object> attributes() {
        return released ? Map.of() : new LinkedHashMap<>(attributes);
    }

    /**
     * Releases the context: attributes are dropped and later writes are ignored.
     * Calling this more than once has no further effect.
     */
    public synchronized void release() {
        released = true;
        attributes.clear();
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public String toString() {
        return "RequestContext[id=" + id + ", released=" + released + "]";
    }
}
