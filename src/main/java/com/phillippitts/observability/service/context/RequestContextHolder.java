package com.phillippitts.observability.service.context;

import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Thread-bound access to the {@link RequestContext} of the request currently being handled.
 *
 * <p>Each thread holds at most one active binding. {@link #begin(String)} stacks a new context on
 * top of whatever was bound before and {@link #end(RequestContext)} restores it, so a pooled
 * thread returns to its previous state (normally: nothing bound) once a request finishes.
 *
 * <p>Work that hops to another thread does not inherit the binding automatically. Use
 * {@link #wrap(Runnable)}, {@link #wrap(Callable)} or an executor decorated with
 * {@link RequestContextTaskDecorator} to carry the context across the hop.
 *
 * <p>The correlation id is mirrored into Log4j2's {@link ThreadContext} under
 * {@value #MDC_REQUEST_ID} so console log lines carry it.
 */
public final class RequestContextHolder {

    /** ThreadContext (MDC) key holding the correlation id of the bound context. */
    public static final String MDC_REQUEST_ID = "requestId";

    private static final ThreadLocal<Binding> CURRENT = new ThreadLocal<>();

    private RequestContextHolder() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates a context and binds it to the calling thread.
     *
     * @param seedId correlation id taken from the inbound request; used verbatim when not blank,
     *               otherwise a random UUID is generated
     * @return the new context, to be passed to {@link #end(RequestContext)} when the request finishes
     */
    public static RequestContext begin(String seedId) {
        String id = (seedId == null || seedId.isBlank()) ? UUID.randomUUID().toString() : seedId;
        RequestContext context = new RequestContext(id);
        bind(context);
        return context;
    }

    /**
     * Returns the live context bound to the calling thread.
     *
     * @return bound context, or empty when nothing is bound or the bound context was released
     */
    public static Optional<RequestContext> current() {
        Binding binding = CURRENT.get();
        if (binding == null || binding.context().isReleased()) {
            return Optional.empty();
        }
        return Optional.of(binding.context());
    }

    /**
     * Returns the correlation id of the current context, if any.
     */
    public static Optional<String> currentId() {
        return current().map(RequestContext::id);
    }

    /**
     * Sets an attribute on the current context; no-op outside a request.
     */
    public static void set(String key, Object value) {
        current().ifPresent(context -> context.set(key, value));
    }

    /**
     * Reads an attribute of the current context.
     *
     * @return value, or empty outside a request
     */
    public static Optional<Object> get(String key) {
        return current().flatMap(context -> context.get(key));
    }

    /**
     * Ends a request: releases the context and, when it is bound to the calling thread,
     * restores the previous binding. Safe to call more than once and from any thread.
     *
     * @param context context returned by {@link #begin(String)}; {@code null} is ignored
     */
    public static void end(RequestContext context) {
        if (context == null) {
            return;
        }
        context.release();
        detach(context);
    }

    /**
     * Unbinds a context from the calling thread without releasing it.
     *
     * <p>Used when a request continues on other threads: the context stays alive for them while
     * the current thread is handed back to its pool clean.
     *
     * @param context context to unbind; ignored unless it is the one bound to this thread
     */
    public static void detach(RequestContext context) {
        Binding binding = CURRENT.get();
        if (binding != null && binding.context() == context) {
            restore(binding.previous());
        }
    }

    /**
     * Binds an existing context to the calling thread until the returned scope is closed.
     *
     * @param context context captured on another thread
     * @return scope restoring this thread's previous binding on close
     */
    public static Scope attach(RequestContext context) {
        Objects.requireNonNull(context, "context");
        Binding previous = CURRENT.get();
        bind(context);
        return () -> {
            Binding binding = CURRENT.get();
            if (binding != null && binding.context() == context) {
                restore(previous);
            }
        };
    }

    /**
     * Wraps a task so it runs with the calling thread's current context bound.
     */
    public static Runnable wrap(Runnable task) {
        Objects.requireNonNull(task, "task");
        Optional<RequestContext> captured = current();
        if (captured.isEmpty()) {
            return task;
        }
        RequestContext context = captured.get();
        return () -> {
            try (Scope ignored = attach(context)) {
                task.run();
            }
        };
    }

    /**
     * Wraps a callable so it runs with the calling thread's current context bound.
     */
    public static <T> Callable<T> wrap(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        Optional<RequestContext> captured = current();
        if (captured.isEmpty()) {
            return task;
        }
        RequestContext context = captured.get();
        return () -> {
            try (Scope ignored = attach(context)) {
                return task.call();
            }
        };
    }

    /**
     * Wraps a supplier so it runs with the calling thread's current context bound.
     */
    public static <T> Supplier<T> wrapSupplier(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        Optional<RequestContext> captured = current();
        if (captured.isEmpty()) {
            return supplier;
        }
        RequestContext context = captured.get();
        return () -> {
            try (Scope ignored = attach(context)) {
                return supplier.get();
            }
        };
    }

    private static void bind(RequestContext context) {
        CURRENT.set(new Binding(context, CURRENT.get()));
        ThreadContext.put(MDC_REQUEST_ID, context.id());
    }

    private static void restore(Binding previous) {
        while (previous != null && previous.context().isReleased()) {
            previous = previous.previous();
        }
        if (previous == null) {
            CURRENT.remove();
            ThreadContext.remove(MDC_REQUEST_ID);
        } else {
            CURRENT.set(previous);
            ThreadContext.put(MDC_REQUEST_ID, previous.context().id());
        }
    }

    /**
     * Restores the previous binding of a thread; closing never throws.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    private record Binding(RequestContext context, Binding previous) {
    }
}
