package com.phillippitts.observability.service.context;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;
import java.util.Optional;

/**
 * Carries the submitting thread's request context and Log4j2 ThreadContext (MDC) into
 * executor worker threads.
 *
 * <p>The worker's own state is restored after the task, so a pooled worker never keeps a
 * context from a previous task.
 */
public class RequestContextTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        Optional<RequestContext> context = RequestContextHolder.current();
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            RequestContextHolder.Scope scope = context.map(RequestContextHolder::attach).orElse(null);
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                runnable.run();
            } finally {
                if (scope != null) {
                    scope.close();
                }
                ThreadContext.clearAll();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
