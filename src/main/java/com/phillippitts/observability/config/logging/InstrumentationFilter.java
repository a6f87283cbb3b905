package com.phillippitts.observability.config.logging;

import com.phillippitts.observability.service.context.RequestContextHolder;
import com.phillippitts.observability.service.pipeline.InboundRequest;
import com.phillippitts.observability.service.pipeline.InstrumentationPipeline;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Servlet transport for the {@link InstrumentationPipeline}.
 *
 * <p>Every HTTP request runs inside a request context:
 * <ul>
 *   <li>correlation id from the configured header (default {@code X-Request-ID}), or a generated
 *       UUID, echoed on the response</li>
 *   <li>one request log entry plus counter and duration histogram once the chain returns</li>
 *   <li>the route template Spring MVC matched is used as the metric {@code path} label</li>
 * </ul>
 *
 * <p>The context is always ended after the request to avoid leakage across pooled threads.
 * Exceptions from the chain are rethrown unchanged. Exceptions that exception handlers already
 * mapped to a response are picked up from {@link #HANDLED_EXCEPTION_ATTRIBUTE} and recorded on the
 * request log entry.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class InstrumentationFilter implements Filter {

    /** Request attribute under which exception handlers leave the exception they mapped. */
    public static final String HANDLED_EXCEPTION_ATTRIBUTE =
            InstrumentationFilter.class.getName() + ".HANDLED_EXCEPTION";

    private final InstrumentationPipeline pipeline;

    public InstrumentationFilter(InstrumentationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http) || !(response instanceof HttpServletResponse httpResponse)) {
            chain.doFilter(request, response);
            return;
        }

        InboundRequest inbound = toInboundRequest(http);
        String header = pipeline.getConfig().requestIdHeader();
        try {
            pipeline.instrument(inbound, () -> {
                RequestContextHolder.currentId().ifPresent(id -> httpResponse.setHeader(header, id));
                chain.doFilter(request, response);
                return httpResponse;
            }, HttpServletResponse::getStatus, ignored -> handledException(http));
        } catch (IOException | ServletException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ServletException(e);
        }
    }

    static InboundRequest toInboundRequest(HttpServletRequest http) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(http.getHeaderNames())) {
            headers.put(name, http.getHeader(name));
        }
        return new InboundRequest(http.getMethod(), http.getRequestURI(), headers,
                () -> bestMatchingPattern(http));
    }

    private static Throwable handledException(HttpServletRequest http) {
        Object error = http.getAttribute(HANDLED_EXCEPTION_ATTRIBUTE);
        return error instanceof Throwable throwable ? throwable : null;
    }

    private static String bestMatchingPattern(HttpServletRequest http) {
        Object pattern = http.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern == null ? null : pattern.toString();
    }
}
