package com.phillippitts.observability.presentation.exception;

import com.phillippitts.observability.config.logging.InstrumentationFilter;
import com.phillippitts.observability.service.context.RequestContext;
import com.phillippitts.observability.service.context.RequestContextHolder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unexpectedExceptionReturns500WithRequestId() {
        RequestContext context = RequestContextHolder.begin("req-err");
        try {
            ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("boom"),
                    new MockHttpServletRequest());

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
            assertThat(response.getBody()).isNotNull();
            assertThat(response.getBody().toString()).contains("req-err");
            assertThat(response.getBody().toString()).doesNotContain("boom");
        } finally {
            RequestContextHolder.end(context);
        }
    }

    @Test
    void unexpectedExceptionIsLeftOnRequestForInstrumentation() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        IllegalStateException boom = new IllegalStateException("boom");

        handler.handleUnexpected(boom, request);

        assertThat(request.getAttribute(InstrumentationFilter.HANDLED_EXCEPTION_ATTRIBUTE)).isSameAs(boom);
    }

    @Test
    void missingResourceReturns404() {
        ResponseEntity<?> response = handler.handleNotFound(new NoResourceFoundException(HttpMethod.GET, "nope"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void outsideRequestRequestIdIsEmpty() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("x"), new MockHttpServletRequest());

        assertThat(response.getBody().toString()).contains("requestId=,");
    }
}
