package com.phillippitts.observability.presentation.controller;

import com.phillippitts.observability.service.context.LogContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Lightweight endpoint to generate an instrumented request and an application log line that
 * carries the request's log context.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping(@RequestHeader(name = "X-User-ID", required = false) String userId) {
        if (userId != null && !userId.isBlank()) {
            LogContext.update("user_id", userId);
        }
        log.info("Ping received");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().toString()
        ));
    }

    /**
     * Always fails, to exercise error handling end to end.
     */
    @GetMapping("/boom")
    ResponseEntity<Map<String, Object>> boom() {
        throw new IllegalStateException("Simulated failure");
    }
}
