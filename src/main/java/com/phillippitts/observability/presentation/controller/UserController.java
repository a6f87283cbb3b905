package com.phillippitts.observability.presentation.controller;

import com.phillippitts.observability.service.context.LogContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Demo resource with a path variable. The lookup runs on the application pool to show that the
 * request context follows the work onto another thread.
 */
@RestController
class UserController {

    private static final Logger log = LogManager.getLogger(UserController.class);

    private final Executor applicationExecutor;

    UserController(@Qualifier("applicationExecutor") Executor applicationExecutor) {
        this.applicationExecutor = applicationExecutor;
    }

    @GetMapping("/users/{id}")
    ResponseEntity<Map<String, Object>> getUser(@PathVariable("id") long id) {
        if (id <= 0) {
            log.warn("Rejected user lookup for id {}", id);
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(Map.of("error", "id must be positive"));
        }
        LogContext.update("user_id", id);
        Map<String, Object> user = CompletableFuture
                .supplyAsync(() -> lookup(id), applicationExecutor)
                .join();
        return ResponseEntity.ok(user);
    }

    private static Map<String, Object> lookup(long id) {
        // Runs on the application pool with the caller's request context bound
        log.info("Loading user {}", id);
        return Map.of(
                "id", id,
                "name", "user-" + id,
                "request_id", LogContext.get().getOrDefault(LogContext.REQUEST_ID, "")
        );
    }
}
