package com.phillippitts.observability.presentation.controller;

import com.phillippitts.observability.domain.LogEntry;
import com.phillippitts.observability.domain.LogLevel;
import com.phillippitts.observability.service.storage.LogStoragePort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Read access to stored log entries: {@code GET /logs?since=<ISO-8601>&level=<LEVEL>}.
 * Both parameters are optional.
 */
@RestController
class LogsController {

    private final LogStoragePort logStorage;

    LogsController(LogStoragePort logStorage) {
        this.logStorage = logStorage;
    }

    @GetMapping("/logs")
    ResponseEntity<?> logs(@RequestParam(name = "since", required = false) String since,
                           @RequestParam(name = "level", required = false) String level) {
        Instant sinceInstant = null;
        if (since != null && !since.isBlank()) {
            try {
                sinceInstant = Instant.parse(since);
            } catch (DateTimeParseException e) {
                return badRequest("since must be an ISO-8601 instant");
            }
        }
        LogLevel levelFilter = null;
        if (level != null && !level.isBlank()) {
            levelFilter = LogLevel.parse(level).orElse(null);
            if (levelFilter == null) {
                return badRequest("unknown level: " + level);
            }
        }
        List<LogEntry> entries = logStorage.read(sinceInstant, levelFilter);
        return ResponseEntity.ok(entries);
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", message));
    }
}
