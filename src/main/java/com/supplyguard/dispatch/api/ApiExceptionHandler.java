package com.supplyguard.dispatch.api;

import com.supplyguard.core.engine.PipelineFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine failures to HTTP responses. A failed pipeline has no partial
 * result, so the caller gets 503 and the thread id to correlate with logs.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PipelineFailedException.class)
    public ResponseEntity<Map<String, Object>> pipelineFailed(PipelineFailedException e) {
        log.error("Analysis {} failed: {}", e.getThreadId(), e.getMessage());
        var body = new LinkedHashMap<String, Object>();
        body.put("error", "analysis_failed");
        body.put("message", e.getMessage());
        body.put("thread_id", e.getThreadId());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
