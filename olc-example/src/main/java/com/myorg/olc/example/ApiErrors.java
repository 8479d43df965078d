package com.myorg.olc.example;

import com.myorg.olc.contracts.core.exception.ValidationException;
import com.myorg.olc.eventing.publish.PublishException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.concurrent.ExecutionException;

@Slf4j
@RestControllerAdvice
public class ApiErrors {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> invalid(ValidationException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(PublishException.class)
    public ResponseEntity<Map<String, String>> unavailable(PublishException e) {
        log.warn("Publish rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ExecutionException.class)
    public ResponseEntity<Map<String, String>> failedSend(ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        log.warn("Publish failed: {}", cause.toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", String.valueOf(cause.getMessage())));
    }
}
