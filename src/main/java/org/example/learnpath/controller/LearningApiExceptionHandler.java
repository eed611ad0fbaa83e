package org.example.learnpath.controller;

import org.example.learnpath.service.exception.AttemptLimitExceededException;
import org.example.learnpath.service.exception.DayAccessDeniedException;
import org.example.learnpath.service.exception.DuplicateResourceException;
import org.example.learnpath.service.exception.QuestionEvaluationException;
import org.example.learnpath.service.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the engine's exceptions to HTTP responses with a {@code {status, error, message, reason}} body.
 */
@RestControllerAdvice(assignableTypes = LearningController.class)
public class LearningApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LearningApiExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return body(HttpStatus.NOT_FOUND, e.getMessage(), null);
    }

    @ExceptionHandler(DayAccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleDayAccessDenied(DayAccessDeniedException e) {
        log.info("Day access denied ({}): {}", e.getReason(), e.getMessage());
        return body(HttpStatus.FORBIDDEN, e.getMessage(), e.getReason().name());
    }

    @ExceptionHandler(AttemptLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleAttemptLimit(AttemptLimitExceededException e) {
        log.info("Attempt limit reached: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e.getMessage(), "ATTEMPT_LIMIT_EXCEEDED");
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateResourceException e) {
        log.info("Duplicate resource: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e.getMessage(), "DUPLICATE");
    }

    @ExceptionHandler(QuestionEvaluationException.class)
    public ResponseEntity<Map<String, Object>> handleEvaluationFailure(QuestionEvaluationException e) {
        log.warn("Question evaluation failed: {}", e.getDetail());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), "EVALUATION_FAILED");
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.debug("Rejected request: {}", e.getMessage());
        String message = e instanceof IllegalArgumentException ? e.getMessage() : "Malformed request";
        return body(HttpStatus.BAD_REQUEST, message, null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handlePersistenceFailure(DataAccessException e) {
        log.error("Persistence failure", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Persistence failure", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        if (reason != null) {
            body.put("reason", reason);
        }
        return ResponseEntity.status(status).body(body);
    }
}
