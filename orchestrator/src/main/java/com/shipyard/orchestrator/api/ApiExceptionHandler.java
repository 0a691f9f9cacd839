package com.shipyard.orchestrator.api;

import com.shipyard.orchestrator.error.CollaboratorException;
import com.shipyard.orchestrator.error.EpisodeNotFoundException;
import com.shipyard.orchestrator.error.InvalidTransitionException;
import com.shipyard.orchestrator.error.OrchestrationException;
import com.shipyard.orchestrator.error.PipelineAlreadyActiveException;
import com.shipyard.orchestrator.error.VersionConflictException;
import com.shipyard.orchestrator.error.WorkflowNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the orchestration error taxonomy to HTTP statuses. Every error body
 * is {@code {"error": <code>, "message": <text>}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> invalidTransition(InvalidTransitionException ex) {
        return body(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler({VersionConflictException.class, PipelineAlreadyActiveException.class})
    public ResponseEntity<Map<String, Object>> conflict(OrchestrationException ex) {
        return body(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler({WorkflowNotFoundException.class, EpisodeNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(OrchestrationException ex) {
        return body(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(CollaboratorException.class)
    public ResponseEntity<Map<String, Object>> collaborator(CollaboratorException ex) {
        log.error("Collaborator call failed: {}", ex.getMessage(), ex);
        return body(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<Map<String, Object>> other(OrchestrationException ex) {
        log.error("Unhandled orchestration error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        Throwable root = ex.getMostSpecificCause();
        return body(HttpStatus.BAD_REQUEST, "bad_request", root.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, OrchestrationException ex) {
        return body(status, ex.code(), ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
