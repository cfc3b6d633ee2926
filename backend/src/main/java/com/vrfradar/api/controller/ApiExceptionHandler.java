package com.vrfradar.api.controller;

import com.vrfradar.api.dto.ErrorBody;
import com.vrfradar.query.NoActiveQueryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps bad request parameters to 400, missing resources to 404 and a refresh without a prior query to 409,
 * all with {@link ErrorBody}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorBody> handleValidation(HandlerMethodValidationException ex) {
        String message = ex.getAllValidationResults().stream()
                .findFirst()
                .map(r -> Optional.ofNullable(r.getMethodParameter().getParameterName()).orElse("parameter")
                        + ": " + r.getResolvableErrors().get(0).getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PARAMETER",
                Optional.ofNullable(ex.getReason()).orElse("Invalid request parameter")));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PARAMETER", ex.getMessage()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(ResourceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(NoActiveQueryException.class)
    public ResponseEntity<ErrorBody> handleNoActiveQuery(NoActiveQueryException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of("NO_ACTIVE_QUERY", ex.getMessage()));
    }
}
