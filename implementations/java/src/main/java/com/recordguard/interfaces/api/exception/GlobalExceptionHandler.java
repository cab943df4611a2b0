package com.recordguard.interfaces.api.exception;

import com.recordguard.application.exceptions.PrincipalNotFoundException;
import com.recordguard.application.exceptions.SessionNotFoundException;
import com.recordguard.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps host-layer failures to error responses. Pipeline outcomes never reach
 * this class; the orchestrator turns them into results.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.FieldViolation> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> ErrorResponse.FieldViolation.builder()
                .field(error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName())
                .constraint(error.getCode())
                .message(error.getDefaultMessage())
                .build())
            .collect(Collectors.toList());

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(error(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Invalid request parameters", request, validationErrors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        log.warn("Malformed request on {}: {}", request.getRequestURI(), ex.getClass().getSimpleName());
        return ResponseEntity.badRequest().body(error(HttpStatus.BAD_REQUEST, "Bad Request",
            "Malformed request", request, null));
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(
            SessionNotFoundException ex,
            HttpServletRequest request) {
        log.info("Session lookup failed on {}", request.getRequestURI());
        ErrorResponse body = error(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, null);
        body.setSessionId(ex.getSessionId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(PrincipalNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePrincipalNotFound(
            PrincipalNotFoundException ex,
            HttpServletRequest request) {
        log.info("Principal lookup failed on {}", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(HttpStatus.NOT_FOUND, "Not Found",
            ex.getMessage(), request, null));
    }

    /**
     * Anything else: generic message, details only in the log.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        ErrorResponse body = error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred. Please try again later.", request, null);
        log.error("Unexpected error {} on {}", body.getErrorId(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static ErrorResponse error(
            HttpStatus status,
            String error,
            String message,
            HttpServletRequest request,
            List<ErrorResponse.FieldViolation> validationErrors) {
        return ErrorResponse.builder()
            .errorId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .validationErrors(validationErrors)
            .build();
    }
}
