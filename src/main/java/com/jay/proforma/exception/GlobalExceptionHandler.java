package com.jay.proforma.exception;

import com.jay.proforma.controller.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Collections;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String VALIDATION_FAILED = "Validation failed";

    @ExceptionHandler(ScenarioValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleScenarioValidation(ScenarioValidationException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_FAILED, ex.getFailures());
    }

    @ExceptionHandler(NumericFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleNumericFailure(NumericFailureException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Calculation failed",
            Collections.singletonList(ex.getMessage()));
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvariantViolation(InvariantViolationException ex) {
        log.error("Invariant violated — run aborted: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Invariant violated",
            Collections.singletonList(ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, Collections.singletonList(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage();
        String error = "Invalid request format";
        if (message.startsWith("JSON parse error:")) {
            String simplified = message.substring("JSON parse error:".length()).trim();
            int colon = simplified.indexOf(':');
            error = colon > 0 ? simplified.substring(0, colon).trim() : simplified;
        }
        return respond(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, Collections.singletonList(error));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleAllExceptions(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Server error",
            Collections.singletonList("An unexpected error occurred: " + ex.getMessage()));
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message, List<String> errors) {
        ApiResponse<Void> response = new ApiResponse<>(false, status.value(), message, errors);
        return ResponseEntity.status(status).body(response);
    }
}
