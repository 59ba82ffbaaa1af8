package com.eyelevel.docpipeline.exception.handler;

import com.eyelevel.docpipeline.dto.ApiResponse;
import com.eyelevel.docpipeline.exception.ConcurrentCheckpointException;
import com.eyelevel.docpipeline.exception.ExecutionNotFoundException;
import com.eyelevel.docpipeline.exception.ExecutionStoreException;
import com.eyelevel.docpipeline.exception.InvalidExecutionStateException;
import com.eyelevel.docpipeline.exception.TerminalRecordModificationException;
import com.eyelevel.docpipeline.exception.json.JsonParsingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the entire application.
 * It intercepts exceptions thrown from controllers and converts them into a
 * standardized ApiResponse format with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles client-side errors such as invalid document references. (400 Bad Request)
     */
    @ExceptionHandler({IllegalArgumentException.class, JsonParsingException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(final RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(final HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        final ApiResponse<Object> response =
                ApiResponse.error("Malformed request body.", "The request body is missing or could not be parsed.");
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles missing required request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(
            final MissingServletRequestParameterException ex) {
        final String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.",
                                                  ex.getParameterName(), ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Required parameter is missing.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(final MethodArgumentNotValidException ex) {
        final String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        final String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(final ConstraintViolationException ex) {
        final String errors = ex.getConstraintViolations().stream()
                .map(violation -> {
                    final String path = violation.getPropertyPath().toString();
                    return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
                })
                .collect(Collectors.joining(", "));
        final String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles type mismatch errors for path variables or request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(final MethodArgumentTypeMismatchException ex) {
        final String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.",
                                                  ex.getValue(), ex.getName(), ex.getRequiredType() != null
                                                          ? ex.getRequiredType().getSimpleName()
                                                          : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid parameter type provided.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles unknown executions. (404 Not Found)
     */
    @ExceptionHandler(ExecutionNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(final ExecutionNotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(
            final HttpRequestMethodNotSupportedException ex) {
        final String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        final String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                                                  ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Method not allowed.", errorMessage),
                                    HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles operations that conflict with the execution's current state. (409 Conflict)
     */
    @ExceptionHandler({InvalidExecutionStateException.class,
            ConcurrentCheckpointException.class,
            TerminalRecordModificationException.class})
    public ResponseEntity<ApiResponse<Object>> handleConflict(final RuntimeException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.CONFLICT);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles an unreachable execution store. (503 Service Unavailable)
     */
    @ExceptionHandler(ExecutionStoreException.class)
    public ResponseEntity<ApiResponse<Object>> handleStoreUnavailable(final ExecutionStoreException ex) {
        log.error("Execution store unavailable: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error("Execution store is temporarily unavailable.", ex.getMessage()),
                                    HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(final Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        final ApiResponse<Object> response = ApiResponse.error(
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName());
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
