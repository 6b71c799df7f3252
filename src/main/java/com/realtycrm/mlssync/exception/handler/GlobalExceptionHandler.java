package com.realtycrm.mlssync.exception.handler;

import com.realtycrm.mlssync.dto.common.ApiResponse;
import com.realtycrm.mlssync.exception.InvalidRequestException;
import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.exception.SyncConflictException;
import com.realtycrm.mlssync.exception.json.JsonParsingException;
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
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the REST surface.
 * It converts exceptions thrown from controllers into the standardized ApiResponse format with the
 * semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles requests that are well-formed but semantically invalid. (400 Bad Request)
     */
    @ExceptionHandler({InvalidRequestException.class, JsonParsingException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return build(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return build(ApiResponse.error("Malformed request body.", "The request body is missing or could not be parsed."),
                     HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles missing required request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(), ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return build(ApiResponse.error("Required parameter is missing.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return build(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String path = violation.getPropertyPath().toString();
                    return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
                })
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return build(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles parameter constraint violations reported by Spring MVC's built-in method validation. (400 Bad Request)
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse<Object>> handleHandlerMethodValidation(HandlerMethodValidationException ex) {
        String errors = ex.getAllValidationResults().stream()
                .flatMap(result -> result.getResolvableErrors().stream()
                        .map(error -> String.format("'%s': %s", result.getMethodParameter().getParameterName(),
                                error.getDefaultMessage())))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling method validation exception: {}", errorMessage);
        return build(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles type mismatch errors for path variables or request parameters, including unknown enum values. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName()
                        : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return build(ApiResponse.error("Invalid parameter type provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles lookups of providers, runs, errors, media or properties that do not exist. (404 Not Found)
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return build(ApiResponse.error(ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    /**
     * Handles URLs that map to no endpoint. (404 Not Found)
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNoResourceFound(NoResourceFoundException ex) {
        String errorMessage = String.format("No endpoint %s found for /%s", ex.getHttpMethod(), ex.getResourcePath());
        log.warn("Handling NoResourceFoundException: {}", errorMessage);
        return build(ApiResponse.error("Resource not found.", errorMessage), HttpStatus.NOT_FOUND);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s", ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return build(ApiResponse.error("Method not allowed.", errorMessage), HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles requests that collide with the current state, e.g. a sync that is already running. (409 Conflict)
     */
    @ExceptionHandler(SyncConflictException.class)
    public ResponseEntity<ApiResponse<Object>> handleConflict(SyncConflictException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return build(ApiResponse.error(ex.getMessage()), HttpStatus.CONFLICT);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return build(ApiResponse.error("An unexpected internal error occurred. Please contact support.",
                                       ex.getClass().getSimpleName()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ApiResponse<Object>> build(ApiResponse<Object> body, HttpStatus status) {
        ApiResponse<Object> response = ApiResponse.builder()
                .displayMessage(body.getDisplayMessage())
                .response(body.getResponse())
                .showMessage(body.getShowMessage())
                .statusCode(status.value())
                .build();
        return new ResponseEntity<>(response, status);
    }
}
