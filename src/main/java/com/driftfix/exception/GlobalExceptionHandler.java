package com.driftfix.exception;

import com.driftfix.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_FAILED",
                     "One or more fields failed validation", request, fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_FAILED",
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {
        String msg = ex.getAllValidationResults().stream()
            .flatMap(r -> r.getResolvableErrors().stream())
            .map(e -> e.getDefaultMessage())
            .findFirst()
            .orElse("Request parameters failed validation");
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_FAILED",
                     msg, request, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", "TYPE_MISMATCH", msg, request, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "MALFORMED_REQUEST",
                     "Request body could not be parsed", request, null);
    }

    @ExceptionHandler({IncompatibleSchemaException.class, InsufficientDataException.class})
    public ResponseEntity<ApiError> handleUnusableData(
            DriftFixException ex, HttpServletRequest request) {
        log.warn("Analysis rejected input | errorCode={} | reason={}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Data", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(CorruptDataException.class)
    public ResponseEntity<ApiError> handleCorrupt(
            CorruptDataException ex, HttpServletRequest request) {
        log.warn("Corrupt input | reason={}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Corrupt Data", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(RollbackException.class)
    public ResponseEntity<ApiError> handleRollback(
            RollbackException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "Rollback Unavailable", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(
            JobNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(InferenceUnavailableException.class)
    public ResponseEntity<ApiError> handleInferenceUnavailable(
            InferenceUnavailableException ex, HttpServletRequest request) {
        log.error("Inference API unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Inference Service Unavailable", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(InferenceException.class)
    public ResponseEntity<ApiError> handleInferenceError(
            InferenceException ex, HttpServletRequest request) {
        log.error("Inference API error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Inference Service Error", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        String code = ex instanceof DriftFixException dfe ? dfe.getErrorCode() : "INTERNAL_ERROR";
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", code,
                     "An unexpected error occurred", request, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String errorCode, String message,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(request.getHeader("X-Request-ID"))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
