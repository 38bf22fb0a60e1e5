package com.produto.api.config;

import com.produto.api.exception.AppException;
import com.produto.api.filter.RequestLoggingFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST endpoints.
 * Every error body carries error, message, status_code, path and request_id.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<Map<String, Object>> handleAppException(AppException ex, HttpServletRequest request) {
        log.warn("AppError: {} - {} | Path: {} | Method: {}",
            ex.getClass().getSimpleName(), ex.getMessage(), request.getRequestURI(), request.getMethod());
        return build(ex.getStatus(), ex.getClass().getSimpleName(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex,
                                                                HttpServletRequest request) {
        List<Map<String, Object>> details = new ArrayList<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("field", fieldError.getField());
            detail.put("message", fieldError.getDefaultMessage());
            detail.put("rejected_value", fieldError.getRejectedValue());
            details.add(detail);
        }
        log.warn("Validation error: {} | Path: {} | Method: {}", details, request.getRequestURI(), request.getMethod());

        ResponseEntity<Map<String, Object>> response = build(HttpStatus.UNPROCESSABLE_ENTITY,
            "ValidationError", "Invalid input data", request);
        response.getBody().put("details", details);
        return response;
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                      HttpServletRequest request) {
        log.warn("Missing parameter: {} | Path: {}", ex.getParameterName(), request.getRequestURI());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "ValidationError", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                                  HttpServletRequest request) {
        Class<?> requiredType = ex.getRequiredType();
        String expected = requiredType != null ? requiredType.getSimpleName() : "a different type";
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("field", ex.getName());
        detail.put("message", "Invalid value, expected " + expected);
        detail.put("rejected_value", ex.getValue());
        log.warn("Validation error: {} | Path: {} | Method: {}", detail, request.getRequestURI(), request.getMethod());

        ResponseEntity<Map<String, Object>> response = build(HttpStatus.UNPROCESSABLE_ENTITY,
            "ValidationError", "Invalid input data", request);
        response.getBody().put("details", List.of(detail));
        return response;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex,
                                                                HttpServletRequest request) {
        log.warn("Bad request: {} | Path: {}", ex.getMessage(), request.getRequestURI());
        return build(HttpStatus.BAD_REQUEST, "BadRequestException", "Malformed request", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse) {
            // Spring MVC's own errors (unknown path, wrong method, ...) keep their status
            HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
            log.warn("HTTPException: {} - {} | Path: {}", status.value(), ex.getMessage(), request.getRequestURI());
            return build(status, "HTTPException", status.getReasonPhrase(), request);
        }
        log.error("Unhandled exception | Path: {} | Method: {}", request.getRequestURI(), request.getMethod(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "Internal server error", request);
    }

    private static ResponseEntity<Map<String, Object>> build(HttpStatus status,
                                                             String error,
                                                             String message,
                                                             HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("status_code", status.value());
        body.put("path", request.getRequestURI());
        body.put("request_id", MDC.get(RequestLoggingFilter.REQUEST_ID_MDC_KEY));
        return ResponseEntity.status(status).body(body);
    }
}
