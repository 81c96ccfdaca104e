package com.recomart.product.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice(basePackages = "com.recomart.product")
public class ProductExceptionHandler {

    @ExceptionHandler(ProductException.class)
    public ResponseEntity<Map<String, Object>> handleProductException(ProductException ex,
                                                                      HttpServletRequest request) {
        log.warn("Product exception: {} [{}] - Path: {}",
                ex.getMessage(), ex.getErrorCode(), request.getRequestURI());
        return ResponseEntity.status(ex.getStatus())
                .body(errorBody(ex.getMessage(), ex.getErrorCode(), request));
    }

    /**
     * Rejected catalog payloads report every offending field, keyed by field name.
     * The first message wins when a field fails more than one constraint.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex,
                                                                         HttpServletRequest request) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));

        log.warn("Invalid product payload on {}: {}", request.getRequestURI(), fieldErrors.keySet());

        Map<String, Object> body = errorBody("One or more fields have invalid values", "VALIDATION_FAILED", request);
        body.put("fieldErrors", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    private static Map<String, Object> errorBody(String message, String errorCode, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("error", message);
        body.put("errorCode", errorCode);
        body.put("path", request.getRequestURI());
        return body;
    }
}
