package com.recomart.recommendation.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice(basePackages = "com.recomart.recommendation")
public class RecommendationExceptionHandler {

    @ExceptionHandler(RecommendationException.class)
    public ResponseEntity<Map<String, Object>> handleRecommendationException(RecommendationException ex) {
        log.warn("Recommendation exception: {} [{}]", ex.getMessage(), ex.getErrorCode());

        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("error", ex.getMessage());
        body.put("errorCode", ex.getErrorCode());

        return ResponseEntity.status(ex.getStatus()).body(body);
    }
}
