package com.recomart.recommendation.exception;

import org.springframework.http.HttpStatus;

public class RecommendationException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public RecommendationException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static RecommendationException productNotIndexed(String productId) {
        return new RecommendationException(
                "Product is not in the similarity index: " + productId,
                HttpStatus.NOT_FOUND,
                "PRODUCT_NOT_INDEXED"
        );
    }

    public static RecommendationException invalidArgument(String message) {
        return new RecommendationException(message, HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT");
    }

    public static RecommendationException indexingInProgress() {
        return new RecommendationException(
                "A similarity index rebuild is already running",
                HttpStatus.CONFLICT,
                "INDEXING_IN_PROGRESS"
        );
    }

    public static RecommendationException segmentationInProgress() {
        return new RecommendationException(
                "A segmentation run is already in progress",
                HttpStatus.CONFLICT,
                "SEGMENTATION_IN_PROGRESS"
        );
    }
}
