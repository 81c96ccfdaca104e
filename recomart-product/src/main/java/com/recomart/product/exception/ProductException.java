package com.recomart.product.exception;

import org.springframework.http.HttpStatus;

public class ProductException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ProductException(String message, HttpStatus status, String errorCode) {
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

    public static ProductException productNotFound(String productId) {
        return new ProductException("Product not found: " + productId, HttpStatus.NOT_FOUND, "PRODUCT_NOT_FOUND");
    }

    public static ProductException productIdAlreadyExists(String productId) {
        return new ProductException("Product with this id already exists: " + productId,
                HttpStatus.CONFLICT, "PRODUCT_ID_EXISTS");
    }

    public static ProductException batchSizeExceeded(int maxSize) {
        return new ProductException(
                String.format("Batch size cannot exceed %d items", maxSize),
                HttpStatus.BAD_REQUEST,
                "BATCH_SIZE_EXCEEDED"
        );
    }
}
