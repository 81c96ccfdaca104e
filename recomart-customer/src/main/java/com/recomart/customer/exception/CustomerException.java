package com.recomart.customer.exception;

import org.springframework.http.HttpStatus;

public class CustomerException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public CustomerException(String message, HttpStatus status, String errorCode) {
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

    public static CustomerException customerNotFound(String customerId) {
        return new CustomerException(
                "Customer not found: " + customerId,
                HttpStatus.NOT_FOUND,
                "CUSTOMER_NOT_FOUND"
        );
    }

    // Product-related exceptions (within activity log context)
    public static CustomerException productNotFound(String productId) {
        return new CustomerException(
                "Product not found: " + productId,
                HttpStatus.NOT_FOUND,
                "PRODUCT_NOT_FOUND"
        );
    }
}
