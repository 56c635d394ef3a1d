package com.altar_funds.exception;

/**
 * Transport failure, non-2xx response or a {@code success=false} envelope from the backend.
 */
public class NetworkException extends PaymentException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
