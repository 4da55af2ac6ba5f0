package com.medimind.intake.exception;

public class FallbackServiceException extends RuntimeException {

    public FallbackServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
