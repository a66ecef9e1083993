package com.boomerang.shared;

/** Raised for configuration and programming errors; never for send outcomes. */
public class BoomerangException extends RuntimeException {

    public BoomerangException(String message) {
        super(message);
    }

    public BoomerangException(String message, Throwable cause) {
        super(message, cause);
    }
}
