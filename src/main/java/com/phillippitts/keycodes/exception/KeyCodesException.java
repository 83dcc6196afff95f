package com.phillippitts.keycodes.exception;

/**
 * Base exception for all keycodes application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class KeyCodesException extends RuntimeException {

    public KeyCodesException(String message) {
        super(message);
    }

    public KeyCodesException(String message, Throwable cause) {
        super(message, cause);
    }

    public KeyCodesException(Throwable cause) {
        super(cause);
    }
}
