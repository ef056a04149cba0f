package com.pawpal.core.input;

/**
 * Thrown when an owner document cannot be read or holds values outside the
 * domain of the planning core.
 */
public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
