package com.reviewmerge.infrastructure.consolidation;

/**
 * The top-level consolidation input is not a list of report-shaped objects.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
