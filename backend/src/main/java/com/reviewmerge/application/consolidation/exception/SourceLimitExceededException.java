package com.reviewmerge.application.consolidation.exception;

public class SourceLimitExceededException extends RuntimeException {

    public SourceLimitExceededException(String message) {
        super(message);
    }
}
