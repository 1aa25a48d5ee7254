package com.csl.commentquery.api;

public class InvalidQueryVarsException extends RuntimeException {
    private final String details;

    public InvalidQueryVarsException(String message, String details) {
        super(message);
        this.details = details;
    }

    public String getDetails() {
        return details;
    }
}
