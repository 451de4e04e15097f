package com.homepurse.analysis.agent;

public class SqlGenerationException extends RuntimeException {

    public SqlGenerationException(String message) {
        super(message);
    }

    public SqlGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
