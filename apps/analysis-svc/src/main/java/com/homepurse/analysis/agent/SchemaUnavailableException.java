package com.homepurse.analysis.agent;

/**
 * The schema context could not be built. Raised before any attempt exists, so nothing is audited.
 */
public class SchemaUnavailableException extends RuntimeException {

    public SchemaUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public SchemaUnavailableException(String message) {
        super(message);
    }
}
