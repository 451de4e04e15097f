package com.homepurse.analysis.ai;

/**
 * Raised when the configured model provider does not return usable text: missing credentials,
 * an upstream HTTP error, a transport failure or an empty completion.
 */
public class LanguageModelException extends RuntimeException {

    public LanguageModelException(String message) {
        super(message);
    }

    public LanguageModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
