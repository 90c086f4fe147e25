package com.alleato.insights.exception;

/**
 * The extraction model failed or answered with something that is not an insight list.
 * Treated as transient: the queue retries the document up to its cap.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
