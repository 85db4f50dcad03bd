package com.dcruver.themerank.nlp;

/**
 * Raised when the embedding provider cannot produce a vector after retries.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
