package com.example.shortie_backend.engine;

/**
 * Raised when the generation provider cannot produce a reply.
 */
public class GenerationException extends RuntimeException {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
