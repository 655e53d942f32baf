package com.freelance.jobalerts.pipeline.service;

/**
 * Raised inside a cycle when its worker lease has passed to another process.
 */
public class LeaseLostException extends RuntimeException {
    public LeaseLostException(String message) {
        super(message);
    }
}
