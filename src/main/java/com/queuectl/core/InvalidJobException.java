package com.queuectl.core;

/**
 * Exception thrown when a job spec is rejected before anything is written,
 * for example because its {@code id} or {@code command} is missing.
 *
 * <p>This is a client error: the caller should fix the input rather than retry.</p>
 */
public class InvalidJobException extends RuntimeException {

    public InvalidJobException(String message) {
        super(message);
    }

    public InvalidJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
