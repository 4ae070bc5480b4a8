package com.jay.proforma.exception;

/**
 * Base type for every failure raised by the calculation core.
 */
public abstract class ProFormaException extends RuntimeException {

    protected ProFormaException(String message) {
        super(message);
    }

    protected ProFormaException(String message, Throwable cause) {
        super(message, cause);
    }
}
