package com.jay.proforma.exception;

/**
 * A calculation that cannot produce a trustworthy number. Never replaced by a zero or a
 * placeholder rate.
 */
public abstract class NumericFailureException extends ProFormaException {

    protected NumericFailureException(String message) {
        super(message);
    }
}
