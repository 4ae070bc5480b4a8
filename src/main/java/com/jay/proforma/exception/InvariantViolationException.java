package com.jay.proforma.exception;

/**
 * The run reached a state the model forbids (negative loan balance, negative cash handed to a
 * waterfall tier). Fatal for the run; never caught at the calculation boundary.
 */
public class InvariantViolationException extends ProFormaException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
