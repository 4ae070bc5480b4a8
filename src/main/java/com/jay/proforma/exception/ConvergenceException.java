package com.jay.proforma.exception;

public class ConvergenceException extends NumericFailureException {

    public ConvergenceException(String message) {
        super(message);
    }
}
