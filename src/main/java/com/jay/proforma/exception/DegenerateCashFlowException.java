package com.jay.proforma.exception;

/** Empty, too short, or single-signed cash-flow series handed to the returns solver. */
public class DegenerateCashFlowException extends NumericFailureException {

    public DegenerateCashFlowException(String message) {
        super(message);
    }
}
