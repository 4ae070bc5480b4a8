package com.jay.proforma.exception;

/** Exit cap rate of zero or below: capitalizing forward NOI would divide by zero. */
public class InvalidCapRateException extends NumericFailureException {

    public InvalidCapRateException(double capRate) {
        super(String.format("Exit cap rate must be positive to capitalize forward NOI (was %.4f)", capRate));
    }
}
