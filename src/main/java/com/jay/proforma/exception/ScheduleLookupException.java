package com.jay.proforma.exception;

public class ScheduleLookupException extends NumericFailureException {

    public ScheduleLookupException(String series, int period, int size) {
        super(String.format("%s has no period %d (valid range 0..%d)", series, period, size - 1));
    }
}
