package com.jay.proforma.exception;

import java.time.LocalDate;

public class RateCurveRangeException extends NumericFailureException {

    public RateCurveRangeException(LocalDate date, LocalDate first, LocalDate last) {
        super(String.format("No index rate for %s: curve covers %s to %s", date, first, last));
    }

    public RateCurveRangeException(String message) {
        super(message);
    }
}
