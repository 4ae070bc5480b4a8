package com.jay.proforma.model.enums;

public enum RateMode {
    FIXED,    // contractual coupon for the whole term
    FLOATING  // index curve rate + spread, looked up per period date
}
