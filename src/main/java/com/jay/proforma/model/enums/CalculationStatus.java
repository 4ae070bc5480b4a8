package com.jay.proforma.model.enums;

public enum CalculationStatus {
    SUCCESS,
    VALIDATION_ERROR,
    NUMERIC_ERROR
}
