package com.jay.proforma.model.enums;

public enum EquityClass {
    LP,  // limited partner
    GP   // general partner / sponsor
}
