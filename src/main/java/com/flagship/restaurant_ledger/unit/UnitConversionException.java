package com.flagship.restaurant_ledger.unit;

/**
 * Raised for unknown unit symbols or units of different dimensions.
 */
public class UnitConversionException extends RuntimeException {

    public UnitConversionException(String message) {
        super(message);
    }
}
