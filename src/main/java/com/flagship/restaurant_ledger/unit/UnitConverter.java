package com.flagship.restaurant_ledger.unit;

import java.math.BigDecimal;

/**
 * Converts quantities between measurement units of the same dimension.
 */
public interface UnitConverter {

    /**
     * @throws UnitConversionException if either unit is unknown or the units are incompatible
     */
    BigDecimal convert(BigDecimal quantity, String fromUnit, String toUnit);

    /**
     * True when both units are known and share a dimension, i.e. {@link #convert} will not throw.
     */
    boolean isCompatible(String fromUnit, String toUnit);
}
