package com.flagship.restaurant_ledger.unit;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-ratio conversion for mass (mg, g, kg), volume (ml, l) and count (un, dz).
 * Results are computed at 10 decimal places with trailing zeros stripped.
 */
@Component
public class StandardUnitConverter implements UnitConverter {

    private static final int SCALE = 10;

    @Override
    public BigDecimal convert(BigDecimal quantity, String fromUnit, String toUnit) {
        if (quantity == null) {
            throw new UnitConversionException("Quantity is required");
        }
        MeasurementUnit from = resolve(fromUnit);
        MeasurementUnit to = resolve(toUnit);

        if (from.getDimension() != to.getDimension()) {
            throw new UnitConversionException(String.format(
                    "Cannot convert %s (%s) to %s (%s)",
                    fromUnit, from.getDimension(), toUnit, to.getDimension()));
        }
        if (from == to) {
            return quantity;
        }

        BigDecimal converted = quantity
                .multiply(from.getToBase())
                .divide(to.getToBase(), SCALE, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        return converted.scale() < 0 ? converted.setScale(0) : converted;
    }

    @Override
    public boolean isCompatible(String fromUnit, String toUnit) {
        return MeasurementUnit.fromSymbol(fromUnit)
                .flatMap(from -> MeasurementUnit.fromSymbol(toUnit)
                        .map(to -> from.getDimension() == to.getDimension()))
                .orElse(false);
    }

    private MeasurementUnit resolve(String symbol) {
        return MeasurementUnit.fromSymbol(symbol)
                .orElseThrow(() -> new UnitConversionException("Unknown unit: " + symbol));
    }
}
