package com.flagship.restaurant_ledger.unit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit conversion between mass, volume and count units.
 */
class StandardUnitConverterTest {

    private final StandardUnitConverter converter = new StandardUnitConverter();

    @Test
    @DisplayName("Kilograms convert to grams")
    void testKilogramToGram() {
        assertEquals(0, new BigDecimal("1500").compareTo(converter.convert(new BigDecimal("1.5"), "kg", "g")));
    }

    @Test
    @DisplayName("Grams convert to kilograms with trailing zeros stripped")
    void testGramToKilogram() {
        BigDecimal result = converter.convert(new BigDecimal("250"), "g", "kg");
        assertEquals(new BigDecimal("0.25"), result);
    }

    @Test
    @DisplayName("Litres convert to millilitres and unit aliases are case-insensitive")
    void testVolumeAliases() {
        assertEquals(0, new BigDecimal("2000").compareTo(converter.convert(new BigDecimal("2"), "L", "ml")));
        assertEquals(0, new BigDecimal("500").compareTo(converter.convert(new BigDecimal("0.5"), "lt", "ML")));
    }

    @Test
    @DisplayName("A dozen is twelve units")
    void testDozenToUnits() {
        assertEquals(0, new BigDecimal("24").compareTo(converter.convert(new BigDecimal("2"), "dz", "un")));
    }

    @Test
    @DisplayName("Same unit returns the quantity unchanged")
    void testSameUnit() {
        BigDecimal quantity = new BigDecimal("3.250");
        assertSame(quantity, converter.convert(quantity, "g", "g"));
    }

    @Test
    @DisplayName("Results are computed at ten decimals")
    void testRepeatingFraction() {
        BigDecimal result = converter.convert(BigDecimal.ONE, "un", "dz");
        assertEquals(new BigDecimal("0.0833333333"), result);
    }

    @Test
    @DisplayName("Converting between mass and volume fails")
    void testIncompatibleUnits() {
        UnitConversionException exception = assertThrows(UnitConversionException.class,
                () -> converter.convert(BigDecimal.ONE, "kg", "l"));
        assertTrue(exception.getMessage().contains("Cannot convert"));
        assertFalse(converter.isCompatible("kg", "l"));
        assertTrue(converter.isCompatible("mg", "KG"));
    }

    @Test
    @DisplayName("Unknown units fail")
    void testUnknownUnit() {
        assertThrows(UnitConversionException.class, () -> converter.convert(BigDecimal.ONE, "cup", "ml"));
        assertFalse(converter.isCompatible("cup", "ml"));
    }
}
