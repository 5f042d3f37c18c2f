package com.flagship.restaurant_ledger.purchase;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class UnitPriceNormalizerTest {

    @Test
    @DisplayName("Floating point noise is removed")
    void testFloatingPointNoise() {
        assertEquals(new BigDecimal("39.9"), UnitPriceNormalizer.normalize(new BigDecimal("39.9000000001")));
    }

    @Test
    @DisplayName("Two-decimal prices are kept")
    void testCentsKept() {
        assertEquals(new BigDecimal("39.99"), UnitPriceNormalizer.normalize(new BigDecimal("39.99")));
    }

    @Test
    @DisplayName("More than two significant decimals round half up to cents")
    void testRoundsToCents() {
        assertEquals(new BigDecimal("12.35"), UnitPriceNormalizer.normalize(new BigDecimal("12.345")));
        assertEquals(new BigDecimal("0.01"), UnitPriceNormalizer.normalize(new BigDecimal("0.0051")));
    }

    @Test
    @DisplayName("Whole prices never get a negative scale")
    void testWholeNumber() {
        BigDecimal result = UnitPriceNormalizer.normalize(new BigDecimal("100.00"));
        assertEquals(new BigDecimal("100"), result);
        assertEquals(0, result.scale());
    }

    @Test
    @DisplayName("Tiny prices round to zero")
    void testRoundsToZero() {
        assertEquals(0, UnitPriceNormalizer.normalize(new BigDecimal("0.004")).signum());
    }

    @Test
    @DisplayName("Null stays null")
    void testNull() {
        assertNull(UnitPriceNormalizer.normalize(null));
    }
}
