package com.flagship.restaurant_ledger.unit;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Units used by stock, recipes and purchases, each with its factor to the
 * family's base unit (gram, millilitre, unit).
 */
public enum MeasurementUnit {

    MILLIGRAM(Dimension.MASS, new BigDecimal("0.001"), List.of("mg")),
    GRAM(Dimension.MASS, BigDecimal.ONE, List.of("g", "gr")),
    KILOGRAM(Dimension.MASS, new BigDecimal("1000"), List.of("kg")),
    MILLILITER(Dimension.VOLUME, BigDecimal.ONE, List.of("ml")),
    LITER(Dimension.VOLUME, new BigDecimal("1000"), List.of("l", "lt")),
    UNIT(Dimension.COUNT, BigDecimal.ONE, List.of("un", "unit", "und")),
    DOZEN(Dimension.COUNT, new BigDecimal("12"), List.of("dz"));

    public enum Dimension { MASS, VOLUME, COUNT }

    private final Dimension dimension;
    private final BigDecimal toBase;
    private final List<String> symbols;

    MeasurementUnit(Dimension dimension, BigDecimal toBase, List<String> symbols) {
        this.dimension = dimension;
        this.toBase = toBase;
        this.symbols = symbols;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public BigDecimal getToBase() {
        return toBase;
    }

    public static Optional<MeasurementUnit> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String normalized = symbol.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(unit -> unit.symbols.contains(normalized))
                .findFirst();
    }
}
