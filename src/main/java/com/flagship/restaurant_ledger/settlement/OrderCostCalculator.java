package com.flagship.restaurant_ledger.settlement;

import com.flagship.restaurant_ledger.unit.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Cost of goods sold for an order.
 *
 * Line cost = (product cost + extras cost) x line quantity, where the product
 * cost is its preset cost price or, failing that, the sum of its recipe
 * portions at ingredient price.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderCostCalculator {

    static final String EXTRA = "extra";
    static final String BASE = "base";

    private static final int WORKING_SCALE = 10;

    private final UnitConverter unitConverter;

    /**
     * @return total cost of the lines, rounded to cents
     */
    public BigDecimal totalCost(List<OrderLine> lines) {
        BigDecimal total = BigDecimal.ZERO;
        for (OrderLine line : lines) {
            total = total.add(lineCost(line));
        }
        return total.setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal lineCost(OrderLine line) {
        BigDecimal unitCost = productCost(line).add(extrasCost(line));
        return unitCost.multiply(nullToZero(line.getQuantity()));
    }

    BigDecimal productCost(OrderLine line) {
        BigDecimal preset = line.getProductCostPrice();
        if (preset != null && preset.signum() > 0) {
            return preset;
        }
        BigDecimal cost = BigDecimal.ZERO;
        for (OrderLine.RecipePortion portion : line.getRecipe()) {
            cost = cost.add(nullToZero(portion.getPortions()).multiply(nullToZero(portion.getIngredient().getPrice())));
        }
        return cost;
    }

    BigDecimal extrasCost(OrderLine line) {
        BigDecimal cost = BigDecimal.ZERO;
        for (OrderLine.ExtraPortion extra : line.getExtras()) {
            BigDecimal portions = chargedPortions(extra);
            if (portions.signum() > 0) {
                cost = cost.add(portions.multiply(costPerBasePortion(extra.getIngredient())));
            }
        }
        return cost;
    }

    /**
     * Price of one base portion: the stock-unit price scaled to the portion's
     * unit and size. Falls back to {@code price x basePortionQuantity} when the
     * units cannot be converted.
     */
    public BigDecimal costPerBasePortion(IngredientCostBasis ingredient) {
        BigDecimal price = nullToZero(ingredient.getPrice());
        BigDecimal portionQuantity = ingredient.getBasePortionQuantity() == null
                ? BigDecimal.ONE
                : ingredient.getBasePortionQuantity();

        String stockUnit = ingredient.getStockUnit();
        String portionUnit = ingredient.getBasePortionUnit();
        if (stockUnit == null || portionUnit == null || stockUnit.equalsIgnoreCase(portionUnit)) {
            return price.multiply(portionQuantity);
        }

        if (!unitConverter.isCompatible(stockUnit, portionUnit)) {
            log.warn("Cannot convert {} to {} for ingredient {}; costing the portion at stock-unit price",
                    stockUnit, portionUnit, ingredient.getIngredientId());
            return price.multiply(portionQuantity);
        }

        BigDecimal portionUnitsPerStockUnit = unitConverter.convert(BigDecimal.ONE, stockUnit, portionUnit);
        if (portionUnitsPerStockUnit.signum() <= 0) {
            return price.multiply(portionQuantity);
        }
        return price.divide(portionUnitsPerStockUnit, WORKING_SCALE, RoundingMode.HALF_UP).multiply(portionQuantity);
    }

    private static BigDecimal chargedPortions(OrderLine.ExtraPortion extra) {
        if (EXTRA.equalsIgnoreCase(extra.getType())) {
            return nullToZero(extra.getQuantity());
        }
        if (BASE.equalsIgnoreCase(extra.getType()) && extra.getDelta() != null && extra.getDelta().signum() > 0) {
            return extra.getDelta();
        }
        return BigDecimal.ZERO;
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
