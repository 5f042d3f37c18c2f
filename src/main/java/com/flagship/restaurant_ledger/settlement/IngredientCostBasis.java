package com.flagship.restaurant_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What an ingredient costs: {@code price} is per stock unit, and one base
 * portion is {@code basePortionQuantity} of {@code basePortionUnit}.
 */
@Value
@Builder
public class IngredientCostBasis {
    Long ingredientId;
    String name;
    BigDecimal price;
    String stockUnit;
    BigDecimal basePortionQuantity;
    String basePortionUnit;
}
