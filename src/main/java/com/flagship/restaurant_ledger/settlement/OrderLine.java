package com.flagship.restaurant_ledger.settlement;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * One order item with everything needed to cost it.
 */
@Value
@Builder
public class OrderLine {
    Long orderItemId;
    Long productId;
    BigDecimal quantity;
    /** Preset product cost; null or zero means cost from the recipe. */
    BigDecimal productCostPrice;
    @Singular("recipePortion")
    List<RecipePortion> recipe;
    @Singular
    List<ExtraPortion> extras;

    @Value
    public static class RecipePortion {
        BigDecimal portions;
        IngredientCostBasis ingredient;
    }

    /**
     * A customization. {@code extra} adds {@code quantity} portions; {@code base}
     * with a positive {@code delta} adds {@code delta} portions of a recipe ingredient.
     */
    @Value
    public static class ExtraPortion {
        String type;
        BigDecimal quantity;
        BigDecimal delta;
        IngredientCostBasis ingredient;
    }
}
