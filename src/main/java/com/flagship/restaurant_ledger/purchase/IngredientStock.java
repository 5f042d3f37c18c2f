package com.flagship.restaurant_ledger.purchase;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class IngredientStock {
    Long id;
    String name;
    BigDecimal currentStock;
}
