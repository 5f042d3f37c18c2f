package com.flagship.restaurant_ledger.settlement;

import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads orders, their items, recipes and extras for costing.
 */
@Repository
public class OrderLineRepository {

    private static final String INGREDIENT_COLUMNS =
            "i.id AS ingredient_id, i.name AS ingredient_name, i.price, i.stock_unit, "
                    + "i.base_portion_quantity, i.base_portion_unit";

    /**
     * Locks the order row so concurrent settlements of one order serialize.
     *
     * @return false if the order does not exist
     */
    public boolean lockOrder(long orderId, TransactionContext tx) {
        return !tx.jdbc().queryForList("SELECT id FROM orders WHERE id = ? FOR UPDATE", Long.class, orderId)
                .isEmpty();
    }

    public List<OrderLine> findLines(long orderId, TransactionContext tx) {
        List<OrderLine.OrderLineBuilder> builders = new ArrayList<>();
        Map<Long, OrderLine.OrderLineBuilder> byItem = new HashMap<>();
        Map<Long, List<OrderLine.OrderLineBuilder>> byProduct = new HashMap<>();

        tx.jdbc().query("""
                SELECT oi.id, oi.product_id, oi.quantity, p.cost_price
                FROM order_items oi
                JOIN products p ON p.id = oi.product_id
                WHERE oi.order_id = ?
                ORDER BY oi.id
                """, rs -> {
            OrderLine.OrderLineBuilder builder = OrderLine.builder()
                    .orderItemId(rs.getLong("id"))
                    .productId(rs.getLong("product_id"))
                    .quantity(rs.getBigDecimal("quantity"))
                    .productCostPrice(rs.getBigDecimal("cost_price"));
            builders.add(builder);
            byItem.put(rs.getLong("id"), builder);
            byProduct.computeIfAbsent(rs.getLong("product_id"), id -> new ArrayList<>()).add(builder);
        }, orderId);

        if (builders.isEmpty()) {
            return List.of();
        }

        tx.jdbc().query("SELECT pi.product_id, pi.portions, " + INGREDIENT_COLUMNS + """

                FROM product_ingredients pi
                JOIN ingredients i ON i.id = pi.ingredient_id
                WHERE pi.product_id IN (SELECT product_id FROM order_items WHERE order_id = ?)
                ORDER BY pi.product_id, i.id
                """, rs -> {
            OrderLine.RecipePortion portion = new OrderLine.RecipePortion(
                    rs.getBigDecimal("portions"), mapIngredient(rs));
            for (OrderLine.OrderLineBuilder builder : byProduct.getOrDefault(rs.getLong("product_id"), List.of())) {
                builder.recipePortion(portion);
            }
        }, orderId);

        tx.jdbc().query("SELECT e.order_item_id, e.type, e.quantity, e.delta, " + INGREDIENT_COLUMNS + """

                FROM order_item_extras e
                JOIN order_items oi ON oi.id = e.order_item_id
                JOIN ingredients i ON i.id = e.ingredient_id
                WHERE oi.order_id = ?
                ORDER BY e.id
                """, rs -> {
            OrderLine.OrderLineBuilder builder = byItem.get(rs.getLong("order_item_id"));
            if (builder != null) {
                builder.extra(new OrderLine.ExtraPortion(rs.getString("type"), rs.getBigDecimal("quantity"),
                        rs.getBigDecimal("delta"), mapIngredient(rs)));
            }
        }, orderId);

        List<OrderLine> lines = new ArrayList<>(builders.size());
        builders.forEach(builder -> lines.add(builder.build()));
        return lines;
    }

    private static IngredientCostBasis mapIngredient(ResultSet rs) throws SQLException {
        return INGREDIENT_MAPPER.mapRow(rs, 0);
    }

    private static final RowMapper<IngredientCostBasis> INGREDIENT_MAPPER = (rs, rowNum) -> IngredientCostBasis.builder()
            .ingredientId(rs.getLong("ingredient_id"))
            .name(rs.getString("ingredient_name"))
            .price(rs.getBigDecimal("price"))
            .stockUnit(rs.getString("stock_unit"))
            .basePortionQuantity(rs.getBigDecimal("base_portion_quantity"))
            .basePortionUnit(rs.getString("base_portion_unit"))
            .build();
}
