package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stock levels of ingredients, as touched by purchase invoices.
 */
@Repository
public class IngredientStockRepository {

    private static final RowMapper<IngredientStock> STOCK_MAPPER = (rs, rowNum) -> new IngredientStock(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getBigDecimal("current_stock")
    );

    /**
     * Returns which of the given ids exist, in a single query.
     */
    public Set<Long> findExistingIds(Collection<Long> ids, TransactionContext tx) {
        if (ids.isEmpty()) {
            return Collections.emptySet();
        }
        return new HashSet<>(tx.jdbc().queryForList(
                "SELECT id FROM ingredients WHERE id IN (" + placeholders(ids.size()) + ")",
                Long.class, ids.toArray()));
    }

    /**
     * Locks the ingredient rows in ascending id order, so concurrent
     * invoice changes touching the same ingredients cannot deadlock.
     */
    public List<IngredientStock> lockForUpdate(Collection<Long> ids, TransactionContext tx) {
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }
        List<Long> ordered = ids.stream().distinct().sorted().collect(Collectors.toList());
        return tx.jdbc().query(
                "SELECT id, name, current_stock FROM ingredients WHERE id IN (" + placeholders(ordered.size())
                        + ") ORDER BY id FOR UPDATE",
                STOCK_MAPPER, ordered.toArray());
    }

    /**
     * @return rows updated; 0 means the ingredient vanished
     */
    public int addStock(long ingredientId, BigDecimal quantity, TransactionContext tx) {
        return tx.jdbc().update(
                "UPDATE ingredients SET current_stock = current_stock + ? WHERE id = ?", quantity, ingredientId);
    }

    public int subtractStock(long ingredientId, BigDecimal quantity, TransactionContext tx) {
        return tx.jdbc().update(
                "UPDATE ingredients SET current_stock = current_stock - ? WHERE id = ?", quantity, ingredientId);
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
