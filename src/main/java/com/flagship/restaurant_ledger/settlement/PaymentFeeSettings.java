package com.flagship.restaurant_ledger.settlement;

import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fee percentages charged per payment method, read from the latest
 * {@code app_settings} row.
 */
@Component
public class PaymentFeeSettings {

    private static final Map<String, String> FEE_COLUMNS = Map.of(
            "credit", "credit_card_fee_pct",
            "debit", "debit_card_fee_pct",
            "pix", "pix_fee_pct",
            "ifood", "ifood_fee_pct",
            "uber_eats", "uber_eats_fee_pct",
            "uber", "uber_eats_fee_pct"
    );

    /**
     * @return the configured percentage, or zero when the method carries no
     *         fee or nothing is configured
     */
    public BigDecimal feePercentage(String paymentMethod, TransactionContext tx) {
        if (paymentMethod == null) {
            return BigDecimal.ZERO;
        }
        String column = FEE_COLUMNS.get(paymentMethod.trim().toLowerCase(Locale.ROOT));
        if (column == null) {
            return BigDecimal.ZERO;
        }
        List<BigDecimal> rows = tx.jdbc().queryForList(
                "SELECT " + column + " FROM app_settings ORDER BY id DESC LIMIT 1", BigDecimal.class);
        if (rows.isEmpty() || rows.get(0) == null) {
            return BigDecimal.ZERO;
        }
        return rows.get(0);
    }
}
