package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.purchase.dto.InvoiceItemRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validation and total-price derivation of invoice lines.
 */
class InvoiceItemPricerTest {

    private final InvoiceItemPricer pricer = new InvoiceItemPricer();

    private static InvoiceItemRequest.InvoiceItemRequestBuilder item() {
        return InvoiceItemRequest.builder()
                .ingredientId(7L)
                .quantity(new BigDecimal("5000"))
                .unitPrice(new BigDecimal("39.90"));
    }

    @Test
    @DisplayName("Supplied total price is kept verbatim")
    void testSuppliedTotalPrice() {
        PurchaseInvoiceItem priced = pricer.price(List.of(item()
                .totalPrice(new BigDecimal("199.50"))
                .displayQuantity(new BigDecimal("5"))
                .build())).get(0);

        assertEquals(new BigDecimal("199.50"), priced.getTotalPrice());
        assertEquals(new BigDecimal("5000.000"), priced.getQuantity());
        assertEquals(new BigDecimal("39.9"), priced.getUnitPrice());
    }

    @Test
    @DisplayName("Display quantity times unit price is used when no total is supplied")
    void testDisplayQuantityTotal() {
        PurchaseInvoiceItem priced = pricer.price(List.of(item()
                .displayQuantity(new BigDecimal("5"))
                .build())).get(0);

        assertEquals(new BigDecimal("199.50"), priced.getTotalPrice());
    }

    @Test
    @DisplayName("Stock quantity times unit price is the last resort")
    void testStockQuantityFallback() {
        PurchaseInvoiceItem priced = pricer.price(List.of(item()
                .quantity(new BigDecimal("3"))
                .unitPrice(new BigDecimal("2.5"))
                .build())).get(0);

        assertEquals(new BigDecimal("7.50"), priced.getTotalPrice());
    }

    @Test
    @DisplayName("Empty item list is rejected")
    void testEmptyItems() {
        LedgerException exception = assertThrows(LedgerException.class, () -> pricer.price(List.of()));
        assertEquals(ErrorCode.INVALID_ITEMS, exception.getErrorCode());
        assertEquals(ErrorCode.INVALID_ITEMS, assertThrows(LedgerException.class,
                () -> pricer.price(null)).getErrorCode());
    }

    @Test
    @DisplayName("Missing ingredient, zero quantity and zero unit price are invalid items")
    void testInvalidItems() {
        assertEquals(ErrorCode.INVALID_ITEM, assertThrows(LedgerException.class,
                () -> pricer.price(List.of(item().ingredientId(null).build()))).getErrorCode());
        assertEquals(ErrorCode.INVALID_ITEM, assertThrows(LedgerException.class,
                () -> pricer.price(List.of(item().quantity(BigDecimal.ZERO).build()))).getErrorCode());
        assertEquals(ErrorCode.INVALID_ITEM, assertThrows(LedgerException.class,
                () -> pricer.price(List.of(item().unitPrice(new BigDecimal("-1")).build()))).getErrorCode());
    }

    @Test
    @DisplayName("A unit price that normalizes to zero is rejected")
    void testUnitPriceRoundsToZero() {
        LedgerException exception = assertThrows(LedgerException.class,
                () -> pricer.price(List.of(item().unitPrice(new BigDecimal("0.001")).build())));
        assertEquals(ErrorCode.INVALID_UNIT_PRICE, exception.getErrorCode());
    }

    @Test
    @DisplayName("A non-positive supplied total is rejected")
    void testInvalidTotalPrice() {
        LedgerException exception = assertThrows(LedgerException.class,
                () -> pricer.price(List.of(item().totalPrice(BigDecimal.ZERO).build())));
        assertEquals(ErrorCode.INVALID_TOTAL_PRICE, exception.getErrorCode());
    }

    @Test
    @DisplayName("Invoice total is the sum of line totals")
    void testSumTotals() {
        List<PurchaseInvoiceItem> items = pricer.price(List.of(
                item().totalPrice(new BigDecimal("10.10")).build(),
                item().ingredientId(8L).totalPrice(new BigDecimal("0.15")).build()));

        assertEquals(new BigDecimal("10.25"), InvoiceItemPricer.sumTotals(items));
    }
}
