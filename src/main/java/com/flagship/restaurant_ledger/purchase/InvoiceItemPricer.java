package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.purchase.dto.InvoiceItemRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates invoice lines and derives their total price.
 *
 * Total price precedence:
 * 1. the supplied totalPrice, verbatim (rounded to cents)
 * 2. displayQuantity x unitPrice
 * 3. quantity x unitPrice, which is only right when stock and price units match
 */
@Component
@Slf4j
public class InvoiceItemPricer {

    private static final int QUANTITY_SCALE = 3;

    public List<PurchaseInvoiceItem> price(List<InvoiceItemRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new LedgerException(ErrorCode.INVALID_ITEMS);
        }
        List<PurchaseInvoiceItem> items = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            items.add(price(requests.get(i), i + 1));
        }
        return items;
    }

    PurchaseInvoiceItem price(InvoiceItemRequest request, int line) {
        if (request == null || request.getIngredientId() == null) {
            throw new LedgerException(ErrorCode.INVALID_ITEM, "Line " + line + ": ingredient is required");
        }
        BigDecimal quantity = request.getQuantity() == null
                ? null
                : request.getQuantity().setScale(QUANTITY_SCALE, RoundingMode.HALF_UP);
        if (quantity == null || quantity.signum() <= 0) {
            throw new LedgerException(ErrorCode.INVALID_ITEM,
                    "Line " + line + ": quantity must be greater than zero");
        }
        if (request.getUnitPrice() == null || request.getUnitPrice().signum() <= 0) {
            throw new LedgerException(ErrorCode.INVALID_ITEM,
                    "Line " + line + ": unit price must be greater than zero");
        }

        BigDecimal unitPrice = UnitPriceNormalizer.normalize(request.getUnitPrice());
        if (unitPrice.signum() <= 0) {
            throw new LedgerException(ErrorCode.INVALID_UNIT_PRICE,
                    "Line " + line + ": unit price rounds to zero: " + request.getUnitPrice());
        }

        return PurchaseInvoiceItem.builder()
                .ingredientId(request.getIngredientId())
                .quantity(quantity)
                .unitPrice(unitPrice)
                .totalPrice(totalPrice(request, quantity, unitPrice, line))
                .build();
    }

    private BigDecimal totalPrice(InvoiceItemRequest request, BigDecimal quantity, BigDecimal unitPrice, int line) {
        if (request.getTotalPrice() != null) {
            BigDecimal supplied = request.getTotalPrice().setScale(2, RoundingMode.HALF_UP);
            if (supplied.signum() <= 0) {
                throw new LedgerException(ErrorCode.INVALID_TOTAL_PRICE,
                        "Line " + line + ": total price must be greater than zero");
            }
            return supplied;
        }

        BigDecimal computed;
        if (request.getDisplayQuantity() != null && request.getDisplayQuantity().signum() > 0) {
            computed = request.getDisplayQuantity().multiply(unitPrice);
        } else {
            log.warn("Line {} has no total price or display quantity; using stock quantity x unit price "
                    + "for ingredient {}", line, request.getIngredientId());
            computed = quantity.multiply(unitPrice);
        }
        computed = computed.setScale(2, RoundingMode.HALF_UP);
        if (computed.signum() <= 0) {
            throw new LedgerException(ErrorCode.INVALID_TOTAL_PRICE,
                    "Line " + line + ": total price rounds to zero");
        }
        return computed;
    }

    public static BigDecimal sumTotals(List<PurchaseInvoiceItem> items) {
        return items.stream()
                .map(PurchaseInvoiceItem::getTotalPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
