package com.flagship.restaurant_ledger.settlement;

import com.flagship.restaurant_ledger.common.OperationResult;
import com.flagship.restaurant_ledger.settlement.dto.SettlementRequest;
import com.flagship.restaurant_ledger.settlement.dto.SettlementResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderSettlementController {

    private final OrderSettlementService settlementService;

    /**
     * Books revenue, CMV and payment fee for a finished order. Repeating the
     * call returns the movements booked the first time.
     */
    @PostMapping("/{orderId}/settlement")
    public ResponseEntity<OperationResult<SettlementResult>> settle(
            @PathVariable("orderId") long orderId,
            @Valid @RequestBody SettlementRequest request,
            @RequestHeader(value = "X-User-Id", required = false) Long userId) {
        SettlementResult result = settlementService.registerOrderRevenueAndCmv(
                orderId, request.getOrderTotal(), request.getPaymentMethod(), request.getPaymentDate(), userId);
        HttpStatus status = result.isAlreadySettled() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(OperationResult.ok(result,
                result.isAlreadySettled() ? "Order already settled" : "Order settled"));
    }
}
