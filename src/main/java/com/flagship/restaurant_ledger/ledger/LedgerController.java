package com.flagship.restaurant_ledger.ledger;

import com.flagship.restaurant_ledger.common.OperationResult;
import com.flagship.restaurant_ledger.common.PageResult;
import com.flagship.restaurant_ledger.common.Strings;
import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.ledger.dto.CreateMovementRequest;
import com.flagship.restaurant_ledger.ledger.dto.GatewayInfoRequest;
import com.flagship.restaurant_ledger.ledger.dto.MovementDeletion;
import com.flagship.restaurant_ledger.ledger.dto.PaymentStatusRequest;
import com.flagship.restaurant_ledger.ledger.dto.ReconcileRequest;
import com.flagship.restaurant_ledger.ledger.dto.UpdateMovementRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for financial movements and ledger reports.
 */
@RestController
@RequestMapping("/api/financial-movements")
@RequiredArgsConstructor
public class LedgerController {

    private static final String USER_ID_HEADER = "X-User-Id";

    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<OperationResult<FinancialMovement>> create(
            @Valid @RequestBody CreateMovementRequest request,
            @RequestHeader(USER_ID_HEADER) Long userId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(OperationResult.ok(ledgerService.create(request, userId), "Movement recorded"));
    }

    @GetMapping
    public OperationResult<PageResult<FinancialMovement>> list(
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate,
            @RequestParam(value = "type", required = false) String type,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "payment_status", required = false) String paymentStatus,
            @RequestParam(value = "related_entity_type", required = false) String relatedEntityType,
            @RequestParam(value = "related_entity_id", required = false) Long relatedEntityId,
            @RequestParam(value = "payment_gateway_id", required = false) String paymentGatewayId,
            @RequestParam(value = "transaction_id", required = false) String transactionId,
            @RequestParam(value = "bank_account", required = false) String bankAccount,
            @RequestParam(value = "reconciled", required = false) Boolean reconciled,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "page_size", required = false) Integer pageSize) {
        MovementFilter filter = MovementFilter.builder()
                .startDate(MovementDateParser.parseDate(startDate))
                .endDate(MovementDateParser.parseDate(endDate))
                .type(isBlank(type) ? null : MovementType.parse(type))
                .category(Strings.blankToNull(category))
                .paymentStatus(isBlank(paymentStatus) ? null : PaymentStatus.parse(paymentStatus))
                .relatedEntityType(Strings.blankToNull(relatedEntityType))
                .relatedEntityId(relatedEntityId)
                .paymentGatewayId(Strings.blankToNull(paymentGatewayId))
                .transactionId(Strings.blankToNull(transactionId))
                .bankAccount(Strings.blankToNull(bankAccount))
                .reconciled(reconciled)
                .build();
        return OperationResult.ok(ledgerService.list(filter, page, pageSize));
    }

    @GetMapping("/{id}")
    public OperationResult<FinancialMovement> get(@PathVariable("id") long id) {
        return OperationResult.ok(ledgerService.getById(id));
    }

    @PatchMapping("/{id}")
    public OperationResult<FinancialMovement> update(
            @PathVariable("id") long id,
            @RequestBody UpdateMovementRequest request,
            @RequestHeader(USER_ID_HEADER) Long userId) {
        return OperationResult.ok(ledgerService.update(id, request, userId), "Movement updated");
    }

    @PatchMapping("/{id}/payment-status")
    public OperationResult<FinancialMovement> updatePaymentStatus(
            @PathVariable("id") long id,
            @RequestBody PaymentStatusRequest request,
            @RequestHeader(USER_ID_HEADER) Long userId) {
        return OperationResult.ok(
                ledgerService.updatePaymentStatus(id, request.getPaymentStatus(), request.getMovementDate(), userId),
                "Payment status updated");
    }

    @PatchMapping("/{id}/reconciliation")
    public OperationResult<FinancialMovement> reconcile(
            @PathVariable("id") long id,
            @RequestBody ReconcileRequest request) {
        if (request.getReconciled() == null) {
            throw new LedgerException(ErrorCode.NO_UPDATES, "reconciled is required");
        }
        return OperationResult.ok(ledgerService.reconcile(id, request.getReconciled()));
    }

    @PatchMapping("/{id}/gateway")
    public OperationResult<FinancialMovement> updateGatewayInfo(
            @PathVariable("id") long id,
            @RequestBody GatewayInfoRequest request,
            @RequestHeader(USER_ID_HEADER) Long userId) {
        return OperationResult.ok(ledgerService.updateGatewayInfo(id, request.getPaymentGatewayId(),
                request.getTransactionId(), request.getBankAccount(), userId));
    }

    @DeleteMapping("/{id}")
    public OperationResult<MovementDeletion> delete(
            @PathVariable("id") long id,
            @RequestHeader(USER_ID_HEADER) Long userId) {
        return OperationResult.ok(ledgerService.delete(id, userId), "Movement deleted");
    }

    @GetMapping("/cash-flow")
    public OperationResult<CashFlowSummary> cashFlow(
            @RequestParam(value = "period", required = false) String period,
            @RequestParam(value = "include_pending", defaultValue = "false") boolean includePending) {
        return OperationResult.ok(ledgerService.cashFlowSummary(period, includePending));
    }

    @GetMapping("/reconciliation-report")
    public OperationResult<ReconciliationReport> reconciliationReport(
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate,
            @RequestParam(value = "reconciled", required = false) Boolean reconciled,
            @RequestParam(value = "payment_gateway_id", required = false) String paymentGatewayId) {
        return OperationResult.ok(ledgerService.reconciliationReport(startDate, endDate, reconciled, paymentGatewayId));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
