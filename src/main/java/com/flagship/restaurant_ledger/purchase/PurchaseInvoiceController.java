package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.audit.AuditEntry;
import com.flagship.restaurant_ledger.common.OperationResult;
import com.flagship.restaurant_ledger.common.PageResult;
import com.flagship.restaurant_ledger.ledger.MovementDateParser;
import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import com.flagship.restaurant_ledger.purchase.dto.CreateInvoiceRequest;
import com.flagship.restaurant_ledger.purchase.dto.InvoiceDeletion;
import com.flagship.restaurant_ledger.purchase.dto.UpdateInvoiceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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

import java.util.List;

/**
 * REST endpoints for supplier invoices. The caller is identified by the
 * {@code X-User-Id} header.
 */
@RestController
@RequestMapping("/api/purchases")
@RequiredArgsConstructor
@Slf4j
public class PurchaseInvoiceController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final PurchaseInvoiceService purchaseInvoiceService;

    @PostMapping
    public ResponseEntity<OperationResult<PurchaseInvoice>> create(
            @Valid @RequestBody CreateInvoiceRequest request,
            @RequestHeader(USER_ID_HEADER) Long userId) {
        PurchaseInvoice invoice = purchaseInvoiceService.create(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(OperationResult.ok(invoice, "Purchase invoice registered"));
    }

    @GetMapping
    public OperationResult<PageResult<PurchaseInvoice>> list(
            @RequestParam(value = "supplier_name", required = false) String supplierName,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate,
            @RequestParam(value = "payment_status", required = false) String paymentStatus,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "page_size", required = false) Integer pageSize) {
        InvoiceFilter filter = InvoiceFilter.builder()
                .supplierName(supplierName)
                .startDate(MovementDateParser.parseDate(startDate))
                .endDate(MovementDateParser.parseDate(endDate))
                .paymentStatus(paymentStatus == null || paymentStatus.isBlank()
                        ? null
                        : PaymentStatus.parse(paymentStatus))
                .build();
        return OperationResult.ok(purchaseInvoiceService.list(filter, page, pageSize));
    }

    @GetMapping("/{id}")
    public OperationResult<PurchaseInvoice> get(@PathVariable("id") long id) {
        return OperationResult.ok(purchaseInvoiceService.getById(id));
    }

    @GetMapping("/{id}/audit")
    public OperationResult<List<AuditEntry>> auditTrail(@PathVariable("id") long id) {
        return OperationResult.ok(purchaseInvoiceService.getAuditTrail(id));
    }

    @PatchMapping("/{id}")
    public OperationResult<PurchaseInvoice> update(
            @PathVariable("id") long id,
            @RequestBody UpdateInvoiceRequest request,
            @RequestHeader(USER_ID_HEADER) Long userId) {
        return OperationResult.ok(purchaseInvoiceService.update(id, request, userId), "Purchase invoice updated");
    }

    @DeleteMapping("/{id}")
    public OperationResult<InvoiceDeletion> delete(
            @PathVariable("id") long id,
            @RequestHeader(USER_ID_HEADER) Long userId) {
        log.info("Delete requested for invoice {} by user {}", id, userId);
        return OperationResult.ok(purchaseInvoiceService.delete(id, userId), "Purchase invoice deleted");
    }
}
