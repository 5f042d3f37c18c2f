package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.audit.AuditAction;
import com.flagship.restaurant_ledger.audit.AuditEntry;
import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.ledger.FinancialMovement;
import com.flagship.restaurant_ledger.ledger.LedgerService;
import com.flagship.restaurant_ledger.ledger.MovementType;
import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import com.flagship.restaurant_ledger.purchase.dto.CreateInvoiceRequest;
import com.flagship.restaurant_ledger.purchase.dto.InvoiceDeletion;
import com.flagship.restaurant_ledger.purchase.dto.InvoiceItemRequest;
import com.flagship.restaurant_ledger.purchase.dto.StockShortage;
import com.flagship.restaurant_ledger.purchase.dto.UpdateInvoiceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Purchase invoices against a real PostgreSQL: every operation moves the
 * invoice, its stock and its expense together or not at all.
 */
@SpringBootTest
@Testcontainers
class PurchaseInvoiceServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("ledger.cache.enabled", () -> "false");
        registry.add("recurrence.scheduler.enabled", () -> "false");
    }

    @Autowired
    private PurchaseInvoiceService purchaseInvoiceService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long adminId;
    private Long managerId;
    private Long staffId;
    private Long otherStaffId;
    private Long flourId;
    private Long sugarId;

    @BeforeEach
    void setUp() {
        adminId = user("Ana Admin", "admin");
        managerId = user("Marcos Manager", "manager");
        staffId = user("Sara Staff", "staff");
        otherStaffId = user("Otto Staff", "staff");
        flourId = ingredient("Flour");
        sugarId = ingredient("Sugar");
    }

    private Long user(String name, String role) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO users (full_name, role) VALUES (?, ?) RETURNING id", Long.class, name, role);
    }

    private Long ingredient(String name) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO ingredients (name, price, current_stock, stock_unit) VALUES (?, 0, 0, 'g') RETURNING id",
                Long.class, name);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static InvoiceItemRequest item(Long ingredientId, String quantity, String unitPrice, String totalPrice) {
        return InvoiceItemRequest.builder()
                .ingredientId(ingredientId)
                .quantity(new BigDecimal(quantity))
                .unitPrice(new BigDecimal(unitPrice))
                .totalPrice(new BigDecimal(totalPrice))
                .build();
    }

    private CreateInvoiceRequest.CreateInvoiceRequestBuilder invoice(InvoiceItemRequest... items) {
        return CreateInvoiceRequest.builder()
                .invoiceNumber("NF-" + System.nanoTime())
                .supplierName("Mill & Co")
                .purchaseDate("01-10-2026")
                .items(List.of(items));
    }

    private BigDecimal stockOf(Long ingredientId) {
        return jdbcTemplate.queryForObject(
                "SELECT current_stock FROM ingredients WHERE id = ?", BigDecimal.class, ingredientId);
    }

    private long countInvoices() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM purchase_invoices", Long.class);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Registering an invoice adds stock and books one pending expense for the line total")
    void testCreateAddsStockAndExpense() {
        printTestHeader("Create Invoice");

        CreateInvoiceRequest request = invoice(
                item(flourId, "5000", "4.50", "22.50"),
                item(sugarId, "2000", "3.20", "6.40"))
                .totalAmount(new BigDecimal("999.99"))
                .build();
        printInput("Request", request);

        PurchaseInvoice saved = purchaseInvoiceService.create(request, staffId);
        printOutput("Invoice", saved);

        assertAmount("28.90", saved.getTotalAmount());
        assertEquals(2, saved.getItems().size());
        assertEquals(PaymentStatus.PENDING, saved.getPaymentStatus());
        assertEquals(LocalDateTime.of(2026, 10, 1, 0, 0), saved.getPurchaseDate());
        assertAmount("5000", stockOf(flourId));
        assertAmount("2000", stockOf(sugarId));

        FinancialMovement expense = ledgerService.getById(saved.getExpenseId());
        printOutput("Expense", expense);
        assertEquals(MovementType.EXPENSE, expense.getType());
        assertAmount("28.90", expense.getValue());
        assertEquals(PaymentStatus.PENDING, expense.getPaymentStatus());
        assertEquals("Purchase - Invoice " + saved.getInvoiceNumber() + " - Mill & Co", expense.getDescription());
        assertEquals("purchase_invoice", expense.getRelatedEntityType());
        assertEquals(saved.getId(), expense.getRelatedEntityId());

        List<AuditEntry> trail = purchaseInvoiceService.getAuditTrail(saved.getId());
        assertEquals(1, trail.size());
        assertEquals(AuditAction.CREATE, trail.get(0).getActionType());
        printSuccess("Invoice, stock and expense written together");
    }

    @Test
    @DisplayName("A paid invoice books a paid expense dated on the payment date")
    void testCreatePaidInvoice() {
        PurchaseInvoice saved = purchaseInvoiceService.create(invoice(item(flourId, "1000", "5.00", "5.00"))
                .paymentStatus("Paid")
                .paymentMethod("pix")
                .paymentDate("2026-10-02")
                .build(), adminId);

        FinancialMovement expense = ledgerService.getById(saved.getExpenseId());
        assertEquals(PaymentStatus.PAID, expense.getPaymentStatus());
        assertEquals(LocalDateTime.of(2026, 10, 2, 0, 0), expense.getMovementDate());
        assertEquals("pix", expense.getPaymentMethod());
    }

    @Test
    @DisplayName("An unknown ingredient rejects the whole invoice")
    void testUnknownIngredientRollsBack() {
        printTestHeader("Unknown Ingredient");
        long invoicesBefore = countInvoices();

        LedgerException e = assertThrows(LedgerException.class, () -> purchaseInvoiceService.create(
                invoice(item(flourId, "1000", "5.00", "5.00"), item(987654L, "1", "1.00", "1.00")).build(),
                adminId));
        printOutput("Error", e.getMessage());

        assertEquals(ErrorCode.INGREDIENT_NOT_FOUND, e.getErrorCode());
        assertEquals(List.of(987654L), e.getDetails());
        assertEquals(invoicesBefore, countInvoices());
        assertAmount("0", stockOf(flourId));
        printSuccess("Nothing written");
    }

    @Test
    @DisplayName("Invalid headers and items are rejected up front")
    void testRequestValidation() {
        LedgerException number = assertThrows(LedgerException.class, () -> purchaseInvoiceService.create(
                invoice(item(flourId, "1", "1.00", "1.00")).invoiceNumber(" ").build(), adminId));
        assertEquals(ErrorCode.INVALID_INVOICE_NUMBER, number.getErrorCode());

        LedgerException supplier = assertThrows(LedgerException.class, () -> purchaseInvoiceService.create(
                invoice(item(flourId, "1", "1.00", "1.00")).supplierName(null).build(), adminId));
        assertEquals(ErrorCode.INVALID_SUPPLIER_NAME, supplier.getErrorCode());

        LedgerException items = assertThrows(LedgerException.class, () -> purchaseInvoiceService.create(
                invoice().build(), adminId));
        assertEquals(ErrorCode.INVALID_ITEMS, items.getErrorCode());
    }

    @Test
    @DisplayName("Replacing items moves stock from the old lines to the new ones and re-prices the expense")
    void testUpdateReplacesItems() {
        printTestHeader("Replace Items");

        PurchaseInvoice created = purchaseInvoiceService.create(
                invoice(item(flourId, "5000", "4.50", "22.50")).build(), staffId);

        UpdateInvoiceRequest request = UpdateInvoiceRequest.builder()
                .items(List.of(item(flourId, "2000", "4.50", "9.00"), item(sugarId, "1000", "3.00", "3.00")))
                .build();
        printInput("Update", request);

        PurchaseInvoice updated = purchaseInvoiceService.update(created.getId(), request, staffId);
        printOutput("Updated", updated);

        assertAmount("12.00", updated.getTotalAmount());
        assertEquals(2, updated.getItems().size());
        assertAmount("2000", stockOf(flourId));
        assertAmount("1000", stockOf(sugarId));
        assertAmount("12.00", ledgerService.getById(created.getExpenseId()).getValue());

        List<AuditEntry> trail = purchaseInvoiceService.getAuditTrail(created.getId());
        assertEquals(AuditAction.UPDATE, trail.get(0).getActionType());
        assertTrue(trail.get(0).getChangedFields().contains("items"));
        assertTrue(trail.get(0).getChangedFields().contains("total_amount"));
        printSuccess("Stock and expense follow the new lines");
    }

    @Test
    @DisplayName("Paying an invoice pays its expense")
    void testUpdatePaymentSyncsExpense() {
        PurchaseInvoice created = purchaseInvoiceService.create(
                invoice(item(flourId, "1000", "5.00", "5.00")).build(), adminId);

        PurchaseInvoice paid = purchaseInvoiceService.update(created.getId(), UpdateInvoiceRequest.builder()
                .paymentStatus("Paid")
                .paymentDate("2026-10-03")
                .paymentMethod("debit")
                .build(), adminId);

        assertEquals(PaymentStatus.PAID, paid.getPaymentStatus());
        FinancialMovement expense = ledgerService.getById(created.getExpenseId());
        assertEquals(PaymentStatus.PAID, expense.getPaymentStatus());
        assertEquals(LocalDateTime.of(2026, 10, 3, 0, 0), expense.getMovementDate());
        assertEquals("debit", expense.getPaymentMethod());
    }

    @Test
    @DisplayName("Only admins, managers and the creator may edit; only admins may delete")
    void testPermissions() {
        printTestHeader("Permissions");

        PurchaseInvoice created = purchaseInvoiceService.create(
                invoice(item(flourId, "1000", "5.00", "5.00")).build(), staffId);
        UpdateInvoiceRequest notes = UpdateInvoiceRequest.builder().notes("checked").build();

        LedgerException other = assertThrows(LedgerException.class,
                () -> purchaseInvoiceService.update(created.getId(), notes, otherStaffId));
        assertEquals(ErrorCode.PERMISSION_DENIED, other.getErrorCode());

        assertEquals("checked", purchaseInvoiceService.update(created.getId(), notes, staffId).getNotes());
        assertNotNull(purchaseInvoiceService.update(created.getId(),
                UpdateInvoiceRequest.builder().notes("approved").build(), managerId));

        LedgerException managerDelete = assertThrows(LedgerException.class,
                () -> purchaseInvoiceService.delete(created.getId(), managerId));
        assertEquals(ErrorCode.PERMISSION_DENIED, managerDelete.getErrorCode());

        LedgerException unknown = assertThrows(LedgerException.class,
                () -> purchaseInvoiceService.delete(created.getId(), 987654L));
        assertEquals(ErrorCode.PERMISSION_DENIED, unknown.getErrorCode());
        printSuccess("Roles enforced");
    }

    @Test
    @DisplayName("Deleting an invoice whose stock was consumed is refused and changes nothing")
    void testDeleteWithInsufficientStock() {
        printTestHeader("Insufficient Stock");

        PurchaseInvoice created = purchaseInvoiceService.create(
                invoice(item(flourId, "5000", "4.50", "22.50"), item(sugarId, "1000", "3.00", "3.00")).build(),
                adminId);
        jdbcTemplate.update("UPDATE ingredients SET current_stock = 1200 WHERE id = ?", flourId);

        LedgerException e = assertThrows(LedgerException.class,
                () -> purchaseInvoiceService.delete(created.getId(), adminId));
        printOutput("Error", e.getMessage());
        printOutput("Details", e.getDetails());

        assertEquals(ErrorCode.INSUFFICIENT_STOCK, e.getErrorCode());
        @SuppressWarnings("unchecked")
        List<StockShortage> shortages = (List<StockShortage>) e.getDetails();
        assertEquals(1, shortages.size());
        assertEquals(flourId, shortages.get(0).getIngredientId());
        assertAmount("3800", shortages.get(0).getShortage());

        assertAmount("1200", stockOf(flourId));
        assertAmount("1000", stockOf(sugarId));
        assertNotNull(purchaseInvoiceService.getById(created.getId()));
        assertNotNull(ledgerService.getById(created.getExpenseId()));
        printSuccess("Delete refused, nothing changed");
    }

    @Test
    @DisplayName("Deleting an invoice reverses stock, removes its expense and keeps the audit trail")
    void testDeleteReversesEverything() {
        printTestHeader("Delete Invoice");

        PurchaseInvoice created = purchaseInvoiceService.create(
                invoice(item(flourId, "5000", "4.50", "22.50")).build(), adminId);

        InvoiceDeletion deletion = purchaseInvoiceService.delete(created.getId(), adminId);
        printOutput("Deletion", deletion);

        assertEquals(created.getId(), deletion.getInvoiceId());
        assertEquals(created.getExpenseId(), deletion.getDeletedExpenseId());
        assertEquals(List.of(flourId), deletion.getRestoredIngredientIds());
        assertTrue(deletion.isAuditRecorded());
        assertAmount("0", stockOf(flourId));

        LedgerException gone = assertThrows(LedgerException.class,
                () -> purchaseInvoiceService.getById(created.getId()));
        assertEquals(ErrorCode.NOT_FOUND, gone.getErrorCode());
        LedgerException expenseGone = assertThrows(LedgerException.class,
                () -> ledgerService.getById(created.getExpenseId()));
        assertEquals(ErrorCode.NOT_FOUND, expenseGone.getErrorCode());

        List<AuditEntry> trail = purchaseInvoiceService.getAuditTrail(created.getId());
        assertEquals(AuditAction.DELETE, trail.get(0).getActionType());
        assertNotNull(trail.get(0).getOldValues());
        printSuccess("Invoice removed with its effects");
    }
}
