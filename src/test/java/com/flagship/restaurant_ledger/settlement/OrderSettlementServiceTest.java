package com.flagship.restaurant_ledger.settlement;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.ledger.FinancialMovement;
import com.flagship.restaurant_ledger.ledger.LedgerService;
import com.flagship.restaurant_ledger.ledger.MovementType;
import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import com.flagship.restaurant_ledger.settlement.dto.SettlementResult;
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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order settlement against a real PostgreSQL: revenue, cost of goods sold
 * and payment fee are booked once per order.
 */
@SpringBootTest
@Testcontainers
class OrderSettlementServiceTest {

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
    private OrderSettlementService settlementService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long cashierId;
    private Long orderId;

    /**
     * Order: 2 x burger (2 buns at 1.50 each, plus 1 extra cheese portion of
     * 50 g at 20.00/kg) and 1 x soda with a preset cost of 4.00.
     * CMV = 2 x (3.00 + 1.00) + 4.00 = 12.00.
     */
    @BeforeEach
    void setUp() {
        cashierId = jdbcTemplate.queryForObject(
                "INSERT INTO users (full_name, role) VALUES ('Cai Cashier', 'staff') RETURNING id", Long.class);
        jdbcTemplate.update("INSERT INTO app_settings (credit_card_fee_pct, debit_card_fee_pct, pix_fee_pct) "
                + "VALUES (3.50, 1.50, 0)");

        Long bun = jdbcTemplate.queryForObject("""
                INSERT INTO ingredients (name, price, stock_unit, base_portion_quantity, base_portion_unit)
                VALUES ('Bun', 1.50, 'un', 1, 'un') RETURNING id
                """, Long.class);
        Long cheese = jdbcTemplate.queryForObject("""
                INSERT INTO ingredients (name, price, stock_unit, base_portion_quantity, base_portion_unit)
                VALUES ('Cheese', 20.00, 'kg', 50, 'g') RETURNING id
                """, Long.class);

        Long burger = jdbcTemplate.queryForObject(
                "INSERT INTO products (name, cost_price) VALUES ('Burger', NULL) RETURNING id", Long.class);
        Long soda = jdbcTemplate.queryForObject(
                "INSERT INTO products (name, cost_price) VALUES ('Soda', 4.00) RETURNING id", Long.class);
        jdbcTemplate.update("INSERT INTO product_ingredients (product_id, ingredient_id, portions) VALUES (?, ?, 2)",
                burger, bun);

        orderId = jdbcTemplate.queryForObject(
                "INSERT INTO orders (total_amount, status) VALUES (50.00, 'delivered') RETURNING id", Long.class);
        Long burgerItem = jdbcTemplate.queryForObject(
                "INSERT INTO order_items (order_id, product_id, quantity) VALUES (?, ?, 2) RETURNING id",
                Long.class, orderId, burger);
        jdbcTemplate.update("INSERT INTO order_items (order_id, product_id, quantity) VALUES (?, ?, 1)",
                orderId, soda);
        jdbcTemplate.update("""
                INSERT INTO order_item_extras (order_item_id, ingredient_id, type, quantity, delta)
                VALUES (?, ?, 'extra', 1, 0)
                """, burgerItem, cheese);
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

    private long movementsForOrder(long id) {
        return jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM financial_movements WHERE related_entity_type = 'order' AND related_entity_id = ?",
                Long.class, id);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Settling an order books revenue, CMV and the card fee")
    void testSettleBooksAllMovements() {
        printTestHeader("Settle Order");
        printInput("Order", orderId);

        SettlementResult result = settlementService.registerOrderRevenueAndCmv(
                orderId, new BigDecimal("50.00"), "credit", "2026-10-16T20:30:00", cashierId);
        printOutput("Result", result);

        assertFalse(result.isAlreadySettled());
        assertAmount("12.00", result.getTotalCmv());
        assertAmount("1.75", result.getFeeAmount());

        FinancialMovement revenue = ledgerService.getById(result.getRevenueId());
        assertEquals(MovementType.REVENUE, revenue.getType());
        assertAmount("50.00", revenue.getValue());
        assertEquals(PaymentStatus.PAID, revenue.getPaymentStatus());
        assertEquals("Credit Card", revenue.getSubcategory());
        assertEquals("Sale - Order #" + orderId, revenue.getDescription());
        assertEquals(LocalDateTime.of(2026, 10, 16, 20, 30), revenue.getMovementDate());

        FinancialMovement cmv = ledgerService.getById(result.getCmvId());
        assertEquals(MovementType.CMV, cmv.getType());
        assertAmount("12.00", cmv.getValue());

        FinancialMovement fee = ledgerService.getById(result.getFeeId());
        assertEquals(MovementType.EXPENSE, fee.getType());
        assertAmount("1.75", fee.getValue());
        assertEquals("Fee credit - Order #" + orderId, fee.getDescription());

        assertEquals(3, movementsForOrder(orderId));
        printSuccess("Three movements booked");
    }

    @Test
    @DisplayName("Settling the same order twice books nothing the second time")
    void testSettleIsIdempotent() {
        printTestHeader("Idempotent Settlement");

        SettlementResult first = settlementService.registerOrderRevenueAndCmv(
                orderId, new BigDecimal("50.00"), "credit", null, cashierId);
        SettlementResult second = settlementService.registerOrderRevenueAndCmv(
                orderId, new BigDecimal("50.00"), "credit", null, cashierId);
        printOutput("First", first);
        printOutput("Second", second);

        assertTrue(second.isAlreadySettled());
        assertEquals(first.getRevenueId(), second.getRevenueId());
        assertEquals(first.getCmvId(), second.getCmvId());
        assertEquals(first.getFeeId(), second.getFeeId());
        assertEquals(3, movementsForOrder(orderId));
        printSuccess("Second settlement returned the existing movements");
    }

    @Test
    @DisplayName("A method without a configured fee books no fee expense")
    void testNoFeeForCash() {
        SettlementResult result = settlementService.registerOrderRevenueAndCmv(
                orderId, new BigDecimal("50.00"), "money", null, cashierId);

        assertNull(result.getFeeId());
        assertAmount("0", result.getFeeAmount());
        assertEquals("Cash", ledgerService.getById(result.getRevenueId()).getSubcategory());
        assertEquals(2, movementsForOrder(orderId));
    }

    @Test
    @DisplayName("Invalid totals, unknown orders and empty orders are rejected")
    void testRejections() {
        LedgerException zero = assertThrows(LedgerException.class, () -> settlementService
                .registerOrderRevenueAndCmv(orderId, BigDecimal.ZERO, "credit", null, cashierId));
        assertEquals(ErrorCode.INVALID_VALUE, zero.getErrorCode());

        LedgerException unknown = assertThrows(LedgerException.class, () -> settlementService
                .registerOrderRevenueAndCmv(987654L, new BigDecimal("10.00"), "credit", null, cashierId));
        assertEquals(ErrorCode.NOT_FOUND, unknown.getErrorCode());

        Long emptyOrder = jdbcTemplate.queryForObject(
                "INSERT INTO orders (total_amount) VALUES (10.00) RETURNING id", Long.class);
        LedgerException empty = assertThrows(LedgerException.class, () -> settlementService
                .registerOrderRevenueAndCmv(emptyOrder, new BigDecimal("10.00"), "credit", null, cashierId));
        assertEquals(ErrorCode.NOT_FOUND, empty.getErrorCode());
        assertEquals(0, movementsForOrder(emptyOrder));
    }
}
