package com.flagship.pos_engine.sale;

import com.flagship.pos_engine.inventory.NewStockItem;
import com.flagship.pos_engine.inventory.StockItem;
import com.flagship.pos_engine.observability.SaleMetrics;
import com.flagship.pos_engine.support.InMemorySaleUnitOfWork;
import com.flagship.pos_engine.support.InMemoryStockItemStore;
import com.flagship.pos_engine.support.InMemoryTransactionStore;
import com.flagship.pos_engine.support.StockFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CheckoutServiceTest {

    private InMemoryStockItemStore stockItemStore;
    private InMemoryTransactionStore transactionStore;
    private SimpleMeterRegistry meterRegistry;
    private TransactionProcessor processor;
    private CheckoutService checkoutService;

    private final UUID merchantId = UUID.randomUUID();

    private StockItem noodles;
    private StockItem coffee;

    @BeforeEach
    void setUp() {
        stockItemStore = new InMemoryStockItemStore();
        transactionStore = new InMemoryTransactionStore();
        InMemorySaleUnitOfWork unitOfWork = new InMemorySaleUnitOfWork(stockItemStore, transactionStore);
        meterRegistry = new SimpleMeterRegistry();
        SaleMetrics metrics = new SaleMetrics(meterRegistry);
        processor = new TransactionProcessor(stockItemStore, transactionStore, unitOfWork, metrics);
        checkoutService = new CheckoutService(processor, transactionStore, unitOfWork, metrics,
            CheckoutPolicy.ALL_OR_NOTHING);

        noodles = stock(StockFixtures.noodles(100));
        coffee = stock(StockFixtures.coffee(5));
    }

    private StockItem stock(NewStockItem input) {
        return stockItemStore.save(StockItem.register(merchantId, input));
    }

    private int quantityOf(StockItem item) {
        return stockItemStore.findById(merchantId, item.getId()).orElseThrow().getQuantityOnHand();
    }

    @Test
    @DisplayName("openTransaction creates an empty transaction")
    void openTransaction() {
        Transaction transaction = checkoutService.openTransaction(merchantId);

        assertEquals(new BigDecimal("0.00"), transaction.getTotal());
        assertNull(transaction.getLineItemCount());
        assertFalse(transaction.hasLines());
        assertTrue(transactionStore.findById(merchantId, transaction.getId()).isPresent());
    }

    @Test
    @DisplayName("completeTransaction closes a transaction opened by the caller")
    void completeTransaction() {
        Transaction transaction = checkoutService.openTransaction(merchantId);
        processor.sell(merchantId, transaction.getId(), noodles.getId(), 2);

        Transaction completed = checkoutService.completeTransaction(merchantId, transaction.getId());

        assertTrue(completed.isCompleted());
        assertEquals(new BigDecimal("7200.00"), completed.getTotal());
        assertEquals(completed, checkoutService.completeTransaction(merchantId, transaction.getId()));
        assertEquals(SellStatus.TRANSACTION_CLOSED,
            processor.sell(merchantId, transaction.getId(), noodles.getId(), 1).getStatus());
        assertEquals(98, quantityOf(noodles));
    }

    @Test
    @DisplayName("completeTransaction of an unknown or foreign transaction fails")
    void completeUnknownTransaction() {
        Transaction transaction = checkoutService.openTransaction(merchantId);

        assertThrows(TransactionNotFoundException.class,
            () -> checkoutService.completeTransaction(merchantId, UUID.randomUUID()));
        assertThrows(TransactionNotFoundException.class,
            () -> checkoutService.completeTransaction(UUID.randomUUID(), transaction.getId()));
        assertFalse(transactionStore.findById(merchantId, transaction.getId()).orElseThrow().isCompleted());
    }

    @Test
    @DisplayName("Checkout without lines is a usage error")
    void emptyCheckout() {
        assertThrows(IllegalArgumentException.class, () -> checkoutService.checkout(merchantId, List.of()));
        assertEquals(0, transactionStore.transactionCount());
    }

    @Nested
    @DisplayName("ALL_OR_NOTHING")
    class AllOrNothing {

        @Test
        @DisplayName("All lines succeed: one transaction with the summed total")
        void completes() {
            CheckoutResult result = checkoutService.checkout(merchantId, List.of(
                SaleLine.of(noodles.getId(), 10),
                SaleLine.of(coffee.getId(), 2)));

            assertTrue(result.isCompleted());
            assertEquals(CheckoutPolicy.ALL_OR_NOTHING, result.getPolicy());
            // 10 * 3600.00 + 2 * 13750.00
            assertEquals(new BigDecimal("63500.00"), result.getTransaction().getTotal());
            assertEquals(2, result.getTransaction().getLineItemCount());
            assertEquals(-1, result.firstFailedLine());
            assertEquals(90, quantityOf(noodles));
            assertEquals(3, quantityOf(coffee));
        }

        @Test
        @DisplayName("A completed checkout's transaction rejects further sales")
        void completedTransactionIsClosed() {
            CheckoutResult result = checkoutService.checkout(merchantId, List.of(SaleLine.of(noodles.getId(), 1)));

            assertTrue(result.getTransaction().isCompleted());

            SellOutcome late = processor.sell(merchantId, result.getTransaction().getId(), noodles.getId(), 5);

            assertEquals(SellStatus.TRANSACTION_CLOSED, late.getStatus());
            assertEquals(99, quantityOf(noodles));
            Transaction stored = transactionStore.findById(merchantId, result.getTransaction().getId()).orElseThrow();
            assertEquals(new BigDecimal("3600.00"), stored.getTotal());
            assertEquals(1, stored.getLineItemCount());
        }

        @Test
        @DisplayName("Sales and depletions of a rolled back checkout are not counted")
        void rolledBackSalesNotCounted() {
            StockItem tea = stock(NewStockItem.builder()
                .name("Teh").quantityOnHand(1).purchaseUnitPrice(new BigDecimal("2000")).profitMarginPercent(5).build());

            CheckoutResult result = checkoutService.checkout(merchantId, List.of(
                SaleLine.of(tea.getId(), 1),
                SaleLine.of(noodles.getId(), 1000)));

            assertEquals(CheckoutResult.Status.REJECTED, result.getStatus());
            assertEquals(1, quantityOf(tea));
            assertEquals(0.0, meterRegistry.get("pos.stock.depleted").counter().count());
            assertNull(meterRegistry.find("pos.sell").tag("status", "SUCCESS").counter());
            assertEquals(1.0, meterRegistry.get("pos.sell").tag("status", "INSUFFICIENT_STOCK").counter().count());

            checkoutService.checkout(merchantId, List.of(
                SaleLine.of(tea.getId(), 1),
                SaleLine.of(noodles.getId(), 1)));

            assertEquals(1.0, meterRegistry.get("pos.stock.depleted").counter().count());
            assertEquals(2.0, meterRegistry.get("pos.sell").tag("status", "SUCCESS").counter().count());
        }

        @Test
        @DisplayName("A failing third line rolls back the first two and the transaction")
        void rollsBack() {
            StockItem tea = stock(NewStockItem.builder()
                .name("Teh").quantityOnHand(1).purchaseUnitPrice(new BigDecimal("2000")).profitMarginPercent(5).build());

            CheckoutResult result = checkoutService.checkout(merchantId, List.of(
                SaleLine.of(noodles.getId(), 10),
                SaleLine.of(tea.getId(), 1),
                SaleLine.of(coffee.getId(), 6)));

            assertEquals(CheckoutResult.Status.REJECTED, result.getStatus());
            assertNull(result.getTransaction());
            assertEquals(3, result.getLineOutcomes().size());
            assertEquals(2, result.firstFailedLine());
            assertEquals(SellStatus.INSUFFICIENT_STOCK, result.getLineOutcomes().get(2).getStatus());

            assertEquals(100, quantityOf(noodles));
            assertEquals(1, quantityOf(tea), "depleted item is restored by the rollback");
            assertEquals(5, quantityOf(coffee));
            assertEquals(0, transactionStore.transactionCount());
            assertEquals(0, transactionStore.lineItemCount());
        }

        @Test
        @DisplayName("An invalid quantity rejects the checkout before later lines run")
        void invalidQuantity() {
            CheckoutResult result = checkoutService.checkout(merchantId, List.of(
                SaleLine.of(noodles.getId(), 0),
                SaleLine.of(coffee.getId(), 1)));

            assertEquals(CheckoutResult.Status.REJECTED, result.getStatus());
            assertEquals(1, result.getLineOutcomes().size());
            assertEquals(SellStatus.INVALID_QUANTITY, result.getLineOutcomes().get(0).getStatus());
            assertEquals(5, quantityOf(coffee));
            assertEquals(0, transactionStore.transactionCount());
        }

        @Test
        @DisplayName("Records the checkout metric by policy and result")
        void metrics() {
            checkoutService.checkout(merchantId, List.of(SaleLine.of(noodles.getId(), 1)));
            checkoutService.checkout(merchantId, List.of(SaleLine.of(coffee.getId(), 50)));

            assertEquals(1.0, meterRegistry.get("pos.checkout")
                .tag("policy", "ALL_OR_NOTHING").tag("result", "COMPLETED").counter().count());
            assertEquals(1.0, meterRegistry.get("pos.checkout")
                .tag("policy", "ALL_OR_NOTHING").tag("result", "REJECTED").counter().count());
        }
    }

    @Nested
    @DisplayName("PER_LINE")
    class PerLine {

        @Test
        @DisplayName("Earlier lines stay committed when a later line fails")
        void partial() {
            CheckoutResult result = checkoutService.checkout(merchantId, List.of(
                SaleLine.of(noodles.getId(), 10),
                SaleLine.of(coffee.getId(), 6),
                SaleLine.of(coffee.getId(), 5)), CheckoutPolicy.PER_LINE);

            assertEquals(CheckoutResult.Status.PARTIAL, result.getStatus());
            assertTrue(result.getTransaction().isCompleted());
            assertEquals(1, result.firstFailedLine());
            assertEquals(3, result.getLineOutcomes().size());
            assertTrue(result.getLineOutcomes().get(2).isSuccess());

            // 10 * 3600.00 + 5 * 13750.00
            assertEquals(new BigDecimal("104750.00"), result.getTransaction().getTotal());
            assertEquals(2, result.getTransaction().getLineItemCount());
            assertEquals(90, quantityOf(noodles));
            assertTrue(stockItemStore.findById(merchantId, coffee.getId()).isEmpty());
        }

        @Test
        @DisplayName("All lines succeed: COMPLETED")
        void completes() {
            CheckoutResult result = checkoutService.checkout(merchantId, List.of(
                SaleLine.of(noodles.getId(), 1)), CheckoutPolicy.PER_LINE);

            assertTrue(result.isCompleted());
            assertEquals(new BigDecimal("3600.00"), result.getTransaction().getTotal());
        }

        @Test
        @DisplayName("No line succeeds: the empty transaction is removed")
        void nothingSold() {
            CheckoutResult result = checkoutService.checkout(merchantId, List.of(
                SaleLine.of(UUID.randomUUID(), 1),
                SaleLine.of(coffee.getId(), -1)), CheckoutPolicy.PER_LINE);

            assertEquals(CheckoutResult.Status.REJECTED, result.getStatus());
            assertNull(result.getTransaction());
            assertEquals(SellStatus.ITEM_NOT_FOUND, result.getLineOutcomes().get(0).getStatus());
            assertEquals(SellStatus.INVALID_QUANTITY, result.getLineOutcomes().get(1).getStatus());
            assertEquals(0, transactionStore.transactionCount());
        }
    }
}
