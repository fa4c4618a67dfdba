package com.flagship.pos_engine.sale;

import com.flagship.pos_engine.inventory.StockItem;
import com.flagship.pos_engine.inventory.StockItemStore;
import com.flagship.pos_engine.observability.LogContext;
import com.flagship.pos_engine.observability.SaleMetrics;
import com.flagship.pos_engine.pricing.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Converts a requested quantity of a stock item into a transaction line item.
 *
 * One sell call is one atomic unit:
 * 1. Validate the quantity (before touching storage)
 * 2. Lock the transaction row, then the stock item row; a completed transaction is closed
 * 3. Check availability; on shortage return INSUFFICIENT_STOCK with nothing written
 * 4. Capture the sale unit price, then decrement and recompute, or delete on depletion
 * 5. Append the line item and update the transaction totals
 *
 * Lock order is always transaction, then stock item. Two sells of the same item
 * serialize on the item row, so the availability check never sees a stale quantity.
 *
 * Business failures are returned as {@link SellOutcome}; storage failures and
 * inconsistent stored pricing are thrown. Successful sales and depletions are
 * counted only once the enclosing unit of work commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionProcessor {

    private final StockItemStore stockItemStore;
    private final TransactionStore transactionStore;
    private final SaleUnitOfWork unitOfWork;
    private final SaleMetrics saleMetrics;

    /**
     * Sells a quantity of one stock item into an open transaction.
     *
     * @param merchantId Merchant scope; the transaction and the item must both belong to it
     * @param transactionId Transaction receiving the line item
     * @param stockItemId Stock item to sell from
     * @param requestedQuantity Units to sell, must be positive
     * @return Outcome of the sale; only SUCCESS has written anything
     */
    public SellOutcome sell(UUID merchantId, UUID transactionId, UUID stockItemId, int requestedQuantity) {
        long startTime = System.currentTimeMillis();
        String previousMerchant = LogContext.put(LogContext.MERCHANT_ID_MDC_KEY, merchantId);
        String previousTransaction = LogContext.put(LogContext.TRANSACTION_ID_MDC_KEY, transactionId);
        String previousStockItem = LogContext.put(LogContext.STOCK_ITEM_ID_MDC_KEY, stockItemId);

        try {
            SellOutcome outcome;
            if (requestedQuantity <= 0) {
                outcome = SellOutcome.invalidQuantity(requestedQuantity);
            } else {
                outcome = sellInUnitOfWork(merchantId, transactionId, stockItemId, requestedQuantity);
            }

            long duration = System.currentTimeMillis() - startTime;
            saleMetrics.recordSellLatency(duration);

            if (outcome.isSuccess()) {
                // SUCCESS is counted on commit, see sellLocked
                log.info("Sold {} units for {}, duration={}ms", requestedQuantity,
                        outcome.getLineItem().getSubtotal(), duration);
            } else {
                saleMetrics.recordSell(outcome.getStatus().name());
                log.warn("Sale rejected: status={}, message={}", outcome.getStatus(), outcome.getMessage());
            }
            return outcome;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            saleMetrics.recordSell("error");
            saleMetrics.recordSellLatency(duration);
            log.error("Sale failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            LogContext.restore(LogContext.MERCHANT_ID_MDC_KEY, previousMerchant);
            LogContext.restore(LogContext.TRANSACTION_ID_MDC_KEY, previousTransaction);
            LogContext.restore(LogContext.STOCK_ITEM_ID_MDC_KEY, previousStockItem);
        }
    }

    private SellOutcome sellInUnitOfWork(UUID merchantId, UUID transactionId, UUID stockItemId, int requestedQuantity) {
        try {
            return unitOfWork.execute(() -> sellLocked(merchantId, transactionId, stockItemId, requestedQuantity));
        } catch (ConcurrencyFailureException e) {
            log.warn("Lock not acquired for stock item: {}", e.getMessage());
            return SellOutcome.concurrencyConflict(stockItemId);
        }
    }

    private SellOutcome sellLocked(UUID merchantId, UUID transactionId, UUID stockItemId, int requestedQuantity) {
        Optional<Transaction> transaction = transactionStore.findByIdForUpdate(merchantId, transactionId);
        if (transaction.isEmpty()) {
            return SellOutcome.transactionNotFound(transactionId);
        }
        if (transaction.get().isCompleted()) {
            return SellOutcome.transactionClosed(transactionId);
        }

        Optional<StockItem> found = stockItemStore.findByIdForUpdate(merchantId, stockItemId);
        if (found.isEmpty()) {
            return SellOutcome.itemNotFound(stockItemId);
        }

        StockItem item = found.get();
        int available = item.getQuantityOnHand();
        if (requestedQuantity > available) {
            return SellOutcome.insufficientStock(item.getName(), requestedQuantity, available);
        }

        // Price is captured before the item changes or disappears
        BigDecimal unitPrice = item.getSaleUnitPrice();
        BigDecimal subtotal = Money.multiply(unitPrice, requestedQuantity);
        int remaining = available - requestedQuantity;

        if (remaining == 0) {
            stockItemStore.delete(merchantId, stockItemId);
            unitOfWork.afterCommit(saleMetrics::incrementStockDepleted);
            log.info("Stock item {} depleted and removed", item.getName());
        } else {
            stockItemStore.save(item.withQuantityOnHand(remaining));
            log.debug("Stock item {} quantity {} -> {}", item.getName(), available, remaining);
        }

        TransactionLineItem lineItem = transactionStore.createLineItem(merchantId,
            TransactionLineItem.create(transactionId, item.getName(), requestedQuantity, unitPrice, subtotal));
        transactionStore.save(transaction.get().addLine(subtotal));
        unitOfWork.afterCommit(() -> saleMetrics.recordSell(SellStatus.SUCCESS.name()));

        return SellOutcome.success(lineItem);
    }
}
