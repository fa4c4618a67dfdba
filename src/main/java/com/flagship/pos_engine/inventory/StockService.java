package com.flagship.pos_engine.inventory;

import com.flagship.pos_engine.observability.LogContext;
import com.flagship.pos_engine.observability.SaleMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Merchant-facing stock management: register, restock and reprice.
 *
 * Every change recomputes the derived pricing through {@link StockItem}.
 * Sales never go through this service; see TransactionProcessor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockService {

    private final StockItemStore stockItemStore;
    private final SaleMetrics saleMetrics;

    /**
     * Registers a new stock item from raw purchase data.
     *
     * @throws IllegalArgumentException if any raw input is out of range
     */
    @Transactional
    public StockItem registerStock(UUID merchantId, NewStockItem input) {
        validateNew(merchantId, input);

        StockItem item = StockItem.register(merchantId, input);
        String previousMerchant = LogContext.put(LogContext.MERCHANT_ID_MDC_KEY, merchantId);
        String previousStockItem = LogContext.put(LogContext.STOCK_ITEM_ID_MDC_KEY, item.getId());
        try {
            StockItem saved = stockItemStore.save(item);
            saleMetrics.incrementStockRegistered();
            log.info("Registered stock item {}: quantity={}, saleUnitPrice={}",
                    saved.getName(), saved.getQuantityOnHand(), saved.getSaleUnitPrice());
            return saved;
        } finally {
            LogContext.restore(LogContext.MERCHANT_ID_MDC_KEY, previousMerchant);
            LogContext.restore(LogContext.STOCK_ITEM_ID_MDC_KEY, previousStockItem);
        }
    }

    /**
     * Adds units to an existing item under a row lock.
     *
     * @throws StockItemNotFoundException if the item does not exist for this merchant
     */
    @Transactional
    public StockItem restock(UUID merchantId, UUID stockItemId, int additionalQuantity) {
        if (additionalQuantity <= 0) {
            throw new IllegalArgumentException("Restock quantity must be positive, got " + additionalQuantity);
        }

        String previousMerchant = LogContext.put(LogContext.MERCHANT_ID_MDC_KEY, merchantId);
        String previousStockItem = LogContext.put(LogContext.STOCK_ITEM_ID_MDC_KEY, stockItemId);
        try {
            StockItem item = stockItemStore.findByIdForUpdate(merchantId, stockItemId)
                .orElseThrow(() -> new StockItemNotFoundException(merchantId, stockItemId));

            StockItem saved = stockItemStore.save(item.restock(additionalQuantity));
            saleMetrics.incrementStockRestocked();
            log.info("Restocked {}: {} -> {}", saved.getName(), item.getQuantityOnHand(), saved.getQuantityOnHand());
            return saved;
        } finally {
            LogContext.restore(LogContext.MERCHANT_ID_MDC_KEY, previousMerchant);
            LogContext.restore(LogContext.STOCK_ITEM_ID_MDC_KEY, previousStockItem);
        }
    }

    /**
     * Changes purchase price and margin under a row lock.
     *
     * @throws StockItemNotFoundException if the item does not exist for this merchant
     */
    @Transactional
    public StockItem reprice(UUID merchantId, UUID stockItemId, BigDecimal purchaseUnitPrice, int profitMarginPercent) {
        validatePrice(purchaseUnitPrice, profitMarginPercent);

        String previousMerchant = LogContext.put(LogContext.MERCHANT_ID_MDC_KEY, merchantId);
        String previousStockItem = LogContext.put(LogContext.STOCK_ITEM_ID_MDC_KEY, stockItemId);
        try {
            StockItem item = stockItemStore.findByIdForUpdate(merchantId, stockItemId)
                .orElseThrow(() -> new StockItemNotFoundException(merchantId, stockItemId));

            StockItem saved = stockItemStore.save(item.reprice(purchaseUnitPrice, profitMarginPercent));
            log.info("Repriced {}: saleUnitPrice {} -> {}", saved.getName(),
                    item.getSaleUnitPrice(), saved.getSaleUnitPrice());
            return saved;
        } finally {
            LogContext.restore(LogContext.MERCHANT_ID_MDC_KEY, previousMerchant);
            LogContext.restore(LogContext.STOCK_ITEM_ID_MDC_KEY, previousStockItem);
        }
    }

    @Transactional(readOnly = true)
    public List<StockItem> listStock(UUID merchantId) {
        return stockItemStore.findAllByMerchant(merchantId);
    }

    @Transactional(readOnly = true)
    public Optional<StockItem> getStockItem(UUID merchantId, UUID stockItemId) {
        return stockItemStore.findById(merchantId, stockItemId);
    }

    private void validateNew(UUID merchantId, NewStockItem input) {
        if (merchantId == null) {
            throw new IllegalArgumentException("Merchant ID is required");
        }
        if (input == null) {
            throw new IllegalArgumentException("Stock item data is required");
        }
        if (input.getName() == null || input.getName().isBlank()) {
            throw new IllegalArgumentException("Stock item name is required");
        }
        if (input.getQuantityOnHand() < 1) {
            throw new IllegalArgumentException("Quantity on hand must be at least 1, got " + input.getQuantityOnHand());
        }
        if (input.getUnitSize() < 1) {
            throw new IllegalArgumentException("Unit size must be at least 1, got " + input.getUnitSize());
        }
        validatePrice(input.getPurchaseUnitPrice(), input.getProfitMarginPercent());
    }

    private void validatePrice(BigDecimal purchaseUnitPrice, int profitMarginPercent) {
        if (purchaseUnitPrice == null) {
            throw new IllegalArgumentException("Purchase unit price is required");
        }
        if (purchaseUnitPrice.signum() < 0) {
            throw new IllegalArgumentException("Purchase unit price cannot be negative: " + purchaseUnitPrice);
        }
        if (profitMarginPercent < 0) {
            throw new IllegalArgumentException("Profit margin cannot be negative: " + profitMarginPercent);
        }
    }
}
