package com.flagship.pos_engine.inventory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage boundary for stock items.
 *
 * Every lookup is scoped by merchant: an item owned by another merchant
 * is reported as absent.
 */
public interface StockItemStore {

    Optional<StockItem> findById(UUID merchantId, UUID stockItemId);

    /**
     * Finds an item and locks it until the surrounding unit of work ends.
     * Concurrent callers asking for the same item wait for the lock.
     */
    Optional<StockItem> findByIdForUpdate(UUID merchantId, UUID stockItemId);

    List<StockItem> findAllByMerchant(UUID merchantId);

    /**
     * Inserts or updates the item, including its derived pricing.
     */
    StockItem save(StockItem stockItem);

    /**
     * @return true if an item was deleted
     */
    boolean delete(UUID merchantId, UUID stockItemId);
}
