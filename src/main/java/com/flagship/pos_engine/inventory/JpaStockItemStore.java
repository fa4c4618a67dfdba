package com.flagship.pos_engine.inventory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stock item storage backed by Spring Data JPA.
 *
 * Bridges the domain layer (StockItem) and persistence layer (StockItemEntity).
 * findByIdForUpdate must run inside a transaction; the others join one if present.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaStockItemStore implements StockItemStore {

    private final StockItemRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<StockItem> findById(UUID merchantId, UUID stockItemId) {
        return repository.findByIdAndMerchantId(stockItemId, merchantId)
            .map(StockItemEntity::toDomain);
    }

    @Override
    @Transactional
    public Optional<StockItem> findByIdForUpdate(UUID merchantId, UUID stockItemId) {
        return repository.findByIdAndMerchantIdForUpdate(stockItemId, merchantId)
            .map(StockItemEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StockItem> findAllByMerchant(UUID merchantId) {
        return repository.findByMerchantIdOrderByNameAscCreatedAtAsc(merchantId)
            .stream()
            .map(StockItemEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional
    public StockItem save(StockItem stockItem) {
        if (stockItem.getQuantityOnHand() <= 0) {
            throw new IllegalStateException(
                "Stock item " + stockItem.getId() + " cannot be stored with quantity " + stockItem.getQuantityOnHand());
        }
        StockItemEntity entity = repository.findById(stockItem.getId())
            .map(existing -> {
                existing.updateFromDomain(stockItem);
                return existing;
            })
            .orElseGet(() -> StockItemEntity.fromDomain(stockItem));

        StockItemEntity saved = repository.save(entity);
        log.debug("Saved stock item {} with quantity {}", saved.getId(), saved.getQuantityOnHand());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public boolean delete(UUID merchantId, UUID stockItemId) {
        return repository.findByIdAndMerchantId(stockItemId, merchantId)
            .map(entity -> {
                repository.delete(entity);
                log.debug("Deleted stock item {}", stockItemId);
                return true;
            })
            .orElse(false);
    }
}
