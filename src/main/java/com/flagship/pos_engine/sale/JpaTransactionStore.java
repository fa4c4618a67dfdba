package com.flagship.pos_engine.sale;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transaction storage backed by Spring Data JPA.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaTransactionStore implements TransactionStore {

    private final TransactionRepository transactionRepository;
    private final TransactionLineItemRepository lineItemRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Transaction> findById(UUID merchantId, UUID transactionId) {
        return transactionRepository.findByIdAndMerchantId(transactionId, merchantId)
            .map(TransactionEntity::toDomain);
    }

    @Override
    @Transactional
    public Optional<Transaction> findByIdForUpdate(UUID merchantId, UUID transactionId) {
        return transactionRepository.findByIdAndMerchantIdForUpdate(transactionId, merchantId)
            .map(TransactionEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transaction> findAllByMerchant(UUID merchantId) {
        return transactionRepository.findByMerchantIdOrderByCreatedAtDesc(merchantId)
            .stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transaction> findByMerchantBetween(UUID merchantId, Instant from, Instant to) {
        return transactionRepository.findByMerchantIdCreatedBetween(merchantId, from, to)
            .stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional
    public Transaction save(Transaction transaction) {
        TransactionEntity entity = transactionRepository.findById(transaction.getId())
            .map(existing -> {
                existing.updateFromDomain(transaction);
                return existing;
            })
            .orElseGet(() -> TransactionEntity.fromDomain(transaction));

        TransactionEntity saved = transactionRepository.save(entity);
        log.debug("Saved transaction {} total={} lines={}", saved.getId(), saved.getTotal(), saved.getLineItemCount());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public TransactionLineItem createLineItem(UUID merchantId, TransactionLineItem lineItem) {
        if (transactionRepository.findByIdAndMerchantId(lineItem.getTransactionId(), merchantId).isEmpty()) {
            throw new IllegalArgumentException(
                "Transaction " + lineItem.getTransactionId() + " not found for merchant " + merchantId);
        }
        if (lineItemRepository.existsById(lineItem.getId())) {
            throw new IllegalStateException("Line item " + lineItem.getId() + " already exists; line items are write-once");
        }
        TransactionLineItemEntity saved = lineItemRepository.save(TransactionLineItemEntity.fromDomain(lineItem));
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public List<TransactionLineItem> findLineItems(UUID merchantId, UUID transactionId) {
        if (transactionRepository.findByIdAndMerchantId(transactionId, merchantId).isEmpty()) {
            return List.of();
        }
        return lineItemRepository.findByTransactionIdOrderBySequenceNumberAsc(transactionId)
            .stream()
            .map(TransactionLineItemEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional
    public boolean delete(UUID merchantId, UUID transactionId) {
        Optional<TransactionEntity> entity = transactionRepository.findByIdAndMerchantIdForUpdate(transactionId, merchantId);
        if (entity.isEmpty()) {
            return false;
        }
        // Lines first; the foreign key cascade covers direct SQL deletes.
        int lines = lineItemRepository.deleteByTransactionId(transactionId);
        transactionRepository.delete(entity.get());
        log.debug("Deleted transaction {} with {} line items", transactionId, lines);
        return true;
    }
}
