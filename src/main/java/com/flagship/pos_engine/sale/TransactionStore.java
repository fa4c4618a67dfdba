package com.flagship.pos_engine.sale;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage boundary for transactions and their line items.
 *
 * Every call is scoped by merchant: a transaction owned by another merchant,
 * and its line items, are reported as absent.
 */
public interface TransactionStore {

    Optional<Transaction> findById(UUID merchantId, UUID transactionId);

    /**
     * Finds a transaction and locks its row until the surrounding unit of work ends.
     */
    Optional<Transaction> findByIdForUpdate(UUID merchantId, UUID transactionId);

    /**
     * Newest first.
     */
    List<Transaction> findAllByMerchant(UUID merchantId);

    /**
     * Transactions created in [from, to), newest first.
     */
    List<Transaction> findByMerchantBetween(UUID merchantId, Instant from, Instant to);

    Transaction save(Transaction transaction);

    /**
     * Appends a line to a transaction of this merchant.
     *
     * @throws IllegalArgumentException if the transaction does not belong to the merchant
     */
    TransactionLineItem createLineItem(UUID merchantId, TransactionLineItem lineItem);

    /**
     * Lines in the order they were created; empty for another merchant's transaction.
     */
    List<TransactionLineItem> findLineItems(UUID merchantId, UUID transactionId);

    /**
     * Deletes the transaction together with all of its line items.
     *
     * @return true if a transaction was deleted
     */
    boolean delete(UUID merchantId, UUID transactionId);
}
