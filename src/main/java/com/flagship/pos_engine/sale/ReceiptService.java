package com.flagship.pos_engine.sale;

import com.flagship.pos_engine.observability.LogContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of sales: receipts and transaction history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReceiptService {

    private final TransactionStore transactionStore;
    private final SaleUnitOfWork unitOfWork;

    public Optional<Receipt> getReceipt(UUID merchantId, UUID transactionId) {
        return unitOfWork.execute(() -> transactionStore.findById(merchantId, transactionId)
            .map(tx -> new Receipt(tx, transactionStore.findLineItems(merchantId, tx.getId()))));
    }

    public List<Transaction> listTransactions(UUID merchantId) {
        return transactionStore.findAllByMerchant(merchantId);
    }

    /**
     * Transactions created at or after from and strictly before to, newest first.
     */
    public List<Transaction> listTransactionsBetween(UUID merchantId, Instant from, Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both ends of the range are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after range end " + to);
        }
        return transactionStore.findByMerchantBetween(merchantId, from, to);
    }

    /**
     * Deletes a transaction and its line items. Sold stock is not returned to inventory.
     *
     * @return true if the transaction existed
     */
    public boolean deleteTransaction(UUID merchantId, UUID transactionId) {
        String previousMerchant = LogContext.put(LogContext.MERCHANT_ID_MDC_KEY, merchantId);
        String previousTransaction = LogContext.put(LogContext.TRANSACTION_ID_MDC_KEY, transactionId);
        try {
            boolean deleted = unitOfWork.execute(() -> transactionStore.delete(merchantId, transactionId));
            if (deleted) {
                log.info("Transaction deleted");
            } else {
                log.warn("Transaction not found for delete");
            }
            return deleted;
        } finally {
            LogContext.restore(LogContext.MERCHANT_ID_MDC_KEY, previousMerchant);
            LogContext.restore(LogContext.TRANSACTION_ID_MDC_KEY, previousTransaction);
        }
    }
}
