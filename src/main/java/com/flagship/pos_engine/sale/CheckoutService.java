package com.flagship.pos_engine.sale;

import com.flagship.pos_engine.observability.LogContext;
import com.flagship.pos_engine.observability.SaleMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Multi-line checkout on top of {@link TransactionProcessor}.
 *
 * The default policy comes from pos.checkout.policy and can be overridden per call.
 * See {@link CheckoutPolicy} for what each policy keeps when a line fails.
 * A transaction returned by checkout is completed: further sells into it are
 * rejected with TRANSACTION_CLOSED.
 */
@Service
@Slf4j
public class CheckoutService {

    private final TransactionProcessor transactionProcessor;
    private final TransactionStore transactionStore;
    private final SaleUnitOfWork unitOfWork;
    private final SaleMetrics saleMetrics;
    private final CheckoutPolicy defaultPolicy;

    public CheckoutService(TransactionProcessor transactionProcessor,
                           TransactionStore transactionStore,
                           SaleUnitOfWork unitOfWork,
                           SaleMetrics saleMetrics,
                           @Value("${pos.checkout.policy:ALL_OR_NOTHING}") CheckoutPolicy defaultPolicy) {
        this.transactionProcessor = transactionProcessor;
        this.transactionStore = transactionStore;
        this.unitOfWork = unitOfWork;
        this.saleMetrics = saleMetrics;
        this.defaultPolicy = defaultPolicy;
    }

    /**
     * Opens an empty transaction: total 0.00, no line count yet.
     */
    public Transaction openTransaction(UUID merchantId) {
        Transaction transaction = Transaction.open(merchantId);
        Transaction saved = unitOfWork.execute(() -> transactionStore.save(transaction));
        log.debug("Opened transaction {} for merchant {}", saved.getId(), merchantId);
        return saved;
    }

    /**
     * Closes a transaction opened with {@link #openTransaction}. Idempotent.
     *
     * @throws TransactionNotFoundException if the transaction does not exist for this merchant
     */
    public Transaction completeTransaction(UUID merchantId, UUID transactionId) {
        Transaction completed = unitOfWork.execute(() -> completeLocked(merchantId, transactionId));
        log.info("Completed transaction {}: lines={}, total={}", transactionId,
                completed.getLineItemCount(), completed.getTotal());
        return completed;
    }

    public CheckoutResult checkout(UUID merchantId, List<SaleLine> lines) {
        return checkout(merchantId, lines, defaultPolicy);
    }

    /**
     * Opens a transaction and sells every line into it, in order.
     *
     * @param merchantId Merchant scope for the transaction and every stock item
     * @param lines Requested lines, at least one
     * @param policy What to keep when a line fails
     * @return Result with the committed transaction (null if nothing was committed)
     * @throws IllegalArgumentException if no lines are given
     */
    public CheckoutResult checkout(UUID merchantId, List<SaleLine> lines, CheckoutPolicy policy) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("Checkout requires at least one line");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Checkout policy is required");
        }

        String previousMerchant = LogContext.put(LogContext.MERCHANT_ID_MDC_KEY, merchantId);
        try {
            CheckoutResult result = policy == CheckoutPolicy.ALL_OR_NOTHING
                ? checkoutAllOrNothing(merchantId, lines)
                : checkoutPerLine(merchantId, lines);

            saleMetrics.recordCheckout(policy.name(), result.getStatus().name());
            log.info("Checkout finished: policy={}, status={}, lines={}, total={}",
                    policy, result.getStatus(), lines.size(),
                    result.getTransaction() != null ? result.getTransaction().getTotal() : null);
            return result;

        } catch (RuntimeException e) {
            saleMetrics.recordCheckout(policy.name(), "error");
            log.error("Checkout failed: policy={}, error={}", policy, e.getMessage());
            throw e;
        } finally {
            LogContext.restore(LogContext.MERCHANT_ID_MDC_KEY, previousMerchant);
        }
    }

    private CheckoutResult checkoutAllOrNothing(UUID merchantId, List<SaleLine> lines) {
        try {
            return unitOfWork.execute(() -> {
                Transaction transaction = transactionStore.save(Transaction.open(merchantId));
                List<SellOutcome> outcomes = new ArrayList<>();

                for (SaleLine line : lines) {
                    SellOutcome outcome = transactionProcessor.sell(
                        merchantId, transaction.getId(), line.getStockItemId(), line.getQuantity());
                    outcomes.add(outcome);
                    if (!outcome.isSuccess()) {
                        throw new CheckoutRollbackException(outcomes);
                    }
                }

                Transaction committed = completeLocked(merchantId, transaction.getId());
                return new CheckoutResult(CheckoutResult.Status.COMPLETED, CheckoutPolicy.ALL_OR_NOTHING,
                    committed, List.copyOf(outcomes));
            });
        } catch (CheckoutRollbackException e) {
            log.warn("Checkout rolled back at line {}: {}", e.getOutcomes().size() - 1,
                    e.getOutcomes().get(e.getOutcomes().size() - 1).getMessage());
            return new CheckoutResult(CheckoutResult.Status.REJECTED, CheckoutPolicy.ALL_OR_NOTHING,
                null, e.getOutcomes());
        }
    }

    private CheckoutResult checkoutPerLine(UUID merchantId, List<SaleLine> lines) {
        Transaction transaction = openTransaction(merchantId);
        List<SellOutcome> outcomes = new ArrayList<>();

        for (SaleLine line : lines) {
            outcomes.add(transactionProcessor.sell(
                merchantId, transaction.getId(), line.getStockItemId(), line.getQuantity()));
        }

        long succeeded = outcomes.stream().filter(SellOutcome::isSuccess).count();
        if (succeeded == 0) {
            unitOfWork.execute(() -> transactionStore.delete(merchantId, transaction.getId()));
            return new CheckoutResult(CheckoutResult.Status.REJECTED, CheckoutPolicy.PER_LINE,
                null, List.copyOf(outcomes));
        }

        CheckoutResult.Status status = succeeded == outcomes.size()
            ? CheckoutResult.Status.COMPLETED
            : CheckoutResult.Status.PARTIAL;
        Transaction completed = unitOfWork.execute(() -> completeLocked(merchantId, transaction.getId()));
        return new CheckoutResult(status, CheckoutPolicy.PER_LINE, completed, List.copyOf(outcomes));
    }

    private Transaction completeLocked(UUID merchantId, UUID transactionId) {
        Transaction transaction = transactionStore.findByIdForUpdate(merchantId, transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(merchantId, transactionId));
        if (transaction.isCompleted()) {
            return transaction;
        }
        return transactionStore.save(transaction.complete());
    }

    /**
     * Unwinds the checkout unit of work. Carries the outcomes seen so far.
     */
    private static final class CheckoutRollbackException extends RuntimeException {

        private final List<SellOutcome> outcomes;

        CheckoutRollbackException(List<SellOutcome> outcomes) {
            super("Checkout line failed", null, false, false);
            this.outcomes = List.copyOf(outcomes);
        }

        List<SellOutcome> getOutcomes() {
            return outcomes;
        }
    }
}
