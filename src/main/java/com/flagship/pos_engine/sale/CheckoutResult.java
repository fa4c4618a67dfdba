package com.flagship.pos_engine.sale;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a multi-line checkout.
 *
 * transaction is the committed transaction, or null when nothing was committed.
 * lineOutcomes holds one entry per line that was attempted, in request order;
 * under ALL_OR_NOTHING a rejected checkout lists the outcomes up to and
 * including the failing line, none of which were committed.
 */
@Value
public class CheckoutResult {

    public enum Status {
        /**
         * Every line succeeded.
         */
        COMPLETED,
        /**
         * PER_LINE only: some lines succeeded, some failed.
         */
        PARTIAL,
        /**
         * Nothing was committed.
         */
        REJECTED
    }

    Status status;
    CheckoutPolicy policy;
    Transaction transaction;
    List<SellOutcome> lineOutcomes;

    /**
     * Index of the first failed line, or -1 if every attempted line succeeded.
     */
    public int firstFailedLine() {
        for (int i = 0; i < lineOutcomes.size(); i++) {
            if (!lineOutcomes.get(i).isSuccess()) {
                return i;
            }
        }
        return -1;
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
