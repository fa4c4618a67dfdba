package com.flagship.pos_engine.sale;

import java.util.UUID;

public class TransactionNotFoundException extends IllegalArgumentException {

    public TransactionNotFoundException(UUID merchantId, UUID transactionId) {
        super("Transaction not found: " + transactionId + " (merchant " + merchantId + ")");
    }
}
