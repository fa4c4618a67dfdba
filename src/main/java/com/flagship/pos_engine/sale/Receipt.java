package com.flagship.pos_engine.sale;

import com.flagship.pos_engine.pricing.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A transaction together with its line items, in the order they were sold.
 */
@Value
public class Receipt {
    Transaction transaction;
    List<TransactionLineItem> lineItems;

    /**
     * Sum of the line subtotals. Equals the transaction total for any committed transaction.
     */
    public BigDecimal linesTotal() {
        BigDecimal sum = Money.ZERO;
        for (TransactionLineItem line : lineItems) {
            sum = Money.add(sum, line.getSubtotal());
        }
        return sum;
    }
}
