package com.flagship.pos_engine.sale;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for a transaction line item.
 *
 * Write-once: every column is updatable = false and there is no update method.
 */
@Entity
@Table(
    name = "transaction_line_items",
    indexes = {
        @Index(name = "idx_line_items_transaction", columnList = "transaction_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionLineItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "product_name", nullable = false, updatable = false)
    private String productName;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static TransactionLineItemEntity fromDomain(TransactionLineItem lineItem) {
        return new TransactionLineItemEntity(
            lineItem.getId(),
            lineItem.getTransactionId(),
            lineItem.getProductName(),
            lineItem.getQuantity(),
            lineItem.getUnitPrice(),
            lineItem.getSubtotal(),
            lineItem.getCreatedAt(),
            null // sequenceNumber is set by database
        );
    }

    TransactionLineItem toDomain() {
        return new TransactionLineItem(id, transactionId, productName, quantity, unitPrice, subtotal, createdAt);
    }
}
