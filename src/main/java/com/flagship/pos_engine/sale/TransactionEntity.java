package com.flagship.pos_engine.sale;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for the transaction header.
 *
 * Line items live in their own table and are removed by the
 * ON DELETE CASCADE foreign key when the header is deleted.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_merchant_created", columnList = "merchant_id, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private UUID merchantId;

    @Column(name = "line_item_count")
    private Integer lineItemCount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal total;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static TransactionEntity fromDomain(Transaction transaction) {
        return new TransactionEntity(
            transaction.getId(),
            transaction.getMerchantId(),
            transaction.getLineItemCount(),
            transaction.getTotal(),
            transaction.getCreatedAt(),
            null, // updatedAt - set by @PrePersist
            transaction.getCompletedAt()
        );
    }

    Transaction toDomain() {
        return Transaction.restore(id, merchantId, lineItemCount, total, createdAt, updatedAt, completedAt);
    }

    /**
     * Only the running totals and the completion time are mutable.
     */
    void updateFromDomain(Transaction transaction) {
        if (!this.id.equals(transaction.getId()) || !this.merchantId.equals(transaction.getMerchantId())) {
            throw new IllegalArgumentException(
                "Cannot update transaction " + this.id + " from " + transaction.getId()
                    + " of merchant " + transaction.getMerchantId());
        }
        this.completedAt = transaction.getCompletedAt();
        this.lineItemCount = transaction.getLineItemCount();
        this.total = transaction.getTotal();
    }
}
