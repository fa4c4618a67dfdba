package com.flagship.pos_engine.inventory;

import com.flagship.pos_engine.pricing.StockPricing;
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
 * JPA Entity for stock item persistence.
 *
 * Key design principles:
 * - No @Setter: raw inputs and derived pricing only change together, through updateFromDomain()
 * - Identity and owner are updatable = false
 * - Derived pricing is stored for reporting but verified against the raw inputs on load
 */
@Entity
@Table(
    name = "stock_items",
    indexes = {
        @Index(name = "idx_stock_items_merchant", columnList = "merchant_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StockItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private UUID merchantId;

    @Column(nullable = false)
    private String name;

    @Column(name = "quantity_on_hand", nullable = false)
    private int quantityOnHand;

    @Column(name = "unit_size", nullable = false)
    private int unitSize;

    @Column(name = "purchase_unit_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal purchaseUnitPrice;

    @Column(name = "profit_margin_percent", nullable = false)
    private int profitMarginPercent;

    @Column(name = "purchase_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal purchaseTotal;

    @Column(name = "sale_unit_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal saleUnitPrice;

    @Column(name = "sale_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal saleTotal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

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

    static StockItemEntity fromDomain(StockItem item) {
        StockPricing pricing = item.getPricing();
        return new StockItemEntity(
            item.getId(),
            item.getMerchantId(),
            item.getName(),
            item.getQuantityOnHand(),
            item.getUnitSize(),
            item.getPurchaseUnitPrice(),
            item.getProfitMarginPercent(),
            pricing.getPurchaseTotal(),
            pricing.getSaleUnitPrice(),
            pricing.getSaleTotal(),
            item.getCreatedAt(),
            null // updatedAt - set by @PrePersist
        );
    }

    /**
     * Converts to the domain object, verifying the stored pricing.
     */
    StockItem toDomain() {
        return StockItem.restore(
            id,
            merchantId,
            name,
            quantityOnHand,
            unitSize,
            purchaseUnitPrice,
            profitMarginPercent,
            StockPricing.stored(purchaseTotal, saleUnitPrice, saleTotal),
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable fields. Identity, owner and createdAt never change.
     */
    void updateFromDomain(StockItem item) {
        if (!this.id.equals(item.getId()) || !this.merchantId.equals(item.getMerchantId())) {
            throw new IllegalArgumentException("Cannot update stock item " + this.id + " from " + item.getId());
        }
        StockPricing pricing = item.getPricing();
        this.name = item.getName();
        this.quantityOnHand = item.getQuantityOnHand();
        this.unitSize = item.getUnitSize();
        this.purchaseUnitPrice = item.getPurchaseUnitPrice();
        this.profitMarginPercent = item.getProfitMarginPercent();
        this.purchaseTotal = pricing.getPurchaseTotal();
        this.saleUnitPrice = pricing.getSaleUnitPrice();
        this.saleTotal = pricing.getSaleTotal();
        // updatedAt will be set automatically by @PreUpdate
    }
}
