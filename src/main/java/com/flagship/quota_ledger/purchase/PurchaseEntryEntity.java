package com.flagship.quota_ledger.purchase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for the {@code topup_purchases} table.
 *
 * The transaction id is assigned by the purchase platform, so the entity
 * reports itself as new until it has been persisted or loaded. Saving
 * therefore always issues an INSERT and a second credit of the same id
 * fails on the primary key instead of being merged over the first.
 */
@Entity
@Table(name = "topup_purchases")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PurchaseEntryEntity implements Persistable<String> {

    @Id
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private String transactionId;

    @Column(name = "user_key", nullable = false, updatable = false)
    private String userKey;

    @Column(name = "seconds_credited", nullable = false, updatable = false)
    private long secondsCredited;

    @Column(name = "product_id", length = 100, updatable = false)
    private String productId;

    @Column(name = "price_paid", precision = 10, scale = 2, updatable = false)
    private BigDecimal pricePaid;

    @Column(name = "currency", length = 3, updatable = false)
    private String currency;

    @Column(name = "purchased_at", nullable = false, updatable = false)
    private Instant purchasedAt;

    @Transient
    private boolean fresh = true;

    static PurchaseEntryEntity fromDomain(PurchaseEntry entry) {
        PurchaseEntryEntity entity = new PurchaseEntryEntity();
        entity.transactionId = entry.getTransactionId();
        entity.userKey = entry.getUserKey();
        entity.secondsCredited = entry.getSecondsCredited();
        entity.productId = entry.getProductId();
        entity.pricePaid = entry.getPricePaid();
        entity.currency = entry.getCurrency();
        entity.purchasedAt = entry.getCreditedAt();
        return entity;
    }

    public PurchaseEntry toDomain() {
        return new PurchaseEntry(transactionId, userKey, secondsCredited, productId,
            pricePaid, currency, purchasedAt);
    }

    @Override
    public String getId() {
        return transactionId;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }
}
