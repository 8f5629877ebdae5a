package com.flagship.quota_ledger.purchase;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for credited top-up purchases, keyed by transaction id.
 */
@Repository
public interface PurchaseEntryRepository extends JpaRepository<PurchaseEntryEntity, String> {

    /**
     * Audit path: a user's purchases, newest first.
     */
    List<PurchaseEntryEntity> findByUserKeyOrderByPurchasedAtDesc(String userKey);
}
