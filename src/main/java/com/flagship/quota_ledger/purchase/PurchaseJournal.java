package com.flagship.quota_ledger.purchase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Append-once log of credited purchases.
 *
 * The primary key on transaction_id is the idempotency primitive. A lookup
 * here is only a shortcut, {@link #record} is what actually claims an id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseJournal {

    private final PurchaseEntryRepository repository;

    /**
     * Claims the transaction id by inserting its entry.
     * Joins the caller's transaction so the claim commits or rolls back
     * together with the balance change it pays for.
     *
     * @throws DataIntegrityViolationException if the id was already claimed
     */
    @Transactional
    public void record(PurchaseEntry entry) {
        repository.saveAndFlush(PurchaseEntryEntity.fromDomain(entry));
        log.debug("Recorded purchase {} for user {}", entry.getTransactionId(), entry.getUserKey());
    }

    @Transactional(readOnly = true)
    public Optional<PurchaseEntry> find(String transactionId) {
        return repository.findById(transactionId)
            .map(PurchaseEntryEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean contains(String transactionId) {
        return repository.existsById(transactionId);
    }

    @Transactional(readOnly = true)
    public List<PurchaseEntry> historyFor(String userKey) {
        return repository.findByUserKeyOrderByPurchasedAtDesc(userKey).stream()
            .map(PurchaseEntryEntity::toDomain)
            .toList();
    }
}
