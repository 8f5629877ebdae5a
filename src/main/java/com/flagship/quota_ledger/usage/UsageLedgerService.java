package com.flagship.quota_ledger.usage;

import com.flagship.quota_ledger.config.LedgerProperties;
import com.flagship.quota_ledger.exception.InvalidRequestException;
import com.flagship.quota_ledger.exception.QuotaExceededException;
import com.flagship.quota_ledger.exception.StoreUnavailableException;
import com.flagship.quota_ledger.observability.QuotaMetrics;
import com.flagship.quota_ledger.period.PeriodKey;
import com.flagship.quota_ledger.period.PeriodResolver;
import com.flagship.quota_ledger.plan.Plan;
import com.flagship.quota_ledger.plan.PlanCatalog;
import com.flagship.quota_ledger.purchase.CreditedTransactionCache;
import com.flagship.quota_ledger.purchase.PurchaseEntry;
import com.flagship.quota_ledger.purchase.PurchaseJournal;
import com.flagship.quota_ledger.purchase.TopUpProductCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fetch, Book and Credit on top of the usage record store and the purchase journal.
 *
 * The service holds no state between requests. Every operation:
 * 1. Resolves the period from the server clock
 * 2. Lazily opens the period record, carrying the previous top-up balance forward
 * 3. Mutates balances only under a row lock inside a store transaction
 * 4. Retries transient store conflicts, then reports store_unavailable
 *
 * Credits are idempotent per transaction id: the journal insert and the
 * balance increase commit together, and the journal's primary key lets only
 * one of any number of concurrent or repeated calls through.
 */
@Service
@Slf4j
public class UsageLedgerService {

    private final UsageRecordStore store;
    private final PurchaseJournal journal;
    private final CreditedTransactionCache creditedCache;
    private final PlanCatalog planCatalog;
    private final TopUpProductCatalog productCatalog;
    private final PeriodResolver periodResolver;
    private final TransactionTemplate transactionTemplate;
    private final QuotaMetrics metrics;
    private final int maxAttempts;
    private final boolean syncPlanOnRequest;

    public UsageLedgerService(UsageRecordStore store,
                              PurchaseJournal journal,
                              CreditedTransactionCache creditedCache,
                              PlanCatalog planCatalog,
                              TopUpProductCatalog productCatalog,
                              PeriodResolver periodResolver,
                              TransactionTemplate transactionTemplate,
                              QuotaMetrics metrics,
                              LedgerProperties properties) {
        this.store = store;
        this.journal = journal;
        this.creditedCache = creditedCache;
        this.planCatalog = planCatalog;
        this.productCatalog = productCatalog;
        this.periodResolver = periodResolver;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.maxAttempts = properties.getStore().getMaxAttempts();
        this.syncPlanOnRequest = properties.getPlans().isSyncOnRequest();
    }

    /**
     * Returns the current period's record, creating it on first access.
     *
     * Never changes consumption or top-up balance, apart from the one-time
     * carry-forward when the record is opened.
     *
     * @param userKey paying entity
     * @param planHint caller's belief about the plan, may be null
     */
    public UsageRecord fetch(String userKey, String planHint) {
        requireUserKey(userKey);
        PeriodKey period = periodResolver.currentPeriod();
        return withConflictRetry("fetch",
            () -> syncPlan(ensureRecord(userKey, period, planHint), planHint));
    }

    /**
     * Books consumed seconds against the current period.
     *
     * Top-up balance is spent before the subscription allowance. A booking
     * larger than both together is rejected without any write.
     *
     * @param clientRecordedAt client's timestamp, logged only, never used for the period
     * @throws InvalidRequestException if seconds is not positive
     * @throws QuotaExceededException if the booking does not fit
     */
    public BookingResult book(String userKey, long seconds, String planHint, Instant clientRecordedAt) {
        requireUserKey(userKey);
        if (seconds <= 0) {
            metrics.recordBooking("invalid");
            throw new InvalidRequestException("seconds must be a positive integer");
        }
        PeriodKey period = periodResolver.currentPeriod();
        logClientPeriodDrift(period, clientRecordedAt);

        BookingResult result;
        try {
            result = withConflictRetry("book", () -> {
                syncPlan(ensureRecord(userKey, period, planHint), planHint);
                return transactionTemplate.execute(status -> applyBooking(userKey, period, seconds));
            });
        } catch (QuotaExceededException e) {
            metrics.recordBooking("quota_exceeded");
            throw e;
        }

        metrics.recordBooking("booked");
        metrics.recordBookedSeconds(result.getTopupUsed(), result.getSubscriptionUsed());
        log.info("Booked {}s in {}: fromTopup={}s, fromSubscription={}s, secondsUsed={}s, remaining={}s",
            seconds, period, result.getTopupUsed(), result.getSubscriptionUsed(),
            result.getSecondsUsed(), result.getRemainingSeconds());
        return result;
    }

    /**
     * Applies a purchased top-up exactly once per transaction id.
     *
     * @throws InvalidRequestException if a field is missing or the amount matches no product
     */
    public CreditResult credit(TopUpCredit credit) {
        requireUserKey(credit.getUserKey());
        String transactionId = credit.getTransactionId();
        if (transactionId == null || transactionId.isBlank()) {
            metrics.recordCredit("invalid");
            throw new InvalidRequestException("transaction_id is required");
        }
        String productId = resolveProduct(credit);

        if (creditedCache.isCredited(transactionId)) {
            return withConflictRetry("credit", () -> alreadyCredited(credit));
        }

        PeriodKey period = periodResolver.currentPeriod();
        CreditResult result = withConflictRetry("credit", () -> {
            if (journal.contains(transactionId)) {
                return alreadyCredited(credit);
            }
            ensureRecord(credit.getUserKey(), period, null);
            Instant now = periodResolver.now();
            PurchaseEntry entry = new PurchaseEntry(transactionId, credit.getUserKey(), credit.getSeconds(),
                productId, credit.getPricePaid(), credit.getCurrency(), now);
            try {
                Long balance = transactionTemplate.execute(status -> applyCredit(entry, period, now));
                return CreditResult.credited(transactionId, credit.getSeconds(), balance);
            } catch (DataIntegrityViolationException e) {
                // Lost the race for the journal key; the next attempt sees the winner's entry
                throw new ConcurrencyFailureException(
                    "Transaction " + transactionId + " was claimed by a concurrent credit", e);
            }
        });

        if (!result.isAlreadyCredited()) {
            creditedCache.markCredited(transactionId, credit.getUserKey());
            metrics.recordCredit("credited");
            log.info("Credited {}s from purchase {} (product {}), topup balance now {}s",
                credit.getSeconds(), transactionId, productId, result.getNewTopupBalance());
        }
        return result;
    }

    /**
     * Audit view of a user's credited purchases, newest first.
     */
    public List<PurchaseEntry> purchaseHistory(String userKey) {
        requireUserKey(userKey);
        try {
            return journal.historyFor(userKey);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Purchase journal unavailable", e);
        }
    }

    private String resolveProduct(TopUpCredit credit) {
        try {
            if (credit.getSeconds() <= 0) {
                throw new InvalidRequestException("seconds must be a positive integer");
            }
            return productCatalog.resolveProduct(credit.getProductId(), credit.getSeconds());
        } catch (InvalidRequestException e) {
            metrics.recordCredit("invalid");
            throw e;
        }
    }

    private BookingResult applyBooking(String userKey, PeriodKey period, long seconds) {
        UsageRecord locked = store.findForUpdate(userKey, period)
            .orElseThrow(() -> new IllegalStateException("Usage record missing for " + userKey + "/" + period));
        if (!locked.canAbsorb(seconds)) {
            throw new QuotaExceededException(userKey, seconds, locked.totalAvailableSeconds());
        }
        UsageRecord updated = locked.deduct(seconds, periodResolver.now());
        store.updateBalances(updated, locked.getVersion());
        return BookingResult.of(locked, updated, seconds);
    }

    private Long applyCredit(PurchaseEntry entry, PeriodKey period, Instant now) {
        // Serializes credits of one user, so a replayed id meets a committed journal row
        store.findForUpdate(entry.getUserKey(), period)
            .orElseThrow(() -> new IllegalStateException(
                "Usage record missing for " + entry.getUserKey() + "/" + period));
        journal.record(entry);
        store.addTopup(entry.getUserKey(), period, entry.getSecondsCredited(), now);
        return store.find(entry.getUserKey(), period)
            .map(UsageRecord::getTopupBalanceSeconds)
            .orElseThrow(() -> new IllegalStateException(
                "Usage record missing for " + entry.getUserKey() + "/" + period));
    }

    private CreditResult alreadyCredited(TopUpCredit credit) {
        String transactionId = credit.getTransactionId();
        Optional<PurchaseEntry> original = journal.find(transactionId);
        original
            .filter(entry -> !entry.getUserKey().equals(credit.getUserKey()))
            .ifPresent(entry -> log.warn("Purchase {} belongs to user {}, replayed for another user",
                transactionId, entry.getUserKey()));

        long secondsCredited = original.map(PurchaseEntry::getSecondsCredited).orElse(credit.getSeconds());
        long balance = currentTopupBalance(credit.getUserKey());
        metrics.recordCredit("duplicate");
        log.info("Purchase {} already credited, topup balance unchanged at {}s", transactionId, balance);
        return CreditResult.alreadyCredited(transactionId, secondsCredited, balance);
    }

    /**
     * Top-up balance as it stands now, without opening a record. Before the
     * current period's record exists that is what it would carry forward.
     */
    private long currentTopupBalance(String userKey) {
        PeriodKey period = periodResolver.currentPeriod();
        return store.find(userKey, period)
            .map(UsageRecord::getTopupBalanceSeconds)
            .orElseGet(() -> carriedTopupFor(userKey, period));
    }

    /**
     * Top-up balance a new record for the period starts with: the preceding
     * month's, or after inactive months the most recent earlier record's.
     */
    private long carriedTopupFor(String userKey, PeriodKey period) {
        return store.find(userKey, periodResolver.previousPeriod(period))
            .or(() -> store.findLatestBefore(userKey, period))
            .map(UsageRecord::getTopupBalanceSeconds)
            .orElse(0L);
    }

    private UsageRecord ensureRecord(String userKey, PeriodKey period, String planHint) {
        Optional<UsageRecord> existing = store.find(userKey, period);
        if (existing.isPresent()) {
            return existing.get();
        }

        Plan plan = planCatalog.resolve(planHint);
        long carriedTopup = carriedTopupFor(userKey, period);
        UsageRecord opened = UsageRecord.open(userKey, period, plan, carriedTopup, periodResolver.now());

        if (store.insertIfAbsent(opened)) {
            metrics.recordRecordCreated(carriedTopup > 0);
            log.info("Opened usage record for {}: plan={}, allowance={}s, carriedTopup={}s",
                period, plan.getId(), plan.getMonthlyAllowanceSeconds(), carriedTopup);
            return opened;
        }
        return store.find(userKey, period)
            .orElseThrow(() -> new IllegalStateException(
                "Usage record for " + userKey + "/" + period + " neither inserted nor found"));
    }

    private UsageRecord syncPlan(UsageRecord record, String planHint) {
        if (!syncPlanOnRequest || planHint == null || planHint.isBlank()) {
            return record;
        }
        Plan plan = planCatalog.resolve(planHint);
        if (plan.getId().equals(record.getPlan())) {
            return record;
        }
        if (store.updatePlan(record.getUserKey(), record.getPeriod(), plan.getId(),
                plan.getMonthlyAllowanceSeconds(), periodResolver.now())) {
            log.info("Plan for {} changed from {} to {}, allowance {}s -> {}s",
                record.getPeriod(), record.getPlan(), plan.getId(),
                record.getSubscriptionLimitSeconds(), plan.getMonthlyAllowanceSeconds());
        }
        return store.find(record.getUserKey(), record.getPeriod())
            .orElseThrow(() -> new IllegalStateException(
                "Usage record missing for " + record.getUserKey() + "/" + record.getPeriod()));
    }

    private void logClientPeriodDrift(PeriodKey serverPeriod, Instant clientRecordedAt) {
        if (clientRecordedAt == null) {
            return;
        }
        PeriodKey clientPeriod = periodResolver.currentPeriod(clientRecordedAt);
        if (!clientPeriod.equals(serverPeriod)) {
            log.info("Client reported a booking in {}, charging server period {}", clientPeriod, serverPeriod);
        }
    }

    private <T> T withConflictRetry(String operation, Supplier<T> action) {
        ConcurrencyFailureException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException e) {
                lastConflict = e;
                metrics.recordStoreConflict(operation);
                log.debug("Store conflict during {} (attempt {}/{}): {}",
                    operation, attempt, maxAttempts, e.getMessage());
            } catch (DataAccessException | TransactionException e) {
                throw new StoreUnavailableException("Usage store failed during " + operation, e);
            }
        }
        throw new StoreUnavailableException(
            String.format("%s still conflicting after %d attempts", operation, maxAttempts), lastConflict);
    }

    private static void requireUserKey(String userKey) {
        if (userKey == null || userKey.isBlank()) {
            throw new InvalidRequestException("user_key is required");
        }
    }
}
