package com.flagship.quota_ledger.usage;

import com.flagship.quota_ledger.period.PeriodKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to the {@code user_usage} table.
 *
 * Correctness comes from the database, not from in-process locks:
 * - creation relies on the (user_key, period_ym) primary key
 * - balance updates run under a row lock and are guarded by row_version
 */
@Repository
@Slf4j
public class UsageRecordStore {

    private static final String COLUMNS =
        "user_key, period_ym, plan, subscription_limit_seconds, seconds_used, " +
        "topup_seconds_available, row_version, created_at, updated_at";

    private static final RowMapper<UsageRecord> ROW_MAPPER = (rs, rowNum) -> new UsageRecord(
        rs.getString("user_key"),
        PeriodKey.parse(rs.getString("period_ym")),
        rs.getString("plan"),
        rs.getLong("subscription_limit_seconds"),
        rs.getLong("seconds_used"),
        rs.getLong("topup_seconds_available"),
        rs.getLong("row_version"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at"))
    );

    private final JdbcTemplate jdbcTemplate;

    public UsageRecordStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<UsageRecord> find(String userKey, PeriodKey period) {
        List<UsageRecord> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM user_usage WHERE user_key = ? AND period_ym = ?",
            ROW_MAPPER,
            userKey,
            period.toString()
        );
        return rows.stream().findFirst();
    }

    /**
     * Most recent record strictly before the period. Period keys sort
     * chronologically as strings.
     */
    public Optional<UsageRecord> findLatestBefore(String userKey, PeriodKey period) {
        List<UsageRecord> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM user_usage WHERE user_key = ? AND period_ym < ? " +
            "ORDER BY period_ym DESC LIMIT 1",
            ROW_MAPPER,
            userKey,
            period.toString()
        );
        return rows.stream().findFirst();
    }

    /**
     * Reads the record and locks its row until the surrounding transaction ends.
     * Must be called inside a transaction.
     */
    public Optional<UsageRecord> findForUpdate(String userKey, PeriodKey period) {
        List<UsageRecord> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM user_usage WHERE user_key = ? AND period_ym = ? FOR UPDATE",
            ROW_MAPPER,
            userKey,
            period.toString()
        );
        return rows.stream().findFirst();
    }

    /**
     * Inserts the record unless one already exists for its user and period.
     *
     * The primary key decides the race: exactly one concurrent creator gets
     * {@code true}, every other one gets {@code false} and should re-read.
     * Run this outside a surrounding transaction, PostgreSQL would otherwise
     * abort that transaction on the losing insert.
     */
    public boolean insertIfAbsent(UsageRecord record) {
        try {
            jdbcTemplate.update(
                "INSERT INTO user_usage (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                record.getUserKey(),
                record.getPeriod().toString(),
                record.getPlan(),
                record.getSubscriptionLimitSeconds(),
                record.getSecondsUsed(),
                record.getTopupBalanceSeconds(),
                record.getVersion(),
                Timestamp.from(record.getCreatedAt()),
                Timestamp.from(record.getUpdatedAt())
            );
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Usage record {}/{} created concurrently", record.getUserKey(), record.getPeriod());
            return false;
        }
    }

    /**
     * Replaces plan and allowance. Consumption and top-up balance are left as they are.
     *
     * @return true if the stored plan changed
     */
    public boolean updatePlan(String userKey, PeriodKey period, String plan, long limitSeconds, Instant now) {
        int updated = jdbcTemplate.update(
            "UPDATE user_usage SET plan = ?, subscription_limit_seconds = ?, " +
            "row_version = row_version + 1, updated_at = ? " +
            "WHERE user_key = ? AND period_ym = ? AND plan <> ?",
            plan,
            limitSeconds,
            Timestamp.from(now),
            userKey,
            period.toString(),
            plan
        );
        return updated == 1;
    }

    /**
     * Writes the balances of a booking.
     *
     * @param expectedVersion row_version the balances were computed from
     * @throws OptimisticLockingFailureException if the row changed in the meantime
     */
    public void updateBalances(UsageRecord updated, long expectedVersion) {
        int rows = jdbcTemplate.update(
            "UPDATE user_usage SET seconds_used = ?, topup_seconds_available = ?, " +
            "row_version = ?, updated_at = ? " +
            "WHERE user_key = ? AND period_ym = ? AND row_version = ?",
            updated.getSecondsUsed(),
            updated.getTopupBalanceSeconds(),
            updated.getVersion(),
            Timestamp.from(updated.getUpdatedAt()),
            updated.getUserKey(),
            updated.getPeriod().toString(),
            expectedVersion
        );
        if (rows != 1) {
            throw new OptimisticLockingFailureException(String.format(
                "Usage record %s/%s changed concurrently (expected version %d)",
                updated.getUserKey(), updated.getPeriod(), expectedVersion));
        }
    }

    /**
     * Atomically adds purchased seconds to the top-up balance.
     *
     * @throws IllegalStateException if the record does not exist
     */
    public void addTopup(String userKey, PeriodKey period, long seconds, Instant now) {
        int rows = jdbcTemplate.update(
            "UPDATE user_usage SET topup_seconds_available = topup_seconds_available + ?, " +
            "row_version = row_version + 1, updated_at = ? " +
            "WHERE user_key = ? AND period_ym = ?",
            seconds,
            Timestamp.from(now),
            userKey,
            period.toString()
        );
        if (rows != 1) {
            throw new IllegalStateException("No usage record for " + userKey + "/" + period);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
