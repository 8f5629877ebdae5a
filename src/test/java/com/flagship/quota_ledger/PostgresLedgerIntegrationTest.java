package com.flagship.quota_ledger;

import com.flagship.quota_ledger.exception.QuotaExceededException;
import com.flagship.quota_ledger.support.MutableClock;
import com.flagship.quota_ledger.support.TestClockConfig;
import com.flagship.quota_ledger.usage.TopUpCredit;
import com.flagship.quota_ledger.usage.UsageLedgerService;
import com.flagship.quota_ledger.usage.UsageRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the ledger against a real PostgreSQL, where row locks, the
 * aborted-transaction state and CHECK constraints behave as in production.
 * Skipped when Docker is not available.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
@Testcontainers(disabledWithoutDocker = true)
class PostgresLedgerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("quota_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("ledger.store.max-attempts", () -> "10");
    }

    @Autowired
    private UsageLedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MutableClock clock;

    private String userKey;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfig.DEFAULT_NOW);
        userKey = "pg-user-" + UUID.randomUUID();
    }

    @Test
    @DisplayName("Concurrent bookings and credits settle to the exact balance")
    void concurrentBookingsAndCredits() throws Exception {
        ledgerService.fetch(userKey, "free");
        String transactionId = "pg-" + userKey;
        AtomicInteger booked = new AtomicInteger();
        AtomicInteger freshCredits = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < 30; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        ledgerService.book(userKey, 100, "free", null);
                        booked.incrementAndGet();
                    } catch (QuotaExceededException ignored) {
                        // expected once the balance is spent
                    }
                    return null;
                }));
            }
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    if (!ledgerService.credit(TopUpCredit.builder()
                            .userKey(userKey).seconds(10_800).transactionId(transactionId).build())
                            .isAlreadyCredited()) {
                        freshCredits.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, freshCredits.get());
        UsageRecord record = ledgerService.fetch(userKey, "free");
        long spent = record.getSecondsUsed() + (10_800 - record.getTopupBalanceSeconds());
        assertEquals(booked.get() * 100L, spent);
        assertTrue(record.getSecondsUsed() <= record.getSubscriptionLimitSeconds());
        assertTrue(record.getTopupBalanceSeconds() >= 0);
    }

    @Test
    @DisplayName("Top-up carries into January on PostgreSQL")
    void carryForwardOnPostgres() {
        clock.setInstant(Instant.parse("2024-12-31T12:00:00Z"));
        ledgerService.fetch(userKey, "free");
        jdbcTemplate.update("UPDATE user_usage SET topup_seconds_available = 160 " +
            "WHERE user_key = ? AND period_ym = '2024-12'", userKey);

        clock.setInstant(Instant.parse("2025-01-01T00:00:01Z"));
        assertEquals(160, ledgerService.fetch(userKey, "free").getTopupBalanceSeconds());
    }

    @Test
    @DisplayName("Schema rejects a negative top-up balance")
    void checkConstraintGuardsBalance() {
        ledgerService.fetch(userKey, "free");

        assertThrows(org.springframework.dao.DataIntegrityViolationException.class,
            () -> jdbcTemplate.update("UPDATE user_usage SET topup_seconds_available = -1 WHERE user_key = ?", userKey));
    }
}
