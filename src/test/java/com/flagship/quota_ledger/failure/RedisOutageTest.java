package com.flagship.quota_ledger.failure;

import com.flagship.quota_ledger.purchase.CreditedTransactionCache;
import com.flagship.quota_ledger.support.TestClockConfig;
import com.flagship.quota_ledger.usage.CreditResult;
import com.flagship.quota_ledger.usage.TopUpCredit;
import com.flagship.quota_ledger.usage.UsageLedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The credited-transaction cache is enabled but Redis cannot be reached.
 */
@SpringBootTest(properties = {
    "ledger.idempotency-cache.enabled=true",
    "spring.data.redis.host=127.0.0.1",
    "spring.data.redis.port=1",
    "spring.data.redis.timeout=200ms"
})
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class RedisOutageTest {

    @Autowired
    private UsageLedgerService ledgerService;

    @Autowired
    private CreditedTransactionCache cache;

    @Test
    @DisplayName("Credits stay idempotent through the journal when Redis is down")
    void journalCoversRedisOutage() {
        assertTrue(cache.isEnabled());
        String userKey = "user-" + UUID.randomUUID();
        TopUpCredit credit = TopUpCredit.builder()
            .userKey(userKey)
            .seconds(10_800)
            .transactionId("outage-" + userKey)
            .build();

        CreditResult first = ledgerService.credit(credit);
        CreditResult replay = ledgerService.credit(credit);

        assertFalse(first.isAlreadyCredited());
        assertTrue(replay.isAlreadyCredited());
        assertEquals(10_800, replay.getNewTopupBalance());
    }
}
