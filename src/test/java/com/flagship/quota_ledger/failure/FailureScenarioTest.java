package com.flagship.quota_ledger.failure;

import com.flagship.quota_ledger.exception.ApiError;
import com.flagship.quota_ledger.exception.GlobalExceptionHandler;
import com.flagship.quota_ledger.exception.StoreUnavailableException;
import com.flagship.quota_ledger.purchase.CreditedTransactionCache;
import com.flagship.quota_ledger.period.PeriodKey;
import com.flagship.quota_ledger.purchase.PurchaseJournal;
import com.flagship.quota_ledger.support.MutableClock;
import com.flagship.quota_ledger.support.TestClockConfig;
import com.flagship.quota_ledger.usage.TopUpCredit;
import com.flagship.quota_ledger.usage.UsageLedgerService;
import com.flagship.quota_ledger.usage.UsageRecord;
import com.flagship.quota_ledger.usage.UsageRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Behaviour when the usage store fails or keeps conflicting.
 *
 * Every failure must leave the ledger as if the operation never ran, so
 * callers can safely retry.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class FailureScenarioTest {

    private static final int MAX_ATTEMPTS = 25;

    @SpyBean
    private UsageRecordStore store;

    @SpyBean
    private PurchaseJournal journal;

    @MockBean
    private CreditedTransactionCache creditedCache;

    @Autowired
    private UsageLedgerService ledgerService;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MutableClock clock;

    private String userKey;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfig.DEFAULT_NOW);
        userKey = "user-" + UUID.randomUUID();
    }

    @Test
    @DisplayName("Unreachable store answers store_unavailable over HTTP")
    void storeDownOverHttp() throws Exception {
        doThrow(new DataAccessResourceFailureException("connection refused"))
            .when(store).find(anyString(), any(PeriodKey.class));

        mockMvc.perform(post("/api/usage/fetch")
                .header("X-Analytics-Token", "test-service-token")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_key\":\"" + userKey + "\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("store_unavailable"));
    }

    @Test
    @DisplayName("Persistent lock conflicts end in store_unavailable without a partial booking")
    void conflictsExhaustRetries() {
        ledgerService.fetch(userKey, "free");
        doThrow(new CannotAcquireLockException("row locked"))
            .when(store).updateBalances(any(UsageRecord.class), anyLong());

        assertThrows(StoreUnavailableException.class, () -> ledgerService.book(userKey, 100, "free", null));

        verify(store, times(MAX_ATTEMPTS)).updateBalances(any(UsageRecord.class), anyLong());
        doCallRealMethod().when(store).updateBalances(any(UsageRecord.class), anyLong());
        assertEquals(0, ledgerService.fetch(userKey, "free").getSecondsUsed());
    }

    @Test
    @DisplayName("Failed balance update rolls back the journal entry, so a retry credits")
    void creditIsAtomic() {
        ledgerService.fetch(userKey, "free");
        String transactionId = "atomic-" + userKey;
        doThrow(new DataAccessResourceFailureException("write failed"))
            .when(store).addTopup(anyString(), any(PeriodKey.class), anyLong(), any(Instant.class));

        assertThrows(StoreUnavailableException.class, () -> ledgerService.credit(topUp(transactionId)));
        assertFalse(journal.contains(transactionId));
        assertEquals(0, ledgerService.fetch(userKey, "free").getTopupBalanceSeconds());

        doCallRealMethod()
            .when(store).addTopup(anyString(), any(PeriodKey.class), anyLong(), any(Instant.class));

        assertFalse(ledgerService.credit(topUp(transactionId)).isAlreadyCredited());
        assertTrue(journal.contains(transactionId));
        assertEquals(10_800, ledgerService.fetch(userKey, "free").getTopupBalanceSeconds());
    }

    @Test
    @DisplayName("Store outage on a cached duplicate credit answers store_unavailable")
    void cachedDuplicateWithStoreDown() throws Exception {
        String transactionId = "cached-" + userKey;
        when(creditedCache.isCredited(transactionId)).thenReturn(true);
        doThrow(new CannotCreateTransactionException("connection refused"))
            .when(journal).find(transactionId);

        mockMvc.perform(post("/api/usage/topup")
                .header("X-Analytics-Token", "test-service-token")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_key\":\"" + userKey + "\",\"seconds\":10800,\"transaction_id\":\""
                    + transactionId + "\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("store_unavailable"));
    }

    @Test
    @DisplayName("Transaction infrastructure failures map to store_unavailable")
    void transactionFailureMapsToStoreUnavailable() {
        ResponseEntity<ApiError> response = new GlobalExceptionHandler()
            .handleTransactionFailure(new CannotCreateTransactionException("pool exhausted"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals("store_unavailable", response.getBody().getError());
    }

    private TopUpCredit topUp(String transactionId) {
        return TopUpCredit.builder()
            .userKey(userKey)
            .seconds(10_800)
            .transactionId(transactionId)
            .build();
    }
}
