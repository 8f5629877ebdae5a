package com.flagship.quota_ledger.usage;

import com.flagship.quota_ledger.exception.InvalidRequestException;
import com.flagship.quota_ledger.observability.CorrelationContext;
import com.flagship.quota_ledger.observability.QuotaMetrics;
import com.flagship.quota_ledger.purchase.dto.PurchaseResponse;
import com.flagship.quota_ledger.usage.dto.BookUsageRequest;
import com.flagship.quota_ledger.usage.dto.BookUsageResponse;
import com.flagship.quota_ledger.usage.dto.CreditTopUpRequest;
import com.flagship.quota_ledger.usage.dto.CreditTopUpResponse;
import com.flagship.quota_ledger.usage.dto.FetchUsageRequest;
import com.flagship.quota_ledger.usage.dto.UsageResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP boundary of the quota ledger.
 *
 * Maps snake_case JSON onto {@link UsageLedgerService} calls. Authentication
 * happens before this controller in the service token filter; rejections are
 * rendered by the global exception handler.
 */
@RestController
@RequestMapping("/api/usage")
@RequiredArgsConstructor
@Slf4j
public class UsageController {

    private final UsageLedgerService ledgerService;
    private final QuotaMetrics metrics;

    @PostMapping("/fetch")
    public ResponseEntity<UsageResponse> fetch(@Valid @RequestBody FetchUsageRequest request) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.USER_KEY_MDC_KEY, request.getUserKey());

        UsageRecord record = ledgerService.fetch(request.getUserKey(), request.getPlan());

        metrics.recordLatency("fetch", System.currentTimeMillis() - startTime);
        log.debug("Fetched usage: plan={}, secondsUsed={}, remaining={}",
            record.getPlan(), record.getSecondsUsed(), record.totalAvailableSeconds());
        return ResponseEntity.ok(UsageResponse.from(record));
    }

    @PostMapping("/book")
    public ResponseEntity<BookUsageResponse> book(@Valid @RequestBody BookUsageRequest request) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.USER_KEY_MDC_KEY, request.getUserKey());

        try {
            BookingResult result = ledgerService.book(
                request.getUserKey(), request.getSeconds(), request.getPlan(), request.getRecordedAt());
            return ResponseEntity.ok(BookUsageResponse.from(result));
        } finally {
            metrics.recordLatency("book", System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Credits a purchased top-up. Replays of an already credited transaction
     * answer 200 with {@code already_credited} set.
     */
    @PostMapping("/topup")
    public ResponseEntity<CreditTopUpResponse> credit(@Valid @RequestBody CreditTopUpRequest request) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.USER_KEY_MDC_KEY, request.getUserKey());
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, request.getTransactionId());

        log.info("Received top-up credit: seconds={}, product={}, price={} {}",
            request.getSeconds(), request.getProductId(), request.getPricePaid(), request.getCurrency());

        try {
            CreditResult result = ledgerService.credit(TopUpCredit.builder()
                .userKey(request.getUserKey())
                .seconds(request.getSeconds())
                .transactionId(request.getTransactionId())
                .productId(request.getProductId())
                .pricePaid(request.getPricePaid())
                .currency(request.getCurrency())
                .build());
            return ResponseEntity.ok(CreditTopUpResponse.from(result));
        } finally {
            metrics.recordLatency("credit", System.currentTimeMillis() - startTime);
        }
    }

    @GetMapping("/purchases")
    public ResponseEntity<List<PurchaseResponse>> purchases(@RequestParam("user_key") String userKey) {
        if (userKey.isBlank()) {
            throw new InvalidRequestException("user_key is required");
        }
        MDC.put(CorrelationContext.USER_KEY_MDC_KEY, userKey);

        List<PurchaseResponse> history = ledgerService.purchaseHistory(userKey).stream()
            .map(PurchaseResponse::from)
            .toList();
        return ResponseEntity.ok(history);
    }
}
