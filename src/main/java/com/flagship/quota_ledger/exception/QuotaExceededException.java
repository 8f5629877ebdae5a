package com.flagship.quota_ledger.exception;

import lombok.Getter;

import java.util.Map;

/**
 * A booking asked for more seconds than the subscription allowance and
 * top-up balance can cover together. Nothing was written.
 */
@Getter
public class QuotaExceededException extends LedgerException {

    private final long requestedSeconds;
    private final long availableSeconds;

    public QuotaExceededException(String userKey, long requestedSeconds, long availableSeconds) {
        super(ErrorKind.QUOTA_EXCEEDED, String.format(
            "Quota exceeded for user %s: requested %ds, available %ds",
            userKey, requestedSeconds, availableSeconds));
        this.requestedSeconds = requestedSeconds;
        this.availableSeconds = availableSeconds;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of(
            "requested_seconds", String.valueOf(requestedSeconds),
            "available_seconds", String.valueOf(availableSeconds));
    }
}
