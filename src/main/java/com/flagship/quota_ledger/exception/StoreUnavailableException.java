package com.flagship.quota_ledger.exception;

/**
 * Persistence failed or kept conflicting. Callers should treat the operation
 * as not applied and may retry.
 */
public class StoreUnavailableException extends LedgerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
