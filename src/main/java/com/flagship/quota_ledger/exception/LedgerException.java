package com.flagship.quota_ledger.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Base class for every rejection the ledger reports with a typed reason.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Extra fields rendered into the error body.
     */
    public Map<String, String> getDetails() {
        return Map.of();
    }
}
