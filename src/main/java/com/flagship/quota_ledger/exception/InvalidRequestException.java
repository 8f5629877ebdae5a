package com.flagship.quota_ledger.exception;

public class InvalidRequestException extends LedgerException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
