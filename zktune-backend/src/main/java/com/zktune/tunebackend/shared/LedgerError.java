package com.zktune.tunebackend.shared;

import org.springframework.http.HttpStatus;

/**
 * Every precondition the ledger can reject a call on. None of them are retried by the ledger.
 */
public enum LedgerError {
    ALREADY_REGISTERED(HttpStatus.CONFLICT),
    NOT_REGISTERED_CREATOR(HttpStatus.NOT_FOUND),
    WORK_NOT_FOUND(HttpStatus.NOT_FOUND),
    INSUFFICIENT_PAYMENT(HttpStatus.PAYMENT_REQUIRED),
    NOT_OWNER(HttpStatus.FORBIDDEN),
    NOTHING_TO_WITHDRAW(HttpStatus.CONFLICT),
    TRANSFER_FAILED(HttpStatus.BAD_GATEWAY);

    private final HttpStatus status;

    LedgerError(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
