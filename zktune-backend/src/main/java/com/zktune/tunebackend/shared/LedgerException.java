package com.zktune.tunebackend.shared;

import org.springframework.web.server.ResponseStatusException;

/**
 * Raised when a ledger operation is refused. The HTTP status comes from the {@link LedgerError}
 * so controllers can let it propagate untouched.
 */
public class LedgerException extends ResponseStatusException {

    private final LedgerError error;

    public LedgerException(LedgerError error, String reason) {
        super(error.getStatus(), reason);
        this.error = error;
    }

    public LedgerException(LedgerError error, String reason, Throwable cause) {
        super(error.getStatus(), reason, cause);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }
}
