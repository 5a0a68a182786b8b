package com.streamfirst.worklog.domain;

/**
 * Raised by ledger stores when a snapshot cannot be written or read back.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
