package com.flagship.library_ledger.error;

/**
 * The row lock guarding a read-modify-write could not be acquired in time,
 * or the database aborted the transaction to break a deadlock.
 * Safe to retry.
 */
public class ConcurrencyConflictException extends LibraryException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorCode.CONCURRENCY_CONFLICT, message, cause);
    }
}
