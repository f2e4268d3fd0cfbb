package com.flagship.library_ledger.error;

/**
 * A unique key or foreign key constraint rejected a write.
 * Wraps the storage exception as the cause.
 */
public class ConstraintViolationException extends LibraryException {

    public ConstraintViolationException(String message, Throwable cause) {
        super(ErrorCode.CONSTRAINT_VIOLATION, message, cause);
    }
}
