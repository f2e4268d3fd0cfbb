package com.flagship.library_ledger.error;

/**
 * Error taxonomy for library ledger operations.
 *
 * Every {@link LibraryException} carries exactly one code so callers can
 * branch on the kind of failure without inspecting messages.
 */
public enum ErrorCode {
    NOT_FOUND,
    OUT_OF_STOCK,
    ALREADY_RETURNED,
    INVALID_DATE,
    CONSTRAINT_VIOLATION,

    /**
     * Lock timeout or deadlock while waiting for a row lock.
     * The only code callers may retry.
     */
    CONCURRENCY_CONFLICT,

    DUPLICATE_LOAN,
    DUPLICATE_BOOK,
    ACTIVE_LOANS
}
