package com.flagship.library_ledger.ledger;

/**
 * Loan lifecycle state, derived from {@code return_date}.
 *
 * OPEN -> CLOSED is the only transition, made by returning the loan.
 */
public enum LoanStatus {
    /**
     * No return date recorded. The copy is out of the library.
     */
    OPEN,

    /**
     * Returned. Terminal state.
     */
    CLOSED
}
