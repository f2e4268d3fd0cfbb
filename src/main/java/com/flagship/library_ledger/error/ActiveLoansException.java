package com.flagship.library_ledger.error;

/**
 * The operation would orphan or undercount copies that are currently on loan.
 */
public class ActiveLoansException extends LibraryException {

    public ActiveLoansException(String message) {
        super(ErrorCode.ACTIVE_LOANS, message);
    }
}
