package com.flagship.library_ledger.error;

public class DuplicateLoanException extends LibraryException {

    public DuplicateLoanException(Long userId, Long bookId) {
        super(ErrorCode.DUPLICATE_LOAN,
            "User " + userId + " already has an open loan for book " + bookId);
    }
}
