package com.flagship.library_ledger.error;

import lombok.Getter;

import java.time.LocalDate;

@Getter
public class AlreadyReturnedException extends LibraryException {

    private final Long loanId;
    private final LocalDate returnDate;

    public AlreadyReturnedException(Long loanId, LocalDate returnDate) {
        super(ErrorCode.ALREADY_RETURNED,
            "Loan " + loanId + " was already returned on " + returnDate);
        this.loanId = loanId;
        this.returnDate = returnDate;
    }
}
