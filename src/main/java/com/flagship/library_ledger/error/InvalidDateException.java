package com.flagship.library_ledger.error;

public class InvalidDateException extends LibraryException {

    public InvalidDateException(String message) {
        super(ErrorCode.INVALID_DATE, message);
    }
}
