package com.flagship.library_ledger.error;

import lombok.Getter;

@Getter
public class OutOfStockException extends LibraryException {

    private final Long bookId;

    public OutOfStockException(Long bookId) {
        super(ErrorCode.OUT_OF_STOCK,
            "Book " + bookId + " is currently unavailable (all copies loaned out)");
        this.bookId = bookId;
    }
}
