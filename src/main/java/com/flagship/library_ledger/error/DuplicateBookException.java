package com.flagship.library_ledger.error;

import lombok.Getter;

@Getter
public class DuplicateBookException extends LibraryException {

    private final Long existingBookId;

    public DuplicateBookException(String title, String author, Long existingBookId) {
        super(ErrorCode.DUPLICATE_BOOK,
            String.format("A book with title '%s' by '%s' already exists (ID: %d)",
                title, author, existingBookId));
        this.existingBookId = existingBookId;
    }
}
