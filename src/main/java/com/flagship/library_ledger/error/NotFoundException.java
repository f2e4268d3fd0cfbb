package com.flagship.library_ledger.error;

import lombok.Getter;

/**
 * A referenced user, book or loan does not exist.
 */
@Getter
public class NotFoundException extends LibraryException {

    private final String resource;
    private final Long id;

    public NotFoundException(String resource, Long id) {
        super(ErrorCode.NOT_FOUND, resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public static NotFoundException user(Long userId) {
        return new NotFoundException("User", userId);
    }

    public static NotFoundException book(Long bookId) {
        return new NotFoundException("Book", bookId);
    }

    public static NotFoundException loan(Long loanId) {
        return new NotFoundException("Loan", loanId);
    }
}
