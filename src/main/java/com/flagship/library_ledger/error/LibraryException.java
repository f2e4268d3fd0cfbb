package com.flagship.library_ledger.error;

import lombok.Getter;

/**
 * Base class for domain failures raised by the ledger, catalog and user services.
 *
 * Errors are returned to the caller unmodified. Nothing inside the core retries;
 * {@link #isRetryable()} tells the caller whether a retry can succeed.
 */
@Getter
public abstract class LibraryException extends RuntimeException {

    private final ErrorCode code;

    protected LibraryException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected LibraryException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public boolean isRetryable() {
        return code == ErrorCode.CONCURRENCY_CONFLICT;
    }
}
