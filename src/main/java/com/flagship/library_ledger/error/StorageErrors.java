package com.flagship.library_ledger.error;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;

/**
 * Translates Spring's {@link DataAccessException} hierarchy into the library
 * error taxonomy. Anything it does not recognise is returned unchanged.
 */
public final class StorageErrors {

    private StorageErrors() {
    }

    public static RuntimeException translate(String operation, DataAccessException e) {
        if (e instanceof DataIntegrityViolationException) {
            return new ConstraintViolationException(
                operation + " rejected by a storage constraint: " + rootMessage(e), e);
        }
        // CannotAcquireLockException and DeadlockLoserDataAccessException both land here
        if (e instanceof PessimisticLockingFailureException || e instanceof QueryTimeoutException) {
            return new ConcurrencyConflictException(
                operation + " could not lock the rows it needs, retry: " + rootMessage(e), e);
        }
        return e;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
