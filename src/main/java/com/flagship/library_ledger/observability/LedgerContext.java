package com.flagship.library_ledger.observability;

import org.slf4j.MDC;

/**
 * MDC keys for ledger logging.
 *
 * Services put the ids they work on into the MDC for the duration of a call,
 * so every log line of that call carries them (see the console pattern in
 * {@code application.yml}). Callers must pair {@link #put} with {@link #clear()}
 * in a {@code finally} block.
 */
public final class LedgerContext {

    public static final String LOAN_ID_MDC_KEY = "loanId";
    public static final String BOOK_ID_MDC_KEY = "bookId";
    public static final String USER_ID_MDC_KEY = "userId";

    private LedgerContext() {
        // Utility class
    }

    public static void put(String key, Object id) {
        if (id != null) {
            MDC.put(key, id.toString());
        }
    }

    public static void clear() {
        MDC.remove(LOAN_ID_MDC_KEY);
        MDC.remove(BOOK_ID_MDC_KEY);
        MDC.remove(USER_ID_MDC_KEY);
    }
}
