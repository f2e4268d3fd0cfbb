package com.flagship.library_ledger.config;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Bounds how long the current transaction waits for row locks.
 *
 * PostgreSQL ignores JPA lock timeout hints other than NOWAIT, so the limit is
 * set with {@code set_config('lock_timeout', ..., true)}, which lasts until the
 * enclosing transaction ends. A timed-out lock raises SQLSTATE 55P03, which
 * Spring translates into a {@code PessimisticLockingFailureException}.
 */
@Component
@RequiredArgsConstructor
public class RowLockTimeout {

    private final JdbcTemplate jdbcTemplate;
    private final LoanProperties loanProperties;

    @Transactional(propagation = Propagation.MANDATORY)
    public void apply() {
        long timeoutMs = loanProperties.getLockTimeoutMs();
        jdbcTemplate.queryForObject(
            "SELECT set_config('lock_timeout', ?, true)",
            String.class,
            timeoutMs + "ms"
        );
    }
}
