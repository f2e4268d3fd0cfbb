package com.flagship.library_ledger.observability;

import com.flagship.library_ledger.ledger.LoanRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges over the loans table: open loans and loans overdue as of today.
 *
 * Values are cached and refreshed by {@link MetricsScheduler} so a metrics
 * scrape never queries the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoanGauges {

    private final LoanRepository loanRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong openLoans = new AtomicLong(0);
    private final AtomicLong overdueLoans = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("library.loans.open", openLoans, AtomicLong::get)
                .description("Loans with no return date")
                .register(meterRegistry);

        Gauge.builder("library.loans.overdue", overdueLoans, AtomicLong::get)
                .description("Open loans whose due date has passed")
                .register(meterRegistry);

        log.info("Loan gauges registered with Micrometer");
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            openLoans.set(loanRepository.countByReturnDateIsNull());
            overdueLoans.set(loanRepository.countByReturnDateIsNullAndDueDateBefore(LocalDate.now()));
            log.debug("Loan gauges refreshed: open={}, overdue={}", openLoans.get(), overdueLoans.get());
        } catch (DataAccessException e) {
            // Keep the previous values; the next tick retries
            log.warn("Failed to refresh loan gauges: {}", e.getMessage());
        }
    }

    long openLoans() {
        return openLoans.get();
    }

    long overdueLoans() {
        return overdueLoans.get();
    }
}
