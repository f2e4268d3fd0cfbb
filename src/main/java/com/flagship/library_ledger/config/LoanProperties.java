package com.flagship.library_ledger.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Loan policy settings bound from {@code library.loan.*}.
 */
@ConfigurationProperties(prefix = "library.loan")
@Validated
@Getter
@Setter
public class LoanProperties {

    /**
     * Days between loan date and due date for {@code checkout}.
     */
    @Min(1)
    private int periodDays = 14;

    /**
     * Rows fetched per round trip while iterating overdue loans.
     */
    @Min(1)
    @Max(1000)
    private int overduePageSize = 100;

    /**
     * Upper bound on waiting for a book row lock. Zero waits forever.
     */
    @Min(0)
    private long lockTimeoutMs = 5000;

    private boolean rejectDuplicateOpenLoans = false;
}
