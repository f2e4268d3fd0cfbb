package com.flagship.library_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;

/**
 * Keyset-paged reads of overdue loans with plain JDBC.
 *
 * Each page is a single statement on its own connection checkout, so a slow
 * consumer of {@link OverdueLoans} never holds a connection between pages.
 * The {@code idx_loans_due_date} index serves both the filter and the order.
 */
@Component
@RequiredArgsConstructor
public class OverdueLoanQuery implements OverdueLoans.PageSource {

    private static final String FIRST_PAGE =
        "SELECT loan_id, user_id, book_id, loan_date, due_date, return_date FROM loans " +
        "WHERE return_date IS NULL AND due_date < ? " +
        "ORDER BY due_date ASC, loan_id ASC LIMIT ?";

    private static final String NEXT_PAGE =
        "SELECT loan_id, user_id, book_id, loan_date, due_date, return_date FROM loans " +
        "WHERE return_date IS NULL AND due_date < ? " +
        "AND (due_date > ? OR (due_date = ? AND loan_id > ?)) " +
        "ORDER BY due_date ASC, loan_id ASC LIMIT ?";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<Loan> fetch(LocalDate asOf, Loan after, int limit) {
        if (after == null) {
            return jdbcTemplate.query(FIRST_PAGE, loanRowMapper(), Date.valueOf(asOf), limit);
        }
        Date afterDue = Date.valueOf(after.getDueDate());
        return jdbcTemplate.query(NEXT_PAGE, loanRowMapper(),
            Date.valueOf(asOf), afterDue, afterDue, after.getId(), limit);
    }

    private RowMapper<Loan> loanRowMapper() {
        return (rs, rowNum) -> {
            Date returned = rs.getDate("return_date");
            return new Loan(
                rs.getLong("loan_id"),
                rs.getLong("user_id"),
                rs.getLong("book_id"),
                rs.getDate("loan_date").toLocalDate(),
                rs.getDate("due_date").toLocalDate(),
                returned != null ? returned.toLocalDate() : null
            );
        };
    }
}
