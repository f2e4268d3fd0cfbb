package com.flagship.library_ledger.ledger;

import com.flagship.library_ledger.error.AlreadyReturnedException;
import com.flagship.library_ledger.error.InvalidDateException;
import lombok.Value;

import java.time.LocalDate;

/**
 * Loan domain object.
 *
 * Key rules:
 * - due date is strictly after the loan date
 * - a loan is returned at most once, never before it was made
 * - state changes produce a new instance
 */
@Value
public class Loan {
    Long id;
    Long userId;
    Long bookId;
    LocalDate loanDate;
    LocalDate dueDate;
    LocalDate returnDate;

    /**
     * Creates a new OPEN loan (not yet persisted).
     *
     * @throws InvalidDateException if {@code dueDate} is not after {@code loanDate}
     */
    public static Loan open(Long userId, Long bookId, LocalDate loanDate, LocalDate dueDate) {
        if (loanDate == null || dueDate == null) {
            throw new IllegalArgumentException("Loan date and due date are required");
        }
        if (!dueDate.isAfter(loanDate)) {
            throw new InvalidDateException(String.format(
                "Due date %s must be after loan date %s", dueDate, loanDate));
        }
        return new Loan(null, userId, bookId, loanDate, dueDate, null);
    }

    public LoanStatus getStatus() {
        return returnDate == null ? LoanStatus.OPEN : LoanStatus.CLOSED;
    }

    public boolean isOpen() {
        return returnDate == null;
    }

    /**
     * Transitions the loan to CLOSED.
     *
     * @throws AlreadyReturnedException if the loan is already CLOSED
     * @throws InvalidDateException if {@code date} is before the loan date
     */
    public Loan close(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("Return date is required");
        }
        if (!isOpen()) {
            throw new AlreadyReturnedException(id, returnDate);
        }
        if (date.isBefore(loanDate)) {
            throw new InvalidDateException(String.format(
                "Return date %s is before loan date %s for loan %d", date, loanDate, id));
        }
        return new Loan(id, userId, bookId, loanDate, dueDate, date);
    }

    /**
     * An open loan is overdue once its due date lies strictly before {@code asOf}.
     */
    public boolean isOverdue(LocalDate asOf) {
        return isOpen() && dueDate.isBefore(asOf);
    }
}
