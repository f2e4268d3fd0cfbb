package com.flagship.library_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * JPA entity for the {@code loans} table.
 *
 * User and book are kept as plain foreign key columns; the cascade rules live
 * in the schema. Only {@code return_date} is mutable, and only once.
 */
@Entity
@Table(
    name = "loans",
    indexes = {
        @Index(name = "idx_loans_user_id", columnList = "user_id"),
        @Index(name = "idx_loans_book_id", columnList = "book_id"),
        @Index(name = "idx_loans_loan_date", columnList = "loan_date"),
        @Index(name = "idx_loans_due_date", columnList = "due_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "loan_id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "book_id", nullable = false, updatable = false)
    private Long bookId;

    @Column(name = "loan_date", nullable = false, updatable = false)
    private LocalDate loanDate;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "return_date")
    private LocalDate returnDate;

    static LoanEntity fromDomain(Loan loan) {
        return new LoanEntity(
            null, // id - assigned by the identity column
            loan.getUserId(),
            loan.getBookId(),
            loan.getLoanDate(),
            loan.getDueDate(),
            loan.getReturnDate()
        );
    }

    public Loan toDomain() {
        return new Loan(id, userId, bookId, loanDate, dueDate, returnDate);
    }

    /**
     * Records the return. The domain object has already validated the transition.
     */
    void updateFromDomain(Loan loan) {
        if (this.returnDate != null) {
            throw new IllegalStateException(
                "Return date already set for loan " + this.id + ". Cannot return a loan twice.");
        }
        this.returnDate = loan.getReturnDate();
    }
}
