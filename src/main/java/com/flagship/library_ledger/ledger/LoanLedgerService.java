package com.flagship.library_ledger.ledger;

import com.flagship.library_ledger.catalog.Book;
import com.flagship.library_ledger.catalog.BookEntity;
import com.flagship.library_ledger.catalog.BookRepository;
import com.flagship.library_ledger.config.LoanProperties;
import com.flagship.library_ledger.config.RowLockTimeout;
import com.flagship.library_ledger.error.DuplicateLoanException;
import com.flagship.library_ledger.error.LibraryException;
import com.flagship.library_ledger.error.NotFoundException;
import com.flagship.library_ledger.error.StorageErrors;
import com.flagship.library_ledger.observability.LedgerContext;
import com.flagship.library_ledger.observability.LoanMetrics;
import com.flagship.library_ledger.user.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * The loan ledger: creates and returns loans while keeping every book's
 * {@code available_quantity} consistent with its open loans.
 *
 * Invariants enforced here:
 * 1. {@code 0 <= available_quantity <= quantity} for every book
 * 2. a loan goes OPEN -> CLOSED exactly once
 * 3. the loan row and the book counter change in the same transaction
 *
 * Both write paths lock the book row before reading {@code available_quantity},
 * so two callers racing for the last copy are serialized: one commits, the
 * other then sees zero and fails with OUT_OF_STOCK. Returns lock the loan row
 * first and the book row second; creations lock only the book row, so lock
 * order never forms a cycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanLedgerService {

    private final LoanRepository loanRepository;
    private final BookRepository bookRepository;
    private final UserRepository userRepository;
    private final OverdueLoanQuery overdueLoanQuery;
    private final RowLockTimeout rowLockTimeout;
    private final LoanProperties loanProperties;
    private final LoanMetrics loanMetrics;

    /**
     * Creates an OPEN loan and takes one copy of the book off the shelf.
     *
     * @return the persisted loan
     * @throws NotFoundException if the user or book does not exist
     * @throws com.flagship.library_ledger.error.InvalidDateException if {@code dueDate} is not after {@code loanDate}
     * @throws com.flagship.library_ledger.error.OutOfStockException if no copy is available
     * @throws DuplicateLoanException if duplicate open loans are rejected and one exists
     * @throws com.flagship.library_ledger.error.ConcurrencyConflictException if the book row lock times out
     */
    @Transactional
    public Loan createLoan(Long userId, Long bookId, LocalDate loanDate, LocalDate dueDate) {
        requireId(userId, "User ID");
        requireId(bookId, "Book ID");
        long startTime = System.currentTimeMillis();
        LedgerContext.put(LedgerContext.USER_ID_MDC_KEY, userId);
        LedgerContext.put(LedgerContext.BOOK_ID_MDC_KEY, bookId);

        log.info("Creating loan: loanDate={}, dueDate={}", loanDate, dueDate);

        try {
            if (!userRepository.existsById(userId)) {
                throw NotFoundException.user(userId);
            }
            Loan loan = Loan.open(userId, bookId, loanDate, dueDate);

            rowLockTimeout.apply();
            BookEntity bookEntity = bookRepository.findByIdForUpdate(bookId)
                .orElseThrow(() -> NotFoundException.book(bookId));

            if (loanProperties.isRejectDuplicateOpenLoans()
                    && loanRepository.existsByUserIdAndBookIdAndReturnDateIsNull(userId, bookId)) {
                throw new DuplicateLoanException(userId, bookId);
            }

            Book checkedOut = bookEntity.toDomain().checkOut();
            bookEntity.updateFromDomain(checkedOut);
            bookRepository.saveAndFlush(bookEntity);

            LoanEntity saved = loanRepository.saveAndFlush(LoanEntity.fromDomain(loan));
            LedgerContext.put(LedgerContext.LOAN_ID_MDC_KEY, saved.getId());

            long duration = System.currentTimeMillis() - startTime;
            loanMetrics.recordLoanCreated("success");
            loanMetrics.recordLatency("create", duration);

            log.info("Loan created: availableQuantity={}, duration={}ms",
                checkedOut.getAvailableQuantity(), duration);

            return saved.toDomain();

        } catch (LibraryException e) {
            loanMetrics.recordLoanCreated(e.getCode().name());
            log.warn("Loan creation rejected: code={}, reason={}", e.getCode(), e.getMessage());
            throw e;
        } catch (DataAccessException e) {
            RuntimeException translated = StorageErrors.translate("Loan creation", e);
            loanMetrics.recordLoanCreated(translated instanceof LibraryException le ? le.getCode().name() : "error");
            log.error("Loan creation failed: error={}", e.getMessage());
            throw translated;
        } finally {
            LedgerContext.clear();
        }
    }

    /**
     * Creates a loan due after the configured loan period.
     */
    @Transactional
    public Loan checkout(Long userId, Long bookId, LocalDate loanDate) {
        if (loanDate == null) {
            throw new IllegalArgumentException("Loan date is required");
        }
        return createLoan(userId, bookId, loanDate, loanDate.plusDays(loanProperties.getPeriodDays()));
    }

    /**
     * Closes an OPEN loan and puts its copy back on the shelf.
     *
     * @return the closed loan
     * @throws NotFoundException if the loan does not exist
     * @throws com.flagship.library_ledger.error.AlreadyReturnedException if the loan is already CLOSED
     * @throws com.flagship.library_ledger.error.InvalidDateException if {@code returnDate} is before the loan date
     */
    @Transactional
    public Loan returnLoan(Long loanId, LocalDate returnDate) {
        requireId(loanId, "Loan ID");
        long startTime = System.currentTimeMillis();
        LedgerContext.put(LedgerContext.LOAN_ID_MDC_KEY, loanId);

        log.info("Returning loan: returnDate={}", returnDate);

        try {
            rowLockTimeout.apply();
            LoanEntity loanEntity = loanRepository.findByIdForUpdate(loanId)
                .orElseThrow(() -> NotFoundException.loan(loanId));
            LedgerContext.put(LedgerContext.BOOK_ID_MDC_KEY, loanEntity.getBookId());
            LedgerContext.put(LedgerContext.USER_ID_MDC_KEY, loanEntity.getUserId());

            Loan closed = loanEntity.toDomain().close(returnDate);

            BookEntity bookEntity = bookRepository.findByIdForUpdate(loanEntity.getBookId())
                .orElseThrow(() -> NotFoundException.book(loanEntity.getBookId()));
            Book checkedIn = bookEntity.toDomain().checkIn();
            bookEntity.updateFromDomain(checkedIn);

            loanEntity.updateFromDomain(closed);
            loanRepository.saveAndFlush(loanEntity);
            bookRepository.saveAndFlush(bookEntity);

            long duration = System.currentTimeMillis() - startTime;
            loanMetrics.recordLoanReturned("success");
            loanMetrics.recordLatency("return", duration);

            log.info("Loan returned: availableQuantity={}, overdue={}, duration={}ms",
                checkedIn.getAvailableQuantity(), closed.getDueDate().isBefore(returnDate), duration);

            return closed;

        } catch (LibraryException e) {
            loanMetrics.recordLoanReturned(e.getCode().name());
            log.warn("Loan return rejected: code={}, reason={}", e.getCode(), e.getMessage());
            throw e;
        } catch (DataAccessException e) {
            RuntimeException translated = StorageErrors.translate("Loan return", e);
            loanMetrics.recordLoanReturned(translated instanceof LibraryException le ? le.getCode().name() : "error");
            log.error("Loan return failed: error={}", e.getMessage());
            throw translated;
        } finally {
            LedgerContext.clear();
        }
    }

    /**
     * Lists OPEN loans due strictly before {@code asOf}, by due date then loan id.
     *
     * Nothing is read until the result is iterated, and each iteration starts over.
     */
    public OverdueLoans listOverdue(LocalDate asOf) {
        return new OverdueLoans(asOf, loanProperties.getOverduePageSize(), overdueLoanQuery);
    }

    @Transactional(readOnly = true)
    public Optional<Loan> findLoan(Long loanId) {
        return loanRepository.findById(loanId).map(LoanEntity::toDomain);
    }

    /**
     * Loan history of one user, most recent loan date first.
     */
    @Transactional(readOnly = true)
    public List<Loan> listLoansForUser(Long userId, boolean openOnly) {
        List<LoanEntity> loans = openOnly
            ? loanRepository.findByUserIdAndReturnDateIsNullOrderByLoanDateDescIdDesc(userId)
            : loanRepository.findByUserIdOrderByLoanDateDescIdDesc(userId);
        return loans.stream().map(LoanEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public List<Loan> listLoans(boolean openOnly) {
        List<LoanEntity> loans = openOnly
            ? loanRepository.findByReturnDateIsNullOrderByLoanDateDescIdDesc()
            : loanRepository.findAllByOrderByLoanDateDescIdDesc();
        return loans.stream().map(LoanEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public long countOpenLoans() {
        return loanRepository.countByReturnDateIsNull();
    }

    @Transactional(readOnly = true)
    public long countOverdue(LocalDate asOf) {
        return loanRepository.countByReturnDateIsNullAndDueDateBefore(asOf);
    }

    private static void requireId(Long id, String name) {
        if (id == null) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
