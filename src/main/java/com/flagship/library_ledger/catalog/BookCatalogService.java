package com.flagship.library_ledger.catalog;

import com.flagship.library_ledger.config.RowLockTimeout;
import com.flagship.library_ledger.error.ActiveLoansException;
import com.flagship.library_ledger.error.DuplicateBookException;
import com.flagship.library_ledger.error.NotFoundException;
import com.flagship.library_ledger.error.StorageErrors;
import com.flagship.library_ledger.ledger.LoanRepository;
import com.flagship.library_ledger.observability.LedgerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Catalog maintenance for books.
 *
 * Edits that touch quantities take the same book row lock as the loan ledger,
 * so a quantity change can never interleave with a checkout or return.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookCatalogService {

    private final BookRepository bookRepository;
    private final LoanRepository loanRepository;
    private final RowLockTimeout rowLockTimeout;

    /**
     * Adds a book with every copy available.
     *
     * @throws DuplicateBookException if a book with the same title and author exists
     * @throws com.flagship.library_ledger.error.ConstraintViolationException if the ISBN is taken
     */
    @Transactional
    public Book addBook(String title, String author, String isbn, int quantity) {
        Book book = Book.add(title, author, isbn, quantity);

        Optional<BookEntity> existing = bookRepository.findFirstByTitleAndAuthor(book.getTitle(), book.getAuthor());
        if (existing.isPresent()) {
            throw new DuplicateBookException(book.getTitle(), book.getAuthor(), existing.get().getId());
        }

        try {
            BookEntity saved = bookRepository.saveAndFlush(BookEntity.fromDomain(book));
            log.info("Book added: bookId={}, title='{}', quantity={}", saved.getId(), saved.getTitle(), quantity);
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw StorageErrors.translate("Adding book '" + book.getTitle() + "'", e);
        }
    }

    /**
     * Updates book details. Null or blank arguments keep the current value.
     *
     * @throws NotFoundException if the book does not exist
     * @throws ActiveLoansException if the new quantity is below the copies on loan
     */
    @Transactional
    public Book updateBook(Long bookId, String title, String author, String isbn, Integer quantity) {
        LedgerContext.put(LedgerContext.BOOK_ID_MDC_KEY, bookId);
        try {
            BookEntity entity = lockBook(bookId);
            Book revised = entity.toDomain().revise(title, author, isbn, quantity);
            entity.updateFromDomain(revised);
            bookRepository.saveAndFlush(entity);

            log.info("Book updated: quantity={}, availableQuantity={}",
                revised.getQuantity(), revised.getAvailableQuantity());
            return revised;
        } catch (DataAccessException e) {
            throw StorageErrors.translate("Updating book " + bookId, e);
        } finally {
            LedgerContext.clear();
        }
    }

    /**
     * Deletes a book that has no copies on loan. Its closed loan history is
     * removed with it by the schema's cascade.
     *
     * @throws NotFoundException if the book does not exist
     * @throws ActiveLoansException if any copy is on loan
     */
    @Transactional
    public void deleteBook(Long bookId) {
        LedgerContext.put(LedgerContext.BOOK_ID_MDC_KEY, bookId);
        try {
            BookEntity entity = lockBook(bookId);
            long openLoans = loanRepository.countByBookIdAndReturnDateIsNull(bookId);
            if (openLoans > 0 || entity.toDomain().copiesOnLoan() > 0) {
                throw new ActiveLoansException(String.format(
                    "Cannot delete book '%s' as it has %d active loans", entity.getTitle(), openLoans));
            }
            bookRepository.delete(entity);
            bookRepository.flush();
            log.info("Book deleted: title='{}'", entity.getTitle());
        } catch (DataAccessException e) {
            throw StorageErrors.translate("Deleting book " + bookId, e);
        } finally {
            LedgerContext.clear();
        }
    }

    /**
     * Case-insensitive substring search over title, author and ISBN, combined
     * with AND and ordered by title. With no criteria, lists the whole catalog.
     */
    @Transactional(readOnly = true)
    public List<Book> searchBooks(String titleFragment, String authorFragment, String isbnFragment) {
        String title = normalize(titleFragment);
        String author = normalize(authorFragment);
        String isbn = normalize(isbnFragment);
        if (title.isEmpty() && author.isEmpty() && isbn.isEmpty()) {
            return listBooks();
        }
        return bookRepository.search(title, author, isbn).stream()
            .map(BookEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Book> listBooks() {
        return bookRepository.findAllByOrderByTitleAsc().stream()
            .map(BookEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Book> findBook(Long bookId) {
        return bookRepository.findById(bookId).map(BookEntity::toDomain);
    }

    private BookEntity lockBook(Long bookId) {
        if (bookId == null) {
            throw new IllegalArgumentException("Book ID is required");
        }
        rowLockTimeout.apply();
        return bookRepository.findByIdForUpdate(bookId)
            .orElseThrow(() -> NotFoundException.book(bookId));
    }

    private static String normalize(String fragment) {
        return fragment == null ? "" : fragment.trim();
    }
}
