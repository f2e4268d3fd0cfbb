package com.flagship.library_ledger.ledger;

import java.time.LocalDate;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Open loans due strictly before a reference date, ordered by due date then loan id.
 *
 * Lazy: rows are pulled one page at a time as the iterator advances.
 * Restartable: each call to {@link #iterator()} starts again from the first row
 * and sees the table as it is at that moment. Finite: iteration ends after the
 * first short page.
 *
 * Paging is keyset-based on {@code (due_date, loan_id)}, so a loan returned
 * mid-iteration never causes a row to be skipped or repeated.
 */
public class OverdueLoans implements Iterable<Loan> {

    /**
     * Fetches up to {@code limit} overdue loans ordered after {@code after},
     * or from the start when {@code after} is null.
     */
    @FunctionalInterface
    public interface PageSource {
        List<Loan> fetch(LocalDate asOf, Loan after, int limit);
    }

    private final LocalDate asOf;
    private final int pageSize;
    private final PageSource source;

    public OverdueLoans(LocalDate asOf, int pageSize, PageSource source) {
        if (asOf == null) {
            throw new IllegalArgumentException("Reference date is required");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.asOf = asOf;
        this.pageSize = pageSize;
        this.source = source;
    }

    public LocalDate getAsOf() {
        return asOf;
    }

    @Override
    public Iterator<Loan> iterator() {
        return new PageIterator();
    }

    public Stream<Loan> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private class PageIterator implements Iterator<Loan> {

        private List<Loan> page = List.of();
        private int position;
        private Loan last;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (position < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            page = source.fetch(asOf, last, pageSize);
            position = 0;
            if (page.size() < pageSize) {
                exhausted = true;
            }
            return !page.isEmpty();
        }

        @Override
        public Loan next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            last = page.get(position++);
            return last;
        }
    }
}
