package com.flagship.library_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Paging behaviour of {@link OverdueLoans} against an in-memory page source
 * that applies the same filter, order and keyset cursor as the SQL query.
 */
class OverdueLoansTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 1, 15);

    private final List<Loan> table = new ArrayList<>();
    private final AtomicInteger fetches = new AtomicInteger();

    private final OverdueLoans.PageSource source = (asOf, after, limit) -> {
        fetches.incrementAndGet();
        Comparator<Loan> order = Comparator.comparing(Loan::getDueDate).thenComparing(Loan::getId);
        return table.stream()
            .filter(Loan::isOpen)
            .filter(l -> l.getDueDate().isBefore(asOf))
            .filter(l -> after == null || order.compare(l, after) > 0)
            .sorted(order)
            .limit(limit)
            .toList();
    };

    private Loan loan(long id, LocalDate due, LocalDate returned) {
        return new Loan(id, 1L, 1L, due.minusDays(14), due, returned);
    }

    @Test
    @DisplayName("Orders by due date then loan id and skips closed or not-yet-due loans")
    void testOrderingAndFilter() {
        table.add(loan(5, LocalDate.of(2024, 1, 10), null));
        table.add(loan(3, LocalDate.of(2024, 1, 10), null));
        table.add(loan(9, LocalDate.of(2024, 1, 2), null));
        table.add(loan(4, LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 4)));
        table.add(loan(6, AS_OF, null));
        table.add(loan(7, LocalDate.of(2024, 2, 1), null));

        List<Long> ids = new OverdueLoans(AS_OF, 2, source).stream().map(Loan::getId).toList();

        assertEquals(List.of(9L, 3L, 5L), ids);
    }

    @Test
    @DisplayName("Nothing is fetched until iteration starts")
    void testLazy() {
        table.add(loan(1, LocalDate.of(2024, 1, 1), null));

        OverdueLoans overdue = new OverdueLoans(AS_OF, 10, source);
        assertEquals(0, fetches.get());

        overdue.iterator().hasNext();
        assertEquals(1, fetches.get());
    }

    @Test
    @DisplayName("Pages through more rows than the page size")
    void testPaging() {
        for (long id = 1; id <= 7; id++) {
            table.add(loan(id, LocalDate.of(2024, 1, 1).plusDays(id % 3), null));
        }

        List<Loan> result = new OverdueLoans(AS_OF, 3, source).stream().toList();

        assertEquals(7, result.size());
        assertEquals(3, fetches.get(), "Pages of 3, 3 and 1 rows");
        for (int i = 1; i < result.size(); i++) {
            Loan prev = result.get(i - 1);
            Loan cur = result.get(i);
            assertTrue(prev.getDueDate().isBefore(cur.getDueDate())
                || (prev.getDueDate().equals(cur.getDueDate()) && prev.getId() < cur.getId()));
        }
    }

    @Test
    @DisplayName("Each iterator restarts and sees the current table")
    void testRestartable() {
        table.add(loan(1, LocalDate.of(2024, 1, 1), null));
        table.add(loan(2, LocalDate.of(2024, 1, 2), null));
        OverdueLoans overdue = new OverdueLoans(AS_OF, 10, source);

        assertEquals(2, overdue.stream().count());
        assertEquals(2, overdue.stream().count());

        table.set(0, table.get(0).close(LocalDate.of(2024, 1, 14)));
        assertEquals(List.of(2L), overdue.stream().map(Loan::getId).toList());
    }

    @Test
    @DisplayName("Exhausted iterator throws NoSuchElementException")
    void testExhausted() {
        Iterator<Loan> iterator = new OverdueLoans(AS_OF, 5, source).iterator();

        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    @DisplayName("Rejects missing reference date and non-positive page size")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new OverdueLoans(null, 5, source));
        assertThrows(IllegalArgumentException.class, () -> new OverdueLoans(AS_OF, 0, source));
    }
}
