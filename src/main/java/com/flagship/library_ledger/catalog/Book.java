package com.flagship.library_ledger.catalog;

import com.flagship.library_ledger.error.ActiveLoansException;
import com.flagship.library_ledger.error.OutOfStockException;
import lombok.Value;

import java.time.Instant;

/**
 * Book domain object.
 *
 * Invariant: {@code 0 <= availableQuantity <= quantity}. Every copy change goes
 * through {@link #checkOut()}, {@link #checkIn()} or {@link #revise}, which
 * return a new instance and reject moves that would break the invariant.
 */
@Value
public class Book {
    Long id;
    String title;
    String author;
    String isbn;
    int quantity;
    int availableQuantity;
    Instant addedAt;

    /**
     * Creates a new catalog entry with every copy available.
     */
    public static Book add(String title, String author, String isbn, int quantity) {
        requireText(title, "Title");
        requireText(author, "Author");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be a positive integer");
        }
        return new Book(null, title.trim(), author.trim(), normalizeIsbn(isbn), quantity, quantity, null);
    }

    /**
     * Takes one copy off the shelf.
     *
     * @throws OutOfStockException if no copy is available
     */
    public Book checkOut() {
        if (availableQuantity <= 0) {
            throw new OutOfStockException(id);
        }
        return new Book(id, title, author, isbn, quantity, availableQuantity - 1, addedAt);
    }

    /**
     * Puts one copy back, never beyond the total quantity.
     */
    public Book checkIn() {
        int restored = Math.min(availableQuantity + 1, quantity);
        return new Book(id, title, author, isbn, quantity, restored, addedAt);
    }

    /**
     * Applies catalog edits. Null arguments keep the current value. A change in
     * total quantity shifts the available count by the same amount.
     *
     * @throws ActiveLoansException if the new quantity is below the copies on loan
     */
    public Book revise(String newTitle, String newAuthor, String newIsbn, Integer newQuantity) {
        String title = isBlank(newTitle) ? this.title : newTitle.trim();
        String author = isBlank(newAuthor) ? this.author : newAuthor.trim();
        String isbn = isBlank(newIsbn) ? this.isbn : newIsbn.trim();
        int quantity = newQuantity == null ? this.quantity : newQuantity;
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative");
        }

        int available = availableQuantity + (quantity - this.quantity);
        if (available < 0) {
            throw new ActiveLoansException(String.format(
                "Cannot reduce quantity of book %d to %d while %d copies are on loan",
                id, quantity, copiesOnLoan()));
        }
        return new Book(id, title, author, isbn, quantity, Math.min(available, quantity), addedAt);
    }

    public int copiesOnLoan() {
        return quantity - availableQuantity;
    }

    private static void requireText(String value, String field) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static String normalizeIsbn(String isbn) {
        return isBlank(isbn) ? null : isbn.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
