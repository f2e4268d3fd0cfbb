package com.flagship.library_ledger.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * JPA entity for the {@code books} table.
 *
 * Quantities are only written through {@link #updateFromDomain(Book)}, so the
 * availability rules in {@link Book} cannot be bypassed with setters.
 */
@Entity
@Table(
    name = "books",
    indexes = {
        @Index(name = "idx_books_title", columnList = "title"),
        @Index(name = "idx_books_author", columnList = "author"),
        @Index(name = "idx_books_isbn", columnList = "isbn")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BookEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "book_id", nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false)
    private String author;

    @Column(unique = true, length = 20)
    private String isbn;

    @Column(nullable = false)
    private int quantity;

    @Column(name = "available_quantity", nullable = false)
    private int availableQuantity;

    @Column(name = "added_at", nullable = false, updatable = false)
    private Instant addedAt;

    @PrePersist
    void onCreate() {
        if (this.addedAt == null) {
            this.addedAt = Instant.now();
        }
    }

    static BookEntity fromDomain(Book book) {
        return new BookEntity(
            null, // id - assigned by the identity column
            book.getTitle(),
            book.getAuthor(),
            book.getIsbn(),
            book.getQuantity(),
            book.getAvailableQuantity(),
            null  // addedAt - set by @PrePersist
        );
    }

    public Book toDomain() {
        return new Book(id, title, author, isbn, quantity, availableQuantity, addedAt);
    }

    public void updateFromDomain(Book book) {
        if (!Objects.equals(id, book.getId())) {
            throw new IllegalArgumentException(
                "Cannot apply book " + book.getId() + " to entity " + id);
        }
        this.title = book.getTitle();
        this.author = book.getAuthor();
        this.isbn = book.getIsbn();
        this.quantity = book.getQuantity();
        this.availableQuantity = book.getAvailableQuantity();
    }
}
