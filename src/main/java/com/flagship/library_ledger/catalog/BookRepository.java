package com.flagship.library_ledger.catalog;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BookRepository extends JpaRepository<BookEntity, Long> {

    /**
     * Loads a book with {@code SELECT ... FOR UPDATE}. Every read-modify-write of
     * {@code available_quantity} starts here, so concurrent loans of the same
     * book are serialized on this row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BookEntity b WHERE b.id = :id")
    Optional<BookEntity> findByIdForUpdate(@Param("id") Long id);

    Optional<BookEntity> findFirstByTitleAndAuthor(String title, String author);

    List<BookEntity> findAllByOrderByTitleAsc();

    /**
     * Case-insensitive substring search. An empty fragment matches everything.
     */
    @Query("""
        SELECT b FROM BookEntity b
        WHERE (:title = '' OR LOWER(b.title) LIKE LOWER(CONCAT('%', :title, '%')))
          AND (:author = '' OR LOWER(b.author) LIKE LOWER(CONCAT('%', :author, '%')))
          AND (:isbn = '' OR LOWER(b.isbn) LIKE LOWER(CONCAT('%', :isbn, '%')))
        ORDER BY b.title ASC
        """)
    List<BookEntity> search(@Param("title") String title,
                            @Param("author") String author,
                            @Param("isbn") String isbn);
}
