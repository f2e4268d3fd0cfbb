package com.flagship.library_ledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface LoanRepository extends JpaRepository<LoanEntity, Long> {

    /**
     * Locks the loan row so two concurrent returns cannot both see it OPEN.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LoanEntity l WHERE l.id = :id")
    Optional<LoanEntity> findByIdForUpdate(@Param("id") Long id);

    boolean existsByUserIdAndBookIdAndReturnDateIsNull(Long userId, Long bookId);

    long countByUserIdAndReturnDateIsNull(Long userId);

    long countByBookIdAndReturnDateIsNull(Long bookId);

    long countByReturnDateIsNull();

    long countByReturnDateIsNullAndDueDateBefore(LocalDate asOf);

    List<LoanEntity> findByUserIdOrderByLoanDateDescIdDesc(Long userId);

    List<LoanEntity> findByUserIdAndReturnDateIsNullOrderByLoanDateDescIdDesc(Long userId);

    List<LoanEntity> findAllByOrderByLoanDateDescIdDesc();

    List<LoanEntity> findByReturnDateIsNullOrderByLoanDateDescIdDesc();
}
