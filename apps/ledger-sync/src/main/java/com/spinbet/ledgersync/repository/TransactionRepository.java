package com.spinbet.ledgersync.repository;

import com.spinbet.ledgersync.entity.Transaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, String> {

    /**
     * Ledger entry dedup check on reference_id.
     */
    boolean existsByReferenceId(String referenceId);
}
