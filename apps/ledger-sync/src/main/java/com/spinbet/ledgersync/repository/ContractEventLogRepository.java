package com.spinbet.ledgersync.repository;

import com.spinbet.ledgersync.modules.chains.model.ContractEventLog;
import com.spinbet.ledgersync.modules.chains.model.ContractEventStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for contract event logs
 */
@Repository
public interface ContractEventLogRepository extends JpaRepository<ContractEventLog, String> {

    /**
     * Find log by contract event id (idempotency check)
     */
    Optional<ContractEventLog> findByEventId(String eventId);

    /**
     * Recent logs, newest first
     */
    List<ContractEventLog> findAllByOrderByCreatedAtDesc(Pageable pageable);

    /**
     * Recent logs in a status, newest first
     */
    List<ContractEventLog> findByStatusOrderByCreatedAtDesc(ContractEventStatus status, Pageable pageable);

    long countByStatus(ContractEventStatus status);
}
