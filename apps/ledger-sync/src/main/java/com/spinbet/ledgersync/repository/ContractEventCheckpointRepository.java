package com.spinbet.ledgersync.repository;

import com.spinbet.ledgersync.modules.chains.model.ContractEventCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the listener checkpoint row
 */
@Repository
public interface ContractEventCheckpointRepository extends JpaRepository<ContractEventCheckpoint, String> {
}
