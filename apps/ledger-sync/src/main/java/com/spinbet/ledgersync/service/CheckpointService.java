package com.spinbet.ledgersync.service;

import com.spinbet.ledgersync.config.ContractEventsProperties;
import com.spinbet.ledgersync.modules.chains.model.ContractEventCheckpoint;
import com.spinbet.ledgersync.repository.ContractEventCheckpointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Service for managing the listener checkpoint (cursor, ledger watermark and counters).
 * The row is created lazily and is never deleted.
 */
@Slf4j
@Service
@Transactional
public class CheckpointService {

    private final ContractEventCheckpointRepository checkpointRepository;
    private final String checkpointId;

    public CheckpointService(ContractEventCheckpointRepository checkpointRepository,
                             ContractEventsProperties properties) {
        this.checkpointRepository = checkpointRepository;
        this.checkpointId = properties.getCheckpointId();
    }

    /**
     * Load the checkpoint, creating it at ledger 0 if it does not exist.
     */
    public ContractEventCheckpoint ensureCheckpoint() {
        var existing = checkpointRepository.findById(checkpointId);
        if (existing.isPresent()) {
            return existing.get();
        }

        ContractEventCheckpoint created = ContractEventCheckpoint.builder()
                .id(checkpointId)
                .lastLedger(0L)
                .build();
        log.info("Created contract event checkpoint {}", checkpointId);
        return checkpointRepository.save(created);
    }

    /**
     * Advance cursor and watermark after a fully applied page.
     */
    public void recordPageApplied(String cursor, long lastLedger, LocalDateTime lastEventAt,
                                  int processedDelta, int skippedDelta) {
        ContractEventCheckpoint checkpoint = ensureCheckpoint();
        checkpoint.setCursor(cursor);
        checkpoint.setLastLedger(lastLedger);
        checkpoint.setLastPolledAt(LocalDateTime.now());
        if (lastEventAt != null) {
            checkpoint.setLastEventAt(lastEventAt);
        }
        checkpoint.setLastError(null);
        checkpoint.setTotalProcessed(checkpoint.getTotalProcessed() + processedDelta);
        checkpoint.setTotalSkipped(checkpoint.getTotalSkipped() + skippedDelta);
        checkpointRepository.save(checkpoint);
    }

    /**
     * Record a failed poll cycle. Cursor and watermark are left untouched.
     */
    public void recordPollFailure(String errorMessage) {
        ContractEventCheckpoint checkpoint = ensureCheckpoint();
        checkpoint.setReconnectCount(checkpoint.getReconnectCount() + 1);
        checkpoint.setLastError(errorMessage);
        checkpoint.setLastPolledAt(LocalDateTime.now());
        checkpointRepository.save(checkpoint);
    }

    /**
     * Record an event whose apply retries were exhausted.
     */
    public void recordEventFailure(String errorMessage) {
        ContractEventCheckpoint checkpoint = ensureCheckpoint();
        checkpoint.setTotalFailed(checkpoint.getTotalFailed() + 1);
        checkpoint.setLastError(errorMessage);
        checkpoint.setLastPolledAt(LocalDateTime.now());
        checkpointRepository.save(checkpoint);
    }

    /**
     * Drop the cursor and restart height-based paging from the given ledger.
     */
    public void resetToLedger(long ledger, String reason) {
        ContractEventCheckpoint checkpoint = ensureCheckpoint();
        checkpoint.setCursor(null);
        checkpoint.setLastLedger(ledger);
        checkpoint.setLastPolledAt(LocalDateTime.now());
        checkpoint.setLastError(reason);
        checkpointRepository.save(checkpoint);
    }

    @Transactional(readOnly = true)
    public ContractEventCheckpoint getCheckpoint() {
        return checkpointRepository.findById(checkpointId).orElse(null);
    }
}
