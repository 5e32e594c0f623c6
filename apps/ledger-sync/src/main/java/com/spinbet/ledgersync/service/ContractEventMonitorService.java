package com.spinbet.ledgersync.service;

import com.spinbet.ledgersync.modules.chains.events.ContractEventPoller;
import com.spinbet.ledgersync.modules.chains.model.ContractEventCheckpoint;
import com.spinbet.ledgersync.modules.chains.model.ContractEventLog;
import com.spinbet.ledgersync.modules.chains.model.ContractEventStatus;
import com.spinbet.ledgersync.modules.chains.model.ListenerSnapshot;
import com.spinbet.ledgersync.repository.ContractEventLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Read-only view of the listener for the REST and GraphQL status endpoints.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ContractEventMonitorService {

    static final int DEFAULT_LOG_LIMIT = 50;
    static final int MAX_LOG_LIMIT = 200;

    private final ContractEventPoller poller;
    private final CheckpointService checkpointService;
    private final ContractEventLogRepository eventLogRepository;

    public ListenerSnapshot snapshot() {
        return poller.getMonitoringSnapshot();
    }

    public ContractEventCheckpoint checkpoint() {
        return checkpointService.getCheckpoint();
    }

    /**
     * Most recent event log rows, newest first.
     *
     * @param status optional status filter, case-insensitive
     * @param limit  page size, clamped to 1..200 (default 50)
     * @throws IllegalArgumentException for an unknown status
     */
    public List<ContractEventLog> recentLogs(String status, Integer limit) {
        int size = limit == null ? DEFAULT_LOG_LIMIT : Math.max(1, Math.min(limit, MAX_LOG_LIMIT));
        PageRequest page = PageRequest.of(0, size);
        if (status == null || status.isBlank()) {
            return eventLogRepository.findAllByOrderByCreatedAtDesc(page);
        }
        ContractEventStatus parsed = ContractEventStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        return eventLogRepository.findByStatusOrderByCreatedAtDesc(parsed, page);
    }
}
