package com.spinbet.ledgersync.gql;

import com.spinbet.ledgersync.gql.payload.ContractEventLogPayload;
import com.spinbet.ledgersync.gql.payload.ListenerStatusPayload;
import com.spinbet.ledgersync.modules.chains.model.ContractEventCheckpoint;
import com.spinbet.ledgersync.modules.chains.model.ContractEventLog;
import com.spinbet.ledgersync.modules.chains.model.ListenerSnapshot;
import com.spinbet.ledgersync.service.ContractEventMonitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Controller
@RequiredArgsConstructor
public class QueryResolver {

    private final ContractEventMonitorService monitorService;

    @QueryMapping
    public ListenerStatusPayload contractEventListenerStatus() {
        ListenerSnapshot snapshot = monitorService.snapshot();
        ContractEventCheckpoint checkpoint = monitorService.checkpoint();

        ListenerStatusPayload.ListenerStatusPayloadBuilder builder = ListenerStatusPayload.builder()
                .enabled(snapshot.isEnabled())
                .contractId(snapshot.getContractId())
                .cursor(snapshot.getCursor())
                .lastLedger(snapshot.getLastLedger())
                .reconnectAttempts(snapshot.getReconnectAttempts())
                .polling(snapshot.isPolling());
        if (checkpoint != null) {
            builder.reconnectCount(checkpoint.getReconnectCount())
                    .totalProcessed(checkpoint.getTotalProcessed())
                    .totalSkipped(checkpoint.getTotalSkipped())
                    .totalFailed(checkpoint.getTotalFailed())
                    .lastError(checkpoint.getLastError())
                    .lastPolledAt(format(checkpoint.getLastPolledAt()))
                    .lastEventAt(format(checkpoint.getLastEventAt()));
        }
        return builder.build();
    }

    @QueryMapping
    public List<ContractEventLogPayload> contractEventLogs(@Argument String status, @Argument Integer limit) {
        try {
            return monitorService.recentLogs(status, limit).stream()
                    .map(this::toPayload)
                    .collect(Collectors.toList());
        } catch (IllegalArgumentException e) {
            log.warn("contractEventLogs called with unknown status {}", status);
            return List.of();
        }
    }

    private ContractEventLogPayload toPayload(ContractEventLog eventLog) {
        return ContractEventLogPayload.builder()
                .id(eventLog.getId())
                .eventId(eventLog.getEventId())
                .eventType(eventLog.getEventType() != null ? eventLog.getEventType().getValue() : null)
                .ledger(eventLog.getLedger())
                .txHash(eventLog.getTxHash())
                .status(eventLog.getStatus() != null ? eventLog.getStatus().name() : null)
                .attempts(eventLog.getAttempts())
                .errorMessage(eventLog.getErrorMessage())
                .topics(eventLog.getTopics())
                .processedAt(format(eventLog.getProcessedAt()))
                .createdAt(format(eventLog.getCreatedAt()))
                .build();
    }

    private static String format(LocalDateTime value) {
        return value != null ? value.toString() : null;
    }
}
