package com.spinbet.ledgersync.modules.chains.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spinbet.ledgersync.config.ContractEventsProperties;
import com.spinbet.ledgersync.config.StellarRpcProperties;
import com.spinbet.ledgersync.modules.chains.model.ContractEventCheckpoint;
import com.spinbet.ledgersync.modules.chains.model.ContractEventLog;
import com.spinbet.ledgersync.modules.chains.model.ContractEventStatus;
import com.spinbet.ledgersync.modules.chains.model.ContractEventType;
import com.spinbet.ledgersync.modules.chains.model.EventPage;
import com.spinbet.ledgersync.modules.chains.model.EventQuery;
import com.spinbet.ledgersync.modules.chains.model.ListenerSnapshot;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.modules.chains.rpc.ContractEventSource;
import com.spinbet.ledgersync.modules.chains.rpc.RetentionWindowException;
import com.spinbet.ledgersync.modules.chains.rpc.RpcException;
import com.spinbet.ledgersync.repository.ContractEventLogRepository;
import com.spinbet.ledgersync.service.CheckpointService;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ContractEventPollerTest {

    private static final String CONTRACT_ID = "CCONTRACT";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ContractEventSource eventSource;
    private ContractEventProcessor processor;
    private CheckpointService checkpointService;
    private ContractEventsProperties properties;
    private StellarRpcProperties stellarProperties;
    private TaskScheduler scheduler;
    private ContractEventCheckpoint checkpoint;

    @BeforeEach
    void setUp() {
        eventSource = mock(ContractEventSource.class);
        processor = mock(ContractEventProcessor.class);
        checkpointService = mock(CheckpointService.class);
        scheduler = mock(TaskScheduler.class);
        properties = new ContractEventsProperties();
        stellarProperties = new StellarRpcProperties();
        stellarProperties.setContractId(CONTRACT_ID);

        checkpoint = ContractEventCheckpoint.builder()
                .id("soroban_contract_listener")
                .cursor("cursor-0")
                .lastLedger(500L)
                .build();
        when(checkpointService.ensureCheckpoint()).thenReturn(checkpoint);
    }

    private ContractEventPoller newPoller() {
        return new ContractEventPoller(eventSource, processor, checkpointService, properties, stellarProperties, scheduler);
    }

    @Test
    void appliesPageInOrderAndAdvancesCheckpoint() {
        NormalizedContractEvent first = event("evt-1", 510L, LocalDateTime.of(2024, 6, 1, 10, 0));
        NormalizedContractEvent second = event("evt-2", 512L, LocalDateTime.of(2024, 6, 1, 10, 5));
        when(eventSource.fetch(any())).thenReturn(new EventPage(List.of(first, second), "cursor-1", 600L));
        when(processor.process(first)).thenReturn(ContractEventStatus.PROCESSED);
        when(processor.process(second)).thenReturn(ContractEventStatus.SKIPPED);

        ContractEventPoller poller = newPoller();
        poller.loadState();

        assertEquals(properties.getPollIntervalMs(), poller.executeCycle());

        ArgumentCaptor<EventQuery> query = ArgumentCaptor.forClass(EventQuery.class);
        verify(eventSource).fetch(query.capture());
        assertEquals("cursor-0", query.getValue().getCursor());
        assertEquals(CONTRACT_ID, query.getValue().getContractId());
        assertEquals(100, query.getValue().getLimit());

        InOrder order = inOrder(processor, checkpointService);
        order.verify(processor).process(first);
        order.verify(processor).process(second);
        order.verify(checkpointService).recordPageApplied("cursor-1", 512L, LocalDateTime.of(2024, 6, 1, 10, 5), 1, 1);

        ListenerSnapshot snapshot = poller.getMonitoringSnapshot();
        assertEquals("cursor-1", snapshot.getCursor());
        assertEquals(512L, snapshot.getLastLedger());
    }

    @Test
    void emptyPageWithBlankCursorKeepsPosition() {
        when(eventSource.fetch(any())).thenReturn(new EventPage(List.of(), "", 600L));

        ContractEventPoller poller = newPoller();
        poller.loadState();
        poller.executeCycle();

        verify(checkpointService).recordPageApplied("cursor-0", 500L, null, 0, 0);
        verifyNoInteractions(processor);
    }

    @Test
    void retentionMissResetsCheckpointThenPagesByHeight() {
        when(eventSource.fetch(any()))
                .thenThrow(new RetentionWindowException("startLedger must be between the oldest ledger: 900 and the latest ledger: 1000"))
                .thenReturn(new EventPage(List.of(), "cursor-new", 1000L));
        when(eventSource.getLatestLedger()).thenReturn(1000L);

        ContractEventPoller poller = newPoller();
        poller.loadState();

        assertEquals(properties.getReconnectBaseDelayMs(), poller.executeCycle());

        verify(checkpointService).resetToLedger(999L, ContractEventPoller.RETENTION_RESET_REASON);
        verify(checkpointService).recordPollFailure(anyString());
        ListenerSnapshot afterReset = poller.getMonitoringSnapshot();
        assertNull(afterReset.getCursor());
        assertEquals(999L, afterReset.getLastLedger());

        poller.executeCycle();

        ArgumentCaptor<EventQuery> queries = ArgumentCaptor.forClass(EventQuery.class);
        verify(eventSource, times(2)).fetch(queries.capture());
        EventQuery heightQuery = queries.getAllValues().get(1);
        assertFalse(heightQuery.hasCursor());
        assertEquals(999L, heightQuery.getStartLedger());
        verify(checkpointService).recordPageApplied("cursor-new", 999L, null, 0, 0);
    }

    @Test
    void reconnectDelayGrowsAndResetsAfterSuccess() {
        when(eventSource.fetch(any()))
                .thenThrow(new RpcException("connection refused"))
                .thenThrow(new RpcException("connection refused"))
                .thenThrow(new RpcException("connection refused"))
                .thenReturn(new EventPage(List.of(), "cursor-0", 600L))
                .thenThrow(new RpcException("connection refused"));

        ContractEventPoller poller = newPoller();
        poller.loadState();

        assertEquals(1_000L, poller.executeCycle());
        assertEquals(2_000L, poller.executeCycle());
        assertEquals(4_000L, poller.executeCycle());
        assertEquals(3, poller.getMonitoringSnapshot().getReconnectAttempts());

        assertEquals(5_000L, poller.executeCycle());
        assertEquals(0, poller.getMonitoringSnapshot().getReconnectAttempts());

        assertEquals(1_000L, poller.executeCycle());
        verify(checkpointService, times(4)).recordPollFailure("connection refused");
        verify(checkpointService, never()).resetToLedger(anyLong(), anyString());
    }

    @Test
    void missingPositionStartsNearLatestLedger() {
        checkpoint.setCursor(null);
        checkpoint.setLastLedger(0L);
        when(eventSource.getLatestLedger()).thenReturn(1000L);
        when(eventSource.fetch(any())).thenReturn(new EventPage(List.of(), null, 1000L));

        ContractEventPoller poller = newPoller();
        poller.loadState();
        poller.executeCycle();

        ArgumentCaptor<EventQuery> query = ArgumentCaptor.forClass(EventQuery.class);
        verify(eventSource).fetch(query.capture());
        assertFalse(query.getValue().hasCursor());
        assertEquals(998L, query.getValue().getStartLedger());
        verify(checkpointService).recordPageApplied(isNull(), eq(998L), isNull(), eq(0), eq(0));
    }

    @Test
    void configuredStartLedgerIsUsedWithoutCheckpointPosition() {
        checkpoint.setCursor(null);
        checkpoint.setLastLedger(0L);
        properties.setStartLedger(42L);
        when(eventSource.fetch(any())).thenReturn(new EventPage(List.of(), null, 1000L));

        ContractEventPoller poller = newPoller();
        poller.loadState();
        poller.executeCycle();

        ArgumentCaptor<EventQuery> query = ArgumentCaptor.forClass(EventQuery.class);
        verify(eventSource).fetch(query.capture());
        assertEquals(42L, query.getValue().getStartLedger());
        verify(eventSource, never()).getLatestLedger();
    }

    @Test
    void partialPageIsRecoveredOnNextCycle() {
        Map<String, ContractEventLog> logs = new HashMap<>();
        ContractEventLogRepository logRepository = mock(ContractEventLogRepository.class);
        when(logRepository.findByEventId(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(logs.get(inv.<String>getArgument(0))));
        when(logRepository.save(any(ContractEventLog.class))).thenAnswer(inv -> {
            ContractEventLog saved = inv.getArgument(0);
            logs.put(saved.getEventId(), saved);
            return saved;
        });

        List<String> applied = new ArrayList<>();
        boolean[] thirdEventHealthy = {false};
        ContractEventHandler handler = new ContractEventHandler() {
            @Override
            public ContractEventType supports() {
                return ContractEventType.STAKING;
            }

            @Override
            public EventHandlingResult handle(NormalizedContractEvent event) {
                if ("evt-3".equals(event.getId()) && !thirdEventHealthy[0]) {
                    throw new IllegalStateException("lock timeout");
                }
                applied.add(event.getId());
                return EventHandlingResult.processed();
            }
        };
        ContractEventProcessor realProcessor = new ContractEventProcessor(
                logRepository,
                new EventClassifier(),
                List.of(handler),
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                new PostCommitPublisher(mock(ApplicationEventPublisher.class)),
                checkpointService,
                properties,
                objectMapper,
                OpenTelemetry.noop().getTracer("test"),
                millis -> { });

        List<NormalizedContractEvent> page = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            page.add(event("evt-" + i, 500L + i, null));
        }
        when(eventSource.fetch(any())).thenReturn(new EventPage(page, "cursor-1", 600L));

        ContractEventPoller poller = new ContractEventPoller(
                eventSource, realProcessor, checkpointService, properties, stellarProperties, scheduler);
        poller.loadState();

        assertEquals(properties.getReconnectBaseDelayMs(), poller.executeCycle());
        assertEquals(List.of("evt-1", "evt-2"), applied);
        assertEquals(ContractEventStatus.FAILED, logs.get("evt-3").getStatus());
        verify(checkpointService, never()).recordPageApplied(any(), anyLong(), any(), anyInt(), anyInt());
        verify(checkpointService).recordEventFailure("lock timeout");
        assertEquals("cursor-0", poller.getMonitoringSnapshot().getCursor());

        thirdEventHealthy[0] = true;
        assertEquals(properties.getPollIntervalMs(), poller.executeCycle());

        assertEquals(List.of("evt-1", "evt-2", "evt-3", "evt-4", "evt-5"), applied);
        ArgumentCaptor<EventQuery> queries = ArgumentCaptor.forClass(EventQuery.class);
        verify(eventSource, times(2)).fetch(queries.capture());
        assertEquals("cursor-0", queries.getAllValues().get(1).getCursor());
        verify(checkpointService).recordPageApplied(eq("cursor-1"), eq(505L), any(), eq(3), eq(2));
    }

    @Test
    void disabledListenerDoesNotSchedule() {
        properties.setEnabled(false);

        ContractEventPoller poller = newPoller();
        poller.start();

        verifyNoInteractions(scheduler);
        assertFalse(poller.getMonitoringSnapshot().isEnabled());
    }

    @Test
    void missingContractIdDoesNotStart() {
        stellarProperties.setContractId(" ");

        ContractEventPoller poller = newPoller();
        poller.start();

        verifyNoInteractions(scheduler);
        verify(checkpointService, never()).ensureCheckpoint();
    }

    @Test
    void startSchedulesFirstCycleAndStopCancelsIt() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).schedule(any(Runnable.class), any(Instant.class));

        ContractEventPoller poller = newPoller();
        poller.start();

        verify(scheduler).schedule(any(Runnable.class), any(Instant.class));
        assertTrue(poller.getMonitoringSnapshot().isEnabled());
        assertEquals("cursor-0", poller.getMonitoringSnapshot().getCursor());

        poller.stop();

        verify(future).cancel(false);
        assertFalse(poller.getMonitoringSnapshot().isEnabled());
    }

    private NormalizedContractEvent event(String id, long ledger, LocalDateTime closedAt) {
        return NormalizedContractEvent.builder()
                .id(id)
                .cursor("cursor-1")
                .ledger(ledger)
                .txHash("tx-" + id)
                .contractId(CONTRACT_ID)
                .topics(List.of("stake"))
                .payload(objectMapper.createObjectNode().put("userId", "user-1").put("amount", "1"))
                .ledgerClosedAt(closedAt)
                .build();
    }
}
