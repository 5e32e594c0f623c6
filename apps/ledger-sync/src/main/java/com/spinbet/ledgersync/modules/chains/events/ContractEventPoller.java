package com.spinbet.ledgersync.modules.chains.events;

import com.spinbet.ledgersync.config.ContractEventsProperties;
import com.spinbet.ledgersync.config.StellarRpcProperties;
import com.spinbet.ledgersync.modules.chains.model.ContractEventCheckpoint;
import com.spinbet.ledgersync.modules.chains.model.ContractEventStatus;
import com.spinbet.ledgersync.modules.chains.model.EventPage;
import com.spinbet.ledgersync.modules.chains.model.EventQuery;
import com.spinbet.ledgersync.modules.chains.model.ListenerSnapshot;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.modules.chains.rpc.ContractEventSource;
import com.spinbet.ledgersync.modules.chains.rpc.RetentionWindowException;
import com.spinbet.ledgersync.service.CheckpointService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives contract event ingestion: fetch a page, apply it event by event, advance the checkpoint,
 * schedule the next cycle.
 *
 * <p>The paging position lives in a single {@link PollerState} that a cycle takes out of
 * {@link #state} at its start and puts back at its end; while it is out, a cycle is in flight.
 * Cycles are chained on a single-threaded scheduler, so the next one is only scheduled after the
 * current one has returned.
 */
@Component
public class ContractEventPoller {

    private static final Logger logger = LoggerFactory.getLogger(ContractEventPoller.class);

    static final String RETENTION_RESET_REASON = "Reset checkpoint due to retention window mismatch";

    private final ContractEventSource eventSource;
    private final ContractEventProcessor processor;
    private final CheckpointService checkpointService;
    private final ContractEventsProperties properties;
    private final StellarRpcProperties stellarProperties;
    private final TaskScheduler scheduler;
    private final ReconnectBackoff backoff;

    private final AtomicReference<PollerState> state = new AtomicReference<>();
    private volatile PollerState lastKnownState = new PollerState(null, 0L);
    private volatile boolean running;
    private volatile boolean stopRequested;
    private volatile ScheduledFuture<?> nextCycle;

    public ContractEventPoller(ContractEventSource eventSource,
                               ContractEventProcessor processor,
                               CheckpointService checkpointService,
                               ContractEventsProperties properties,
                               StellarRpcProperties stellarProperties,
                               @Qualifier("contractEventScheduler") TaskScheduler scheduler) {
        this.eventSource = eventSource;
        this.processor = processor;
        this.checkpointService = checkpointService;
        this.properties = properties;
        this.stellarProperties = stellarProperties;
        this.scheduler = scheduler;
        this.backoff = new ReconnectBackoff(properties.getReconnectBaseDelayMs(), properties.getReconnectMaxDelayMs());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    /**
     * Load the checkpoint and schedule the first cycle immediately.
     */
    public synchronized void start() {
        if (!properties.isEnabled()) {
            logger.warn("Contract event listener disabled (contract-events.enabled=false)");
            return;
        }
        if (!stellarProperties.isConfigured()) {
            logger.warn("Contract event listener not started: stellar.rpc-url or stellar.contract-id is not set");
            return;
        }
        if (running) {
            return;
        }

        loadState();
        running = true;
        stopRequested = false;
        PollerState initial = lastKnownState;
        logger.info("Contract event listener started: contract={}, cursor={}, lastLedger={}, interval={}ms",
                stellarProperties.getContractId(), initial.getCursor(), initial.getLastLedger(),
                properties.getPollIntervalMs());
        schedule(0L);
    }

    /**
     * Stop scheduling. A cycle already running is allowed to finish.
     */
    @PreDestroy
    public synchronized void stop() {
        stopRequested = true;
        running = false;
        ScheduledFuture<?> pending = nextCycle;
        if (pending != null) {
            pending.cancel(false);
        }
        logger.info("Contract event listener stopped");
    }

    /**
     * Read cursor and height from the checkpoint into the in-memory state.
     */
    void loadState() {
        ContractEventCheckpoint checkpoint = checkpointService.ensureCheckpoint();
        String cursor = checkpoint.getCursor();
        long lastLedger = checkpoint.getLastLedger() != null ? checkpoint.getLastLedger() : 0L;
        if ((cursor == null || cursor.isBlank()) && lastLedger <= 0 && properties.getStartLedger() > 0) {
            lastLedger = properties.getStartLedger();
        }
        PollerState initial = new PollerState(cursor, lastLedger);
        state.set(initial);
        lastKnownState = initial;
    }

    private void runCycle() {
        long delay;
        try {
            delay = executeCycle();
        } catch (RuntimeException e) {
            logger.error("Unexpected error in contract event poll cycle: {}", e.getMessage(), e);
            delay = backoff.nextDelay();
        }
        if (stopRequested) {
            logger.debug("Stop requested, not scheduling another poll cycle");
            return;
        }
        schedule(delay);
    }

    private void schedule(long delayMs) {
        nextCycle = scheduler.schedule(this::runCycle, Instant.now().plusMillis(delayMs));
    }

    /**
     * Run one poll cycle.
     *
     * @return delay in milliseconds before the next cycle
     */
    long executeCycle() {
        PollerState current = state.getAndSet(null);
        if (current == null) {
            logger.debug("Poll cycle already in flight, skipping");
            return properties.getPollIntervalMs();
        }

        PollerState next = current;
        try {
            next = pollOnce(current);
            backoff.reset();
            return properties.getPollIntervalMs();
        } catch (RetentionWindowException e) {
            logger.warn("Event source rejected paging position (cursor={}, lastLedger={}): {}",
                    current.getCursor(), current.getLastLedger(), e.getMessage());
            recordPollFailure(e);
            next = resetAfterRetentionMiss(current);
            return scheduleReconnect();
        } catch (RuntimeException e) {
            logger.error("Contract event poll failed: {}", e.getMessage(), e);
            recordPollFailure(e);
            return scheduleReconnect();
        } finally {
            lastKnownState = next;
            state.set(next);
        }
    }

    private PollerState pollOnce(PollerState current) {
        PollerState working = current;
        if (!working.hasCursor() && working.getLastLedger() <= 0) {
            long latest = eventSource.getLatestLedger();
            working = working.resetTo(Math.max(1L, latest - 2));
            logger.info("No checkpoint position, starting from ledger {} (latest {})", working.getLastLedger(), latest);
        }

        String contractId = stellarProperties.getContractId();
        EventQuery query = working.hasCursor()
                ? EventQuery.fromCursor(contractId, working.getCursor(), properties.getPageLimit())
                : EventQuery.fromLedger(contractId, working.getLastLedger(), properties.getPageLimit());
        EventPage page = eventSource.fetch(query);

        int processed = 0;
        int skipped = 0;
        long maxLedger = working.getLastLedger();
        LocalDateTime lastEventAt = null;
        for (NormalizedContractEvent event : page.getEvents()) {
            ContractEventStatus outcome;
            try {
                outcome = processor.process(event);
            } catch (EventProcessingException e) {
                logger.error("Aborting page at event {}: processed={}, skipped={}, failed=1",
                        e.getEventId(), processed, skipped);
                throw e;
            }
            if (outcome == ContractEventStatus.PROCESSED) {
                processed++;
            } else {
                skipped++;
            }
            maxLedger = Math.max(maxLedger, event.getLedger());
            lastEventAt = event.getLedgerClosedAt() != null ? event.getLedgerClosedAt() : LocalDateTime.now();
        }

        PollerState next = working.advance(page.getNextCursor(), maxLedger);
        checkpointService.recordPageApplied(next.getCursor(), next.getLastLedger(), lastEventAt, processed, skipped);

        if (!page.getEvents().isEmpty()) {
            logger.info("Applied contract event page: events={}, processed={}, skipped={}, failed=0, cursor={}, lastLedger={}",
                    page.getEvents().size(), processed, skipped, next.getCursor(), next.getLastLedger());
        }
        return next;
    }

    /**
     * Drop the cursor and restart from just below the latest ledger. History older than that is not
     * ingested.
     */
    private PollerState resetAfterRetentionMiss(PollerState current) {
        try {
            long latest = eventSource.getLatestLedger();
            long resetLedger = Math.max(1L, latest - 1);
            checkpointService.resetToLedger(resetLedger, RETENTION_RESET_REASON);
            logger.warn("{}: ledger {} (latest {})", RETENTION_RESET_REASON, resetLedger, latest);
            return current.resetTo(resetLedger);
        } catch (RuntimeException e) {
            logger.error("Could not reset checkpoint after retention miss: {}", e.getMessage(), e);
            return current;
        }
    }

    private long scheduleReconnect() {
        long delay = backoff.nextDelay();
        logger.warn("Reconnect attempt {} scheduled in {}ms", backoff.getAttempts(), delay);
        return delay;
    }

    private void recordPollFailure(RuntimeException failure) {
        try {
            checkpointService.recordPollFailure(failure.getMessage());
        } catch (RuntimeException e) {
            logger.error("Could not record poll failure on checkpoint: {}", e.getMessage(), e);
        }
    }

    public ListenerSnapshot getMonitoringSnapshot() {
        PollerState snapshot = lastKnownState;
        return ListenerSnapshot.builder()
                .enabled(running)
                .contractId(stellarProperties.getContractId())
                .cursor(snapshot.getCursor())
                .lastLedger(snapshot.getLastLedger())
                .reconnectAttempts(backoff.getAttempts())
                .polling(running && state.get() == null)
                .build();
    }
}
