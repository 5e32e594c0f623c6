package com.spinbet.ledgersync.modules.chains.events;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spinbet.ledgersync.config.ContractEventsProperties;
import com.spinbet.ledgersync.modules.chains.model.ContractEventLog;
import com.spinbet.ledgersync.modules.chains.model.ContractEventStatus;
import com.spinbet.ledgersync.modules.chains.model.ContractEventType;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.repository.ContractEventLogRepository;
import com.spinbet.ledgersync.service.CheckpointService;
import com.spinbet.ledgersync.util.RetryUtils;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies normalized contract events exactly once.
 *
 * <p>Each attempt runs in one database transaction: the event log row is looked up by event id
 * (terminal rows short-circuit to skipped), upserted as pending, dispatched to the handler for its
 * type and finalized. Domain events returned by the handler are published only after commit.
 * Failed attempts are retried with capped backoff; when the budget is exhausted the row is marked
 * failed and {@link EventProcessingException} is thrown.
 */
@Slf4j
@Component
public class ContractEventProcessor {

    static final String UNKNOWN_EVENT_REASON = "Unknown or unsupported event type";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ContractEventLogRepository eventLogRepository;
    private final EventClassifier classifier;
    private final Map<ContractEventType, ContractEventHandler> handlers;
    private final TransactionTemplate transactionTemplate;
    private final PostCommitPublisher postCommitPublisher;
    private final CheckpointService checkpointService;
    private final ContractEventsProperties properties;
    private final ObjectMapper objectMapper;
    private final Tracer tracer;
    private final RetryUtils.Sleeper sleeper;

    @Autowired
    public ContractEventProcessor(ContractEventLogRepository eventLogRepository,
                                  EventClassifier classifier,
                                  List<ContractEventHandler> handlers,
                                  TransactionTemplate transactionTemplate,
                                  PostCommitPublisher postCommitPublisher,
                                  CheckpointService checkpointService,
                                  ContractEventsProperties properties,
                                  ObjectMapper objectMapper,
                                  Tracer tracer) {
        this(eventLogRepository, classifier, handlers, transactionTemplate, postCommitPublisher,
                checkpointService, properties, objectMapper, tracer, RetryUtils.Sleeper.THREAD_SLEEP);
    }

    ContractEventProcessor(ContractEventLogRepository eventLogRepository,
                           EventClassifier classifier,
                           List<ContractEventHandler> handlers,
                           TransactionTemplate transactionTemplate,
                           PostCommitPublisher postCommitPublisher,
                           CheckpointService checkpointService,
                           ContractEventsProperties properties,
                           ObjectMapper objectMapper,
                           Tracer tracer,
                           RetryUtils.Sleeper sleeper) {
        this.eventLogRepository = eventLogRepository;
        this.classifier = classifier;
        this.handlers = indexHandlers(handlers);
        this.transactionTemplate = transactionTemplate;
        this.postCommitPublisher = postCommitPublisher;
        this.checkpointService = checkpointService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.tracer = tracer;
        this.sleeper = sleeper;
    }

    /**
     * Apply one event with bounded retries.
     *
     * @return {@code PROCESSED} or {@code SKIPPED}
     * @throws EventProcessingException when every attempt failed
     */
    public ContractEventStatus process(NormalizedContractEvent event) {
        ContractEventType type = classifier.classify(event);
        try {
            return RetryUtils.executeWithRetry(
                    () -> applyOnce(event, type),
                    properties.getProcessingRetryAttempts(),
                    properties.getProcessingRetryBaseDelayMs(),
                    properties.getProcessingRetryMaxDelayMs(),
                    sleeper);
        } catch (Exception e) {
            log.error("Contract event {} ({}) failed after {} attempts: {}",
                    event.getId(), type.getValue(), properties.getProcessingRetryAttempts(), e.getMessage());
            markEventFailed(event, type, e);
            throw new EventProcessingException(event.getId(), e);
        }
    }

    private ContractEventStatus applyOnce(NormalizedContractEvent event, ContractEventType type) {
        Span span = tracer.spanBuilder("ContractEventProcessor.apply")
                .setAttribute("event.id", event.getId())
                .setAttribute("event.type", type.getValue())
                .setAttribute("ledger", event.getLedger())
                .startSpan();
        try {
            AppliedEvent applied = transactionTemplate.execute(status -> applyInTransaction(event, type));
            if (applied == null) {
                throw new IllegalStateException("Transaction returned no result for event " + event.getId());
            }
            postCommitPublisher.publish(applied.postCommitEvents);
            return applied.status;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    private AppliedEvent applyInTransaction(NormalizedContractEvent event, ContractEventType type) {
        ContractEventLog existing = eventLogRepository.findByEventId(event.getId()).orElse(null);
        if (existing != null && existing.isTerminal()) {
            log.debug("Contract event {} already {}, skipping", event.getId(), existing.getStatus());
            return new AppliedEvent(ContractEventStatus.SKIPPED, Collections.emptyList());
        }

        ContractEventLog eventLog = existing != null ? existing : newLog(event);
        copyEventFields(eventLog, event);
        eventLog.setEventType(type);
        eventLog.setStatus(ContractEventStatus.PENDING);
        eventLog.setAttempts(attemptsOf(eventLog) + 1);
        eventLog.setErrorMessage(null);
        eventLogRepository.save(eventLog);

        ContractEventHandler handler = handlers.get(type);
        EventHandlingResult result;
        if (handler == null) {
            log.warn("Skipping unclassified contract event {} (topics={})", event.getId(), event.getTopics());
            result = EventHandlingResult.skipped(UNKNOWN_EVENT_REASON);
        } else {
            result = handler.handle(event);
        }

        if (result.isSkipped()) {
            log.warn("Skipped contract event {} ({}): {}", event.getId(), type.getValue(), result.getReason());
        }

        eventLog.setStatus(result.getOutcome());
        eventLog.setErrorMessage(result.getReason());
        eventLog.setProcessedAt(LocalDateTime.now());
        eventLogRepository.save(eventLog);

        return new AppliedEvent(result.getOutcome(), result.getPostCommitEvents());
    }

    /**
     * Record the exhausted event as failed in its own transaction and count it on the checkpoint.
     */
    private void markEventFailed(NormalizedContractEvent event, ContractEventType type, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                ContractEventLog eventLog = eventLogRepository.findByEventId(event.getId())
                        .orElseGet(() -> newLog(event));
                copyEventFields(eventLog, event);
                eventLog.setEventType(type);
                eventLog.setStatus(ContractEventStatus.FAILED);
                eventLog.setAttempts(attemptsOf(eventLog) + 1);
                eventLog.setErrorMessage(message);
                eventLog.setProcessedAt(LocalDateTime.now());
                eventLogRepository.save(eventLog);
            });
            checkpointService.recordEventFailure(message);
        } catch (RuntimeException e) {
            log.error("Could not record failure of contract event {}: {}", event.getId(), e.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    private ContractEventLog newLog(NormalizedContractEvent event) {
        return ContractEventLog.builder()
                .eventId(event.getId())
                .build();
    }

    /**
     * Refresh the row from the delivered event. A retried row takes the latest cursor and payload.
     */
    private void copyEventFields(ContractEventLog eventLog, NormalizedContractEvent event) {
        eventLog.setLedger(event.getLedger());
        eventLog.setTxHash(event.getTxHash());
        eventLog.setCursor(event.getCursor());
        eventLog.setTopics(event.getTopics() != null ? new ArrayList<>(event.getTopics()) : new ArrayList<>());
        eventLog.setPayload(event.getPayload() != null
                ? objectMapper.convertValue(event.getPayload(), PAYLOAD_TYPE)
                : Collections.emptyMap());
    }

    private static int attemptsOf(ContractEventLog eventLog) {
        return eventLog.getAttempts() != null ? eventLog.getAttempts() : 0;
    }

    private static Map<ContractEventType, ContractEventHandler> indexHandlers(List<ContractEventHandler> handlers) {
        Map<ContractEventType, ContractEventHandler> index = new EnumMap<>(ContractEventType.class);
        for (ContractEventHandler handler : handlers) {
            ContractEventHandler previous = index.put(handler.supports(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for event type " + handler.supports()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        return index;
    }

    private static final class AppliedEvent {

        private final ContractEventStatus status;
        private final List<Object> postCommitEvents;

        private AppliedEvent(ContractEventStatus status, List<Object> postCommitEvents) {
            this.status = status;
            this.postCommitEvents = postCommitEvents;
        }
    }
}
