package com.spinbet.ledgersync.modules.chains.events;

import com.spinbet.ledgersync.modules.chains.model.ContractEventStatus;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of applying one event: processed or skipped, an optional reason, and the domain events to
 * publish once the transaction has committed.
 */
@Getter
public class EventHandlingResult {

    private final ContractEventStatus outcome;
    private final String reason;
    private final List<Object> postCommitEvents;

    private EventHandlingResult(ContractEventStatus outcome, String reason, List<Object> postCommitEvents) {
        this.outcome = outcome;
        this.reason = reason;
        this.postCommitEvents = postCommitEvents;
    }

    public static EventHandlingResult processed(List<Object> postCommitEvents) {
        return new EventHandlingResult(ContractEventStatus.PROCESSED, null,
                postCommitEvents == null ? Collections.emptyList() : List.copyOf(postCommitEvents));
    }

    public static EventHandlingResult processed() {
        return processed(Collections.emptyList());
    }

    public static EventHandlingResult skipped(String reason) {
        return new EventHandlingResult(ContractEventStatus.SKIPPED, reason, Collections.emptyList());
    }

    public boolean isSkipped() {
        return outcome == ContractEventStatus.SKIPPED;
    }
}
