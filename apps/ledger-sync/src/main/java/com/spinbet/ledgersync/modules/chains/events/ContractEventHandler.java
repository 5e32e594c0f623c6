package com.spinbet.ledgersync.modules.chains.events;

import com.spinbet.ledgersync.modules.chains.model.ContractEventType;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;

/**
 * Applies one kind of contract event to domain state.
 *
 * <p>Called inside the per-event transaction opened by {@link ContractEventProcessor}; implementations
 * must not open their own. A missing field or record is reported as a skipped result, not an exception.
 */
public interface ContractEventHandler {

    ContractEventType supports();

    EventHandlingResult handle(NormalizedContractEvent event);
}
