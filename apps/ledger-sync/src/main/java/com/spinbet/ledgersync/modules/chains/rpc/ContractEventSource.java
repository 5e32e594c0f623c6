package com.spinbet.ledgersync.modules.chains.rpc;

import com.spinbet.ledgersync.modules.chains.model.EventPage;
import com.spinbet.ledgersync.modules.chains.model.EventQuery;

/**
 * Paged source of contract events.
 */
public interface ContractEventSource {

    /**
     * Fetch one page of normalized events.
     *
     * @throws RetentionWindowException when the cursor or start ledger fell out of the node's history
     * @throws RpcException             on any other transport or RPC failure
     */
    EventPage fetch(EventQuery query);

    /**
     * Latest ledger sequence known to the node.
     */
    long getLatestLedger();
}
