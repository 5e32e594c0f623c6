package com.spinbet.ledgersync.modules.chains.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Contract event after decoding: flat topics and a JSON payload object.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NormalizedContractEvent {

    private String id;

    /**
     * Continuation token of the page this event was fetched with.
     */
    private String cursor;

    private long ledger;

    private String txHash;

    private String contractId;

    private List<String> topics;

    private ObjectNode payload;

    private LocalDateTime ledgerClosedAt;

    public String joinedTopics() {
        return topics == null ? "" : String.join(" ", topics);
    }
}
