package com.spinbet.ledgersync.gql.payload;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ContractEventLogPayload {
    String id;
    String eventId;
    String eventType;
    Long ledger;
    String txHash;
    String status;
    Integer attempts;
    String errorMessage;
    List<String> topics;
    String processedAt;
    String createdAt;
}
