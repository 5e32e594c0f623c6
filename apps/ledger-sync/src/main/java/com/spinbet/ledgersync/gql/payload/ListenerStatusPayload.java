package com.spinbet.ledgersync.gql.payload;

import lombok.Builder;
import lombok.Value;

/**
 * GraphQL payload for the contract event listener.
 *
 * <p>Matches {@code ListenerStatusPayload} in {@code src/main/resources/graphql/schema.graphqls}.</p>
 */
@Value
@Builder
public class ListenerStatusPayload {
    boolean enabled;
    String contractId;
    String cursor;
    Long lastLedger;
    Integer reconnectAttempts;
    boolean polling;
    Integer reconnectCount;
    Long totalProcessed;
    Long totalSkipped;
    Long totalFailed;
    String lastError;
    String lastPolledAt;
    String lastEventAt;
}
