package com.spinbet.ledgersync.sync;

import com.spinbet.ledgersync.modules.chains.model.ContractEventType;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ledger-entry references and provenance metadata shared by the sync handlers.
 */
final class OnChainReference {

    static final String SOURCE = "soroban_event_listener";

    private static final String REFERENCE_PREFIX = "soroban_event:";
    private static final int MAX_REFERENCE_LENGTH = 255;

    private OnChainReference() {
    }

    /**
     * Dedup key of the ledger entry written for an event.
     */
    static String referenceId(String eventId) {
        String reference = REFERENCE_PREFIX + eventId;
        return reference.length() > MAX_REFERENCE_LENGTH ? reference.substring(0, MAX_REFERENCE_LENGTH) : reference;
    }

    static Map<String, Object> ledgerEntryMetadata(NormalizedContractEvent event, ContractEventType category) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", SOURCE);
        metadata.put("category", category.getValue());
        metadata.put("eventId", event.getId());
        metadata.put("txHash", event.getTxHash());
        metadata.put("ledger", event.getLedger());
        return metadata;
    }

    /**
     * Copy of {@code existing} with an on-chain provenance block stored under {@code key}.
     */
    static Map<String, Object> withProvenance(Map<String, Object> existing, String key,
                                              NormalizedContractEvent event, String txHash) {
        Map<String, Object> provenance = new LinkedHashMap<>();
        provenance.put("eventId", event.getId());
        provenance.put("txHash", txHash);
        provenance.put("ledger", event.getLedger());
        provenance.put("syncedAt", LocalDateTime.now().toString());

        Map<String, Object> merged = existing == null ? new HashMap<>() : new HashMap<>(existing);
        merged.put(key, provenance);
        return merged;
    }

    static LocalDateTime closedAtOrNow(NormalizedContractEvent event) {
        return event.getLedgerClosedAt() != null ? event.getLedgerClosedAt() : LocalDateTime.now();
    }
}
