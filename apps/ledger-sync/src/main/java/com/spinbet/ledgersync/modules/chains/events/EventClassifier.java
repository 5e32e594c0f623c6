package com.spinbet.ledgersync.modules.chains.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.spinbet.ledgersync.modules.chains.model.ContractEventType;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps a normalized event to a {@link ContractEventType}.
 *
 * <p>Keyword rules over the joined topics and the payload's event hint are tried first, then
 * type-indicative payload keys. First match wins.
 */
@Component
public class EventClassifier {

    private static final List<String> EVENT_HINT_KEYS = List.of("event", "type", "name", "action");
    private static final List<String> NFT_KEYS = List.of("nftId", "nft_id", "tokenId", "token_id");
    private static final List<String> BET_KEYS = List.of("betId", "bet_id");
    private static final List<String> SPIN_KEYS = List.of("spinId", "spin_id", "sessionId");
    private static final List<String> STAKING_KEYS = List.of("stakeAmount", "stake_amount", "staker", "rewardAmount");

    public ContractEventType classify(NormalizedContractEvent event) {
        return classify(event.getTopics(), event.getPayload());
    }

    public ContractEventType classify(List<String> topics, JsonNode payload) {
        String joinedTopics = topics == null ? "" : String.join(" ", topics);
        String eventHint = PayloadReader.readString(payload, EVENT_HINT_KEYS).orElse("");
        String combined = (joinedTopics + " " + eventHint).toLowerCase(Locale.ROOT);

        if (combined.contains("nft") || combined.contains("mint")) {
            return ContractEventType.NFT_MINT;
        }
        if (combined.contains("bet") && containsAny(combined, "settle", "won", "lost", "cancel")) {
            return ContractEventType.BET_SETTLEMENT;
        }
        if (combined.contains("spin") && containsAny(combined, "reward", "settle", "payout", "win")) {
            return ContractEventType.SPIN_REWARD;
        }
        if (combined.contains("stake")) {
            return ContractEventType.STAKING;
        }

        if (hasValue(payload, NFT_KEYS)) {
            return ContractEventType.NFT_MINT;
        }
        if (hasValue(payload, BET_KEYS)) {
            return ContractEventType.BET_SETTLEMENT;
        }
        if (hasValue(payload, SPIN_KEYS)) {
            return ContractEventType.SPIN_REWARD;
        }
        if (hasValue(payload, STAKING_KEYS)) {
            return ContractEventType.STAKING;
        }
        return ContractEventType.UNKNOWN;
    }

    private static boolean hasValue(JsonNode payload, List<String> keys) {
        return PayloadReader.readString(payload, keys).filter(value -> !value.isEmpty()).isPresent();
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
