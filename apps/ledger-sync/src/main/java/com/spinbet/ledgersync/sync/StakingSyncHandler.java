package com.spinbet.ledgersync.sync;

import com.spinbet.ledgersync.entity.Transaction;
import com.spinbet.ledgersync.entity.TransactionStatus;
import com.spinbet.ledgersync.entity.TransactionType;
import com.spinbet.ledgersync.entity.User;
import com.spinbet.ledgersync.event.StakeCreditedEvent;
import com.spinbet.ledgersync.event.StakeDebitedEvent;
import com.spinbet.ledgersync.modules.chains.events.ContractEventHandler;
import com.spinbet.ledgersync.modules.chains.events.EventHandlingResult;
import com.spinbet.ledgersync.modules.chains.model.ContractEventType;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.repository.TransactionRepository;
import com.spinbet.ledgersync.repository.UserRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.spinbet.ledgersync.modules.chains.events.PayloadReader.readNumber;
import static com.spinbet.ledgersync.modules.chains.events.PayloadReader.readString;

/**
 * Staking 事件同步处理器
 * Applies a signed stake/reward delta to the user's wallet and records a ledger entry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StakingSyncHandler implements ContractEventHandler {

    static final List<String> USER_KEYS = List.of("userId", "user_id", "staker", "account", "address", "wallet");
    static final List<String> AMOUNT_KEYS = List.of(
            "amount", "stakeAmount", "stake_amount", "rewardAmount", "reward_amount", "value", "delta");
    static final List<String> ACTION_KEYS = List.of("action", "event", "type", "operation");
    static final List<String> DELTA_KEYS = List.of("balanceDelta", "balance_delta", "delta");
    static final List<String> REWARD_KEYS = List.of("rewardAmount", "reward_amount");
    static final List<String> STAKE_KEYS = List.of("stakeAmount", "stake_amount");

    private final UserRepository userRepository;
    private final TransactionRepository transactionRepository;

    @Override
    public ContractEventType supports() {
        return ContractEventType.STAKING;
    }

    @Override
    public EventHandlingResult handle(NormalizedContractEvent event) {
        JsonNode payload = event.getPayload();

        Optional<String> userId = readString(payload, USER_KEYS).filter(value -> !value.isBlank());
        if (userId.isEmpty()) {
            return EventHandlingResult.skipped("staking event missing user identifier");
        }

        Optional<BigDecimal> amount = readNumber(payload, AMOUNT_KEYS);
        if (amount.isEmpty()) {
            return EventHandlingResult.skipped("staking event missing amount");
        }

        String action = readString(payload, ACTION_KEYS)
                .filter(value -> !value.isBlank())
                .orElseGet(() -> deriveActionFromTopics(event.getTopics()));
        BigDecimal delta = readNumber(payload, DELTA_KEYS)
                .orElseGet(() -> deriveSignedDelta(amount.get(), action, event.getTopics()));
        BigDecimal rewardAmount = readNumber(payload, REWARD_KEYS)
                .orElse(delta.signum() > 0 ? delta.abs() : BigDecimal.ZERO);
        BigDecimal stakedAmount = readNumber(payload, STAKE_KEYS)
                .orElse(amount.get().abs());

        Optional<User> locked = userRepository.findByIdForUpdate(userId.get());
        if (locked.isEmpty()) {
            return EventHandlingResult.skipped("staking event user not found (" + userId.get() + ")");
        }
        User user = locked.get();

        String referenceId = OnChainReference.referenceId(event.getId());
        if (transactionRepository.existsByReferenceId(referenceId)) {
            log.warn("Ledger entry {} already exists, not re-applying staking delta", referenceId);
            return EventHandlingResult.skipped("ledger entry already recorded (" + referenceId + ")");
        }

        user.applyBalanceDelta(delta);
        userRepository.save(user);

        Map<String, Object> metadata = OnChainReference.ledgerEntryMetadata(event, ContractEventType.STAKING);
        metadata.put("action", action);
        transactionRepository.save(Transaction.builder()
                .userId(user.getId())
                .type(delta.signum() >= 0 ? TransactionType.STAKING_REWARD : TransactionType.STAKING_PENALTY)
                .amount(delta)
                .status(TransactionStatus.COMPLETED)
                .referenceId(referenceId)
                .metadata(metadata)
                .build());

        log.debug("Applied staking delta {} to user {} (event {})", delta, user.getId(), event.getId());

        if (delta.signum() >= 0) {
            return EventHandlingResult.processed(List.of(
                    new StakeCreditedEvent(user.getId(), stakedAmount, rewardAmount)));
        }
        return EventHandlingResult.processed(List.of(
                new StakeDebitedEvent(user.getId(), delta.abs(), action.isBlank() ? "stake_debit" : action)));
    }

    static String deriveActionFromTopics(List<String> topics) {
        String normalized = join(topics);
        if (normalized.contains("unstake")) {
            return "unstake";
        }
        if (normalized.contains("reward")) {
            return "reward";
        }
        if (normalized.contains("credit")) {
            return "credit";
        }
        if (normalized.contains("debit")) {
            return "debit";
        }
        if (normalized.contains("stake")) {
            return "stake";
        }
        return "unknown";
    }

    /**
     * Sign the amount from the action hint and topics. Credit words are checked first, so
     * {@code unstake} and {@code unlock} credit even though they contain debit words.
     */
    static BigDecimal deriveSignedDelta(BigDecimal amount, String action, List<String> topics) {
        String normalized = ((action == null ? "" : action) + " " + join(topics)).toLowerCase(Locale.ROOT);
        BigDecimal value = amount.abs();

        if (normalized.contains("credit") || normalized.contains("reward") || normalized.contains("unstake")
                || normalized.contains("unlock") || normalized.contains("claim")) {
            return value;
        }
        if (normalized.contains("debit") || normalized.contains("lock") || normalized.contains("stake")) {
            return value.negate();
        }
        return amount;
    }

    private static String join(List<String> topics) {
        return topics == null ? "" : String.join(" ", topics).toLowerCase(Locale.ROOT);
    }
}
