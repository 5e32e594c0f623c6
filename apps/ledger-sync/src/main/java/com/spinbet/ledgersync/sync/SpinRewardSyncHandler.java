package com.spinbet.ledgersync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.spinbet.ledgersync.entity.Spin;
import com.spinbet.ledgersync.entity.SpinOutcome;
import com.spinbet.ledgersync.entity.SpinSession;
import com.spinbet.ledgersync.entity.SpinStatus;
import com.spinbet.ledgersync.event.SpinSettledEvent;
import com.spinbet.ledgersync.modules.chains.events.ContractEventHandler;
import com.spinbet.ledgersync.modules.chains.events.EventHandlingResult;
import com.spinbet.ledgersync.modules.chains.model.ContractEventType;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.repository.SpinRepository;
import com.spinbet.ledgersync.repository.SpinSessionRepository;
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
 * Spin 奖励事件同步处理器
 * Settles a spin from an on-chain reward event and mirrors the status into its session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpinRewardSyncHandler implements ContractEventHandler {

    static final List<String> SPIN_KEYS = List.of("spinId", "spin_id", "sessionId", "session_id");
    static final List<String> PAYOUT_KEYS = List.of(
            "payoutAmount", "payout_amount", "rewardAmount", "reward_amount", "amount", "winAmount");
    static final List<String> OUTCOME_KEYS = List.of("outcome", "result");
    static final List<String> STATUS_KEYS = List.of("status", "state");
    static final List<String> TX_KEYS = List.of("txHash", "tx_hash", "transactionHash", "transaction_hash");

    private static final Map<String, SpinOutcome> OUTCOME_ALIASES = Map.ofEntries(
            Map.entry("jackpot", SpinOutcome.JACKPOT),
            Map.entry("high_win", SpinOutcome.HIGH_WIN),
            Map.entry("highwin", SpinOutcome.HIGH_WIN),
            Map.entry("medium_win", SpinOutcome.MEDIUM_WIN),
            Map.entry("mediumwin", SpinOutcome.MEDIUM_WIN),
            Map.entry("small_win", SpinOutcome.SMALL_WIN),
            Map.entry("smallwin", SpinOutcome.SMALL_WIN),
            Map.entry("no_win", SpinOutcome.NO_WIN),
            Map.entry("nowin", SpinOutcome.NO_WIN),
            Map.entry("loss", SpinOutcome.NO_WIN),
            Map.entry("lose", SpinOutcome.NO_WIN)
    );

    private final SpinRepository spinRepository;
    private final SpinSessionRepository spinSessionRepository;

    @Override
    public ContractEventType supports() {
        return ContractEventType.SPIN_REWARD;
    }

    @Override
    public EventHandlingResult handle(NormalizedContractEvent event) {
        JsonNode payload = event.getPayload();

        Optional<String> spinKey = readString(payload, SPIN_KEYS).filter(value -> !value.isBlank());
        Optional<BigDecimal> payoutAmount = readNumber(payload, PAYOUT_KEYS);
        Optional<String> outcome = readString(payload, OUTCOME_KEYS);
        SpinStatus status = parseSpinStatus(readString(payload, STATUS_KEYS).orElse(null),
                payoutAmount.isPresent(), event.getTopics());
        String txReference = readString(payload, TX_KEYS)
                .filter(value -> !value.isBlank())
                .orElse(event.getTxHash());

        Optional<Spin> found = spinKey.flatMap(this::findSpin);
        if (found.isEmpty()) {
            return EventHandlingResult.skipped(
                    "spin event could not find spin record (spinId=" + spinKey.orElse("n/a") + ")");
        }
        Spin spin = found.get();

        spin.setStatus(status);
        payoutAmount.ifPresent(spin::setPayoutAmount);
        outcome.flatMap(SpinRewardSyncHandler::parseSpinOutcome).ifPresent(spin::setOutcome);
        spin.setMetadata(OnChainReference.withProvenance(spin.getMetadata(), "onChain", event, txReference));
        spinRepository.save(spin);

        findSession(spin, txReference).ifPresent(session -> {
            session.setTxReference(txReference);
            session.setStatus(SpinSession.mirrorOf(status));
            spinSessionRepository.save(session);
        });

        if (status != SpinStatus.COMPLETED) {
            return EventHandlingResult.processed();
        }

        BigDecimal stake = spin.getStakeAmount() != null ? spin.getStakeAmount() : BigDecimal.ZERO;
        BigDecimal payout = spin.getPayoutAmount() != null ? spin.getPayoutAmount() : BigDecimal.ZERO;
        return EventHandlingResult.processed(List.of(new SpinSettledEvent(
                spin.getUserId(),
                spin.getId(),
                spin.getOutcome(),
                stake,
                payout,
                payout.compareTo(stake) > 0,
                OnChainReference.closedAtOrNow(event))));
    }

    /**
     * Spin id first, then session id. A spin whose own id matches wins over a different spin whose
     * session id carries the same value.
     */
    Optional<Spin> findSpin(String key) {
        Optional<Spin> byId = spinRepository.findByIdForUpdate(key);
        if (byId.isPresent()) {
            return byId;
        }
        return spinRepository.findBySessionIdForUpdate(key);
    }

    /**
     * The spin's own session, else the session holding the transaction reference.
     */
    private Optional<SpinSession> findSession(Spin spin, String txReference) {
        String sessionId = spin.getSessionId();
        Optional<SpinSession> byId = sessionId == null || sessionId.isBlank()
                ? Optional.empty()
                : spinSessionRepository.findById(sessionId);
        if (byId.isPresent() || txReference == null || txReference.isBlank()) {
            return byId;
        }
        return spinSessionRepository.findFirstByTxReference(txReference);
    }

    static SpinStatus parseSpinStatus(String statusHint, boolean hasPayout, List<String> topics) {
        String normalized = ((statusHint == null ? "" : statusHint) + " "
                + (topics == null ? "" : String.join(" ", topics))).toLowerCase(Locale.ROOT);
        if (normalized.contains("fail") || normalized.contains("error") || normalized.contains("revert")) {
            return SpinStatus.FAILED;
        }
        if (normalized.contains("pending") || normalized.contains("processing") || normalized.contains("queued")) {
            return SpinStatus.PENDING;
        }
        if (normalized.contains("complete") || normalized.contains("settle")) {
            return SpinStatus.COMPLETED;
        }
        return hasPayout ? SpinStatus.COMPLETED : SpinStatus.PENDING;
    }

    static Optional<SpinOutcome> parseSpinOutcome(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(OUTCOME_ALIASES.get(value.trim().toLowerCase(Locale.ROOT)));
    }
}
