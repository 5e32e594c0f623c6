package com.spinbet.ledgersync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.spinbet.ledgersync.entity.Bet;
import com.spinbet.ledgersync.entity.BetStatus;
import com.spinbet.ledgersync.entity.Transaction;
import com.spinbet.ledgersync.entity.TransactionStatus;
import com.spinbet.ledgersync.entity.TransactionType;
import com.spinbet.ledgersync.event.BetSettledEvent;
import com.spinbet.ledgersync.modules.chains.events.ContractEventHandler;
import com.spinbet.ledgersync.modules.chains.events.EventHandlingResult;
import com.spinbet.ledgersync.modules.chains.model.ContractEventType;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.repository.BetRepository;
import com.spinbet.ledgersync.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.spinbet.ledgersync.modules.chains.events.PayloadReader.readBoolean;
import static com.spinbet.ledgersync.modules.chains.events.PayloadReader.readNumber;
import static com.spinbet.ledgersync.modules.chains.events.PayloadReader.readString;

/**
 * Bet 结算事件同步处理器
 * Settles a bet and writes the payout or refund ledger entry.
 *
 * <p>The outcome must come from a structured payload field (status hint or win flag). Topic keywords
 * only refine an outcome once such a field is present and never settle a bet on their own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BetSettlementSyncHandler implements ContractEventHandler {

    static final List<String> BET_KEYS = List.of("betId", "bet_id", "id");
    static final List<String> STATUS_KEYS = List.of("status", "result", "outcome");
    static final List<String> WIN_FLAG_KEYS = List.of("isWin", "won", "is_winner");
    static final List<String> PAYOUT_KEYS = List.of(
            "payoutAmount", "payout_amount", "winningsAmount", "winnings_amount", "amount");

    private final BetRepository betRepository;
    private final TransactionRepository transactionRepository;

    @Override
    public ContractEventType supports() {
        return ContractEventType.BET_SETTLEMENT;
    }

    @Override
    public EventHandlingResult handle(NormalizedContractEvent event) {
        JsonNode payload = event.getPayload();

        Optional<String> betId = readString(payload, BET_KEYS).filter(value -> !value.isBlank());
        if (betId.isEmpty()) {
            return EventHandlingResult.skipped("bet settlement event missing bet id");
        }

        Optional<Bet> locked = betRepository.findByIdForUpdate(betId.get());
        if (locked.isEmpty()) {
            return EventHandlingResult.skipped("bet not found (" + betId.get() + ")");
        }
        Bet bet = locked.get();

        Optional<String> statusHint = readString(payload, STATUS_KEYS).filter(value -> !value.isBlank());
        Optional<Boolean> winFlag = readBoolean(payload, WIN_FLAG_KEYS);
        if (statusHint.isEmpty() && winFlag.isEmpty()) {
            log.warn("Bet settlement event {} has no status or win flag; topics alone do not settle a bet",
                    event.getId());
            return EventHandlingResult.skipped("bet settlement event has no structured outcome field");
        }

        BetStatus status = parseBetStatus(statusHint.orElse(null), winFlag.orElse(null), event.getTopics());
        if (status == null) {
            return EventHandlingResult.skipped("bet settlement status could not be determined");
        }

        LocalDateTime settledAt = OnChainReference.closedAtOrNow(event);
        bet.setStatus(status);
        bet.setSettledAt(settledAt);
        bet.setMetadata(OnChainReference.withProvenance(bet.getMetadata(), "onChainSettlement", event,
                event.getTxHash()));
        betRepository.save(bet);

        BigDecimal payout = readNumber(payload, PAYOUT_KEYS)
                .orElseGet(() -> status == BetStatus.WON && bet.getPotentialPayout() != null
                        ? bet.getPotentialPayout()
                        : BigDecimal.ZERO);

        String referenceId = OnChainReference.referenceId(event.getId());
        if (transactionRepository.existsByReferenceId(referenceId)) {
            log.warn("Ledger entry {} already exists, bet {} settled without a new entry", referenceId, bet.getId());
        } else if (status == BetStatus.WON && payout.signum() > 0) {
            saveLedgerEntry(event, bet, TransactionType.BET_WINNING, payout, referenceId);
        } else if (status == BetStatus.CANCELLED) {
            saveLedgerEntry(event, bet, TransactionType.BET_CANCELLATION, bet.getStakeAmount(), referenceId);
        }

        if (status != BetStatus.WON && status != BetStatus.LOST) {
            return EventHandlingResult.processed();
        }
        boolean win = status == BetStatus.WON;
        return EventHandlingResult.processed(List.of(new BetSettledEvent(
                bet.getUserId(),
                bet.getId(),
                bet.getMatchId(),
                win,
                bet.getStakeAmount(),
                win ? payout : BigDecimal.ZERO,
                settledAt)));
    }

    private void saveLedgerEntry(NormalizedContractEvent event, Bet bet, TransactionType type,
                                 BigDecimal amount, String referenceId) {
        transactionRepository.save(Transaction.builder()
                .userId(bet.getUserId())
                .type(type)
                .amount(amount)
                .status(TransactionStatus.COMPLETED)
                .relatedEntityId(bet.getId())
                .referenceId(referenceId)
                .metadata(OnChainReference.ledgerEntryMetadata(event, ContractEventType.BET_SETTLEMENT))
                .build());
    }

    /**
     * Resolve the settlement outcome. Precedence: cancel in the status hint, the win flag, win/loss/pending
     * words in the status hint, then topic keywords.
     *
     * @return the outcome, or {@code null} when it cannot be determined
     */
    static BetStatus parseBetStatus(String statusHint, Boolean winFlag, List<String> topics) {
        String hint = statusHint == null ? "" : statusHint.toLowerCase(Locale.ROOT);

        if (hint.contains("cancel")) {
            return BetStatus.CANCELLED;
        }
        if (winFlag != null) {
            return winFlag ? BetStatus.WON : BetStatus.LOST;
        }
        BetStatus fromHint = fromKeywords(hint);
        if (fromHint != null) {
            return fromHint;
        }
        if (hint.contains("pending")) {
            return BetStatus.PENDING;
        }
        String joinedTopics = topics == null ? "" : String.join(" ", topics).toLowerCase(Locale.ROOT);
        if (joinedTopics.contains("cancel")) {
            return BetStatus.CANCELLED;
        }
        return fromKeywords(joinedTopics);
    }

    private static BetStatus fromKeywords(String text) {
        if (text.contains("win") || text.contains("won")) {
            return BetStatus.WON;
        }
        if (text.contains("loss") || text.contains("lost")) {
            return BetStatus.LOST;
        }
        return null;
    }
}
