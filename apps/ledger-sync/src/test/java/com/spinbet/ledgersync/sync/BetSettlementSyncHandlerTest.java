package com.spinbet.ledgersync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spinbet.ledgersync.entity.Bet;
import com.spinbet.ledgersync.entity.BetStatus;
import com.spinbet.ledgersync.entity.Transaction;
import com.spinbet.ledgersync.entity.TransactionType;
import com.spinbet.ledgersync.event.BetSettledEvent;
import com.spinbet.ledgersync.modules.chains.events.EventHandlingResult;
import com.spinbet.ledgersync.modules.chains.model.ContractEventStatus;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.repository.BetRepository;
import com.spinbet.ledgersync.repository.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BetSettlementSyncHandlerTest {

    private static final LocalDateTime CLOSED_AT = LocalDateTime.of(2024, 6, 2, 9, 30);

    private final ObjectMapper objectMapper = new ObjectMapper();

    private BetRepository betRepository;
    private TransactionRepository transactionRepository;
    private BetSettlementSyncHandler handler;
    private Bet bet;

    @BeforeEach
    void setUp() {
        betRepository = mock(BetRepository.class);
        transactionRepository = mock(TransactionRepository.class);
        handler = new BetSettlementSyncHandler(betRepository, transactionRepository);

        bet = Bet.builder()
                .id("bet-1")
                .userId("user-1")
                .matchId("match-1")
                .stakeAmount(new BigDecimal("20"))
                .potentialPayout(new BigDecimal("55"))
                .build();
        when(betRepository.findByIdForUpdate("bet-1")).thenReturn(Optional.of(bet));
    }

    @Test
    void topicsAloneDoNotSettleBet() {
        EventHandlingResult result = handler.handle(event("evt-1", List.of("bet", "win"),
                objectMapper.createObjectNode().put("betId", "bet-1")));

        assertEquals(ContractEventStatus.SKIPPED, result.getOutcome());
        assertEquals("bet settlement event has no structured outcome field", result.getReason());
        assertEquals(BetStatus.PENDING, bet.getStatus());
        verify(betRepository, never()).save(any());
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void winFlagSettlesWithPotentialPayout() {
        EventHandlingResult result = handler.handle(event("evt-2", List.of("bet", "settled"),
                objectMapper.createObjectNode().put("betId", "bet-1").put("isWin", true)));

        assertEquals(BetStatus.WON, bet.getStatus());
        assertEquals(CLOSED_AT, bet.getSettledAt());
        @SuppressWarnings("unchecked")
        Map<String, Object> provenance = (Map<String, Object>) bet.getMetadata().get("onChainSettlement");
        assertEquals("evt-2", provenance.get("eventId"));

        ArgumentCaptor<Transaction> captor = ArgumentCaptor.forClass(Transaction.class);
        verify(transactionRepository).save(captor.capture());
        Transaction entry = captor.getValue();
        assertEquals(TransactionType.BET_WINNING, entry.getType());
        assertEquals(0, new BigDecimal("55").compareTo(entry.getAmount()));
        assertEquals("bet-1", entry.getRelatedEntityId());
        assertEquals("soroban_event:evt-2", entry.getReferenceId());

        BetSettledEvent settled = (BetSettledEvent) result.getPostCommitEvents().get(0);
        assertTrue(settled.isWin());
        assertEquals("match-1", settled.getMatchId());
        assertEquals(0, new BigDecimal("55").compareTo(settled.getPayoutAmount()));
    }

    @Test
    void cancelRefundsStake() {
        EventHandlingResult result = handler.handle(event("evt-3", List.of("bet"),
                objectMapper.createObjectNode().put("betId", "bet-1").put("status", "Cancelled")));

        assertEquals(BetStatus.CANCELLED, bet.getStatus());
        ArgumentCaptor<Transaction> captor = ArgumentCaptor.forClass(Transaction.class);
        verify(transactionRepository).save(captor.capture());
        assertEquals(TransactionType.BET_CANCELLATION, captor.getValue().getType());
        assertEquals(0, new BigDecimal("20").compareTo(captor.getValue().getAmount()));
        assertTrue(result.getPostCommitEvents().isEmpty());
    }

    @Test
    void cancelHintBeatsWinFlag() {
        handler.handle(event("evt-4", List.of("bet"), objectMapper.createObjectNode()
                .put("betId", "bet-1")
                .put("status", "cancelled")
                .put("won", true)));

        assertEquals(BetStatus.CANCELLED, bet.getStatus());
    }

    @Test
    void lossWritesNoLedgerEntry() {
        EventHandlingResult result = handler.handle(event("evt-5", List.of("bet"),
                objectMapper.createObjectNode().put("bet_id", "bet-1").put("result", "lost")));

        assertEquals(BetStatus.LOST, bet.getStatus());
        verify(transactionRepository, never()).save(any());
        BetSettledEvent settled = (BetSettledEvent) result.getPostCommitEvents().get(0);
        assertFalse(settled.isWin());
        assertEquals(0, BigDecimal.ZERO.compareTo(settled.getPayoutAmount()));
    }

    @Test
    void existingLedgerEntryIsNotDuplicated() {
        when(transactionRepository.existsByReferenceId("soroban_event:evt-6")).thenReturn(true);

        EventHandlingResult result = handler.handle(event("evt-6", List.of("bet"),
                objectMapper.createObjectNode().put("betId", "bet-1").put("status", "won").put("payoutAmount", "60")));

        assertEquals(ContractEventStatus.PROCESSED, result.getOutcome());
        assertEquals(BetStatus.WON, bet.getStatus());
        verify(betRepository).save(bet);
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void missingOrUnknownBetIsSkipped() {
        EventHandlingResult missing = handler.handle(event("evt-7", List.of("bet"),
                objectMapper.createObjectNode().put("status", "won")));
        EventHandlingResult unknown = handler.handle(event("evt-8", List.of("bet"),
                objectMapper.createObjectNode().put("betId", "bet-404").put("status", "won")));

        assertEquals("bet settlement event missing bet id", missing.getReason());
        assertEquals("bet not found (bet-404)", unknown.getReason());
    }

    @Test
    void parseBetStatusFollowsPrecedence() {
        assertEquals(BetStatus.CANCELLED, BetSettlementSyncHandler.parseBetStatus("cancel", true, List.of()));
        assertEquals(BetStatus.LOST, BetSettlementSyncHandler.parseBetStatus("won", false, List.of()));
        assertEquals(BetStatus.WON, BetSettlementSyncHandler.parseBetStatus("Won", null, List.of()));
        assertEquals(BetStatus.PENDING, BetSettlementSyncHandler.parseBetStatus("pending", null, List.of("win")));
        assertEquals(BetStatus.LOST, BetSettlementSyncHandler.parseBetStatus("final", null, List.of("bet", "loss")));
        assertEquals(BetStatus.CANCELLED, BetSettlementSyncHandler.parseBetStatus("final", null, List.of("cancelled")));
        assertNull(BetSettlementSyncHandler.parseBetStatus("final", null, List.of("bet")));
    }

    @Test
    void undeterminedOutcomeIsSkipped() {
        EventHandlingResult result = handler.handle(event("evt-9", List.of("bet"),
                objectMapper.createObjectNode().put("betId", "bet-1").put("status", "final")));

        assertEquals("bet settlement status could not be determined", result.getReason());
        verify(betRepository, never()).save(any());
    }

    private NormalizedContractEvent event(String id, List<String> topics, ObjectNode payload) {
        return NormalizedContractEvent.builder()
                .id(id)
                .ledger(1000L)
                .txHash("tx-" + id)
                .topics(topics)
                .payload(payload)
                .ledgerClosedAt(CLOSED_AT)
                .build();
    }
}
