package com.spinbet.ledgersync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spinbet.ledgersync.entity.Spin;
import com.spinbet.ledgersync.entity.SpinOutcome;
import com.spinbet.ledgersync.entity.SpinSession;
import com.spinbet.ledgersync.entity.SpinSessionStatus;
import com.spinbet.ledgersync.entity.SpinStatus;
import com.spinbet.ledgersync.event.SpinSettledEvent;
import com.spinbet.ledgersync.modules.chains.events.EventHandlingResult;
import com.spinbet.ledgersync.modules.chains.model.ContractEventStatus;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.repository.SpinRepository;
import com.spinbet.ledgersync.repository.SpinSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SpinRewardSyncHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SpinRepository spinRepository;
    private SpinSessionRepository spinSessionRepository;
    private SpinRewardSyncHandler handler;

    @BeforeEach
    void setUp() {
        spinRepository = mock(SpinRepository.class);
        spinSessionRepository = mock(SpinSessionRepository.class);
        handler = new SpinRewardSyncHandler(spinRepository, spinSessionRepository);
    }

    @Test
    void spinIdMatchWinsOverSessionIdCollision() {
        Spin byId = spin("shared-1", "session-a");
        Spin bySession = spin("spin-b", "shared-1");
        when(spinRepository.findByIdForUpdate("shared-1")).thenReturn(Optional.of(byId));
        when(spinRepository.findBySessionIdForUpdate("shared-1")).thenReturn(Optional.of(bySession));

        handler.handle(event("evt-1", objectMapper.createObjectNode().put("spinId", "shared-1").put("payoutAmount", "5")));

        assertEquals(SpinStatus.COMPLETED, byId.getStatus());
        assertEquals(SpinStatus.PENDING, bySession.getStatus());
        verify(spinRepository).save(byId);
        verify(spinRepository, never()).findBySessionIdForUpdate(anyString());
    }

    @Test
    void fallsBackToSessionId() {
        Spin spin = spin("spin-1", "session-1");
        when(spinRepository.findBySessionIdForUpdate("session-1")).thenReturn(Optional.of(spin));

        EventHandlingResult result = handler.handle(event("evt-2",
                objectMapper.createObjectNode().put("sessionId", "session-1").put("status", "processing")));

        assertEquals(ContractEventStatus.PROCESSED, result.getOutcome());
        assertEquals(SpinStatus.PENDING, spin.getStatus());
        assertTrue(result.getPostCommitEvents().isEmpty());
    }

    @Test
    void completedSpinIsSettledAndMirroredToSession() {
        Spin spin = spin("spin-1", "session-1");
        SpinSession session = SpinSession.builder().id("session-1").userId("user-1").build();
        when(spinRepository.findByIdForUpdate("spin-1")).thenReturn(Optional.of(spin));
        when(spinSessionRepository.findById("session-1")).thenReturn(Optional.of(session));

        ObjectNode payload = objectMapper.createObjectNode()
                .put("spinId", "spin-1")
                .put("payoutAmount", "50")
                .put("outcome", "HighWin");
        EventHandlingResult result = handler.handle(event("evt-3", payload));

        assertEquals(SpinStatus.COMPLETED, spin.getStatus());
        assertEquals(SpinOutcome.HIGH_WIN, spin.getOutcome());
        assertEquals(0, new BigDecimal("50").compareTo(spin.getPayoutAmount()));
        @SuppressWarnings("unchecked")
        Map<String, Object> onChain = (Map<String, Object>) spin.getMetadata().get("onChain");
        assertEquals("evt-3", onChain.get("eventId"));
        assertEquals("tx-evt-3", onChain.get("txHash"));
        assertEquals("web", spin.getMetadata().get("client"));

        assertEquals(SpinSessionStatus.COMPLETED, session.getStatus());
        assertEquals("tx-evt-3", session.getTxReference());
        verify(spinSessionRepository).save(session);

        SpinSettledEvent settled = (SpinSettledEvent) result.getPostCommitEvents().get(0);
        assertEquals("user-1", settled.getUserId());
        assertEquals("spin-1", settled.getSpinId());
        assertTrue(settled.isWin());
        assertEquals(LocalDateTime.of(2024, 6, 1, 12, 0), settled.getSettledAt());
    }

    @Test
    void mirrorsStatusIntoOwnSessionOnly() {
        Spin spin = spin("shared-1", "session-a");
        SpinSession own = SpinSession.builder().id("session-a").build();
        SpinSession unrelated = SpinSession.builder().id("shared-1").build();
        when(spinRepository.findByIdForUpdate("shared-1")).thenReturn(Optional.of(spin));
        when(spinSessionRepository.findById("session-a")).thenReturn(Optional.of(own));
        when(spinSessionRepository.findById("shared-1")).thenReturn(Optional.of(unrelated));

        handler.handle(event("evt-7", objectMapper.createObjectNode().put("spinId", "shared-1").put("payoutAmount", "5")));

        assertEquals(SpinSessionStatus.COMPLETED, own.getStatus());
        assertEquals(SpinSessionStatus.PENDING, unrelated.getStatus());
        verify(spinSessionRepository).save(own);
        verify(spinSessionRepository, never()).save(unrelated);
    }

    @Test
    void sessionIsFoundByTxReference() {
        Spin spin = spin("spin-1", "session-1");
        SpinSession session = SpinSession.builder().id("session-1").txReference("0xfeed").build();
        when(spinRepository.findByIdForUpdate("spin-1")).thenReturn(Optional.of(spin));
        when(spinSessionRepository.findFirstByTxReference("0xfeed")).thenReturn(Optional.of(session));

        handler.handle(event("evt-4", objectMapper.createObjectNode()
                .put("spinId", "spin-1")
                .put("status", "failed")
                .put("transactionHash", "0xfeed")));

        assertEquals(SpinStatus.FAILED, spin.getStatus());
        assertEquals(SpinSessionStatus.FAILED, session.getStatus());
    }

    @Test
    void unknownSpinIsSkipped() {
        EventHandlingResult missingId = handler.handle(event("evt-5", objectMapper.createObjectNode().put("amount", "1")));
        EventHandlingResult notFound = handler.handle(event("evt-6", objectMapper.createObjectNode().put("spinId", "nope")));

        assertEquals("spin event could not find spin record (spinId=n/a)", missingId.getReason());
        assertEquals("spin event could not find spin record (spinId=nope)", notFound.getReason());
        verify(spinRepository, never()).save(any());
    }

    private Spin spin(String id, String sessionId) {
        return Spin.builder()
                .id(id)
                .userId("user-1")
                .sessionId(sessionId)
                .stakeAmount(new BigDecimal("10"))
                .metadata(Map.of("client", "web"))
                .build();
    }

    private NormalizedContractEvent event(String id, ObjectNode payload) {
        return NormalizedContractEvent.builder()
                .id(id)
                .ledger(800L)
                .txHash("tx-" + id)
                .topics(List.of("spin", "reward"))
                .payload(payload)
                .ledgerClosedAt(LocalDateTime.of(2024, 6, 1, 12, 0))
                .build();
    }
}
