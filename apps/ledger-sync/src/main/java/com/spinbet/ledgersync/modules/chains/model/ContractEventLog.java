package com.spinbet.ledgersync.modules.chains.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * One row per distinct contract event id, mapped to contract_event_logs.
 * The unique event id is the primary dedup key of the ingestion pipeline.
 */
@Entity
@Table(name = "contract_event_logs", indexes = {
        @Index(name = "uq_contract_event_logs_event_id", columnList = "event_id", unique = true),
        @Index(name = "idx_contract_event_logs_event_type", columnList = "event_type"),
        @Index(name = "idx_contract_event_logs_status", columnList = "status"),
        @Index(name = "idx_contract_event_logs_ledger", columnList = "ledger"),
        @Index(name = "idx_contract_event_logs_tx_hash", columnList = "tx_hash"),
        @Index(name = "idx_contract_event_logs_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContractEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "event_id", nullable = false, length = 128)
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    @Builder.Default
    private ContractEventType eventType = ContractEventType.UNKNOWN;

    @Column(nullable = false)
    private Long ledger;

    @Column(name = "tx_hash", length = 128)
    private String txHash;

    @Column(length = 255)
    private String cursor;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private List<String> topics;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private ContractEventStatus status = ContractEventStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private Integer attempts = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
