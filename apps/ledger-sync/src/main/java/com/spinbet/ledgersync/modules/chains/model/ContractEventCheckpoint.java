package com.spinbet.ledgersync.modules.chains.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Durable ingestion progress of the contract event listener.
 * Mapped to contract_event_checkpoints; one row per listener identity, never deleted.
 */
@Entity
@Table(name = "contract_event_checkpoints", indexes = {
        @Index(name = "idx_contract_event_checkpoints_last_ledger", columnList = "last_ledger")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContractEventCheckpoint {

    @Id
    @Column(length = 64)
    private String id;

    @Column(length = 255)
    private String cursor;

    @Column(name = "last_ledger", nullable = false)
    @Builder.Default
    private Long lastLedger = 0L;

    @Column(name = "last_polled_at")
    private LocalDateTime lastPolledAt;

    @Column(name = "last_event_at")
    private LocalDateTime lastEventAt;

    @Column(name = "reconnect_count", nullable = false)
    @Builder.Default
    private Integer reconnectCount = 0;

    @Column(name = "total_processed", nullable = false)
    @Builder.Default
    private Long totalProcessed = 0L;

    @Column(name = "total_skipped", nullable = false)
    @Builder.Default
    private Long totalSkipped = 0L;

    @Column(name = "total_failed", nullable = false)
    @Builder.Default
    private Long totalFailed = 0L;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
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
}
