package com.spinbet.ledgersync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Entity
@Table(name = "spin_sessions", indexes = {
        @Index(name = "idx_spin_sessions_tx_reference", columnList = "tx_reference")
})
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpinSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id")
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private SpinSessionStatus status = SpinSessionStatus.PENDING;

    @Column(name = "tx_reference")
    private String txReference;

    /**
     * Session state that mirrors a spin status.
     */
    public static SpinSessionStatus mirrorOf(SpinStatus spinStatus) {
        return switch (spinStatus) {
            case COMPLETED -> SpinSessionStatus.COMPLETED;
            case FAILED -> SpinSessionStatus.FAILED;
            default -> SpinSessionStatus.PENDING;
        };
    }
}
