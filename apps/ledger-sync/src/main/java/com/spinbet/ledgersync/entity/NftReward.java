package com.spinbet.ledgersync.entity;

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
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "nft_rewards",
        uniqueConstraints = @UniqueConstraint(name = "uq_nft_rewards_contract_nft",
                columnNames = {"nft_contract_address", "nft_id"}),
        indexes = @Index(name = "idx_nft_rewards_user_id", columnList = "user_id"))
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NftReward {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "nft_contract_address", nullable = false)
    private String nftContractAddress;

    @Column(name = "nft_id", nullable = false)
    private String nftId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private NftTier tier = NftTier.COMMON;

    @Column(name = "is_minted", nullable = false)
    @Builder.Default
    private Boolean isMinted = false;

    @Column(name = "mint_transaction_hash")
    private String mintTransactionHash;

    @Column(name = "claimed_at")
    private LocalDateTime claimedAt;

    @Column(name = "metadata_uri")
    private String metadataUri;

    @Column(name = "spin_game_id")
    private String spinGameId;

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
