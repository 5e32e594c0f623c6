package com.spinbet.ledgersync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.spinbet.ledgersync.config.StellarRpcProperties;
import com.spinbet.ledgersync.entity.NftReward;
import com.spinbet.ledgersync.entity.NftTier;
import com.spinbet.ledgersync.modules.chains.events.ContractEventHandler;
import com.spinbet.ledgersync.modules.chains.events.EventHandlingResult;
import com.spinbet.ledgersync.modules.chains.model.ContractEventType;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.repository.NftRewardRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.spinbet.ledgersync.modules.chains.events.PayloadReader.readString;

/**
 * NFT 铸造事件同步处理器
 * Upserts the NFT reward keyed by (contract address, nft id) and marks it minted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NftMintSyncHandler implements ContractEventHandler {

    static final List<String> USER_KEYS = List.of("userId", "user_id", "owner", "recipient");
    static final List<String> NFT_KEYS = List.of("nftId", "nft_id", "tokenId", "token_id", "assetId", "asset_id");
    static final List<String> CONTRACT_KEYS = List.of(
            "nftContractAddress", "nft_contract_address", "contractAddress", "contract_address");
    static final List<String> METADATA_URI_KEYS = List.of("metadataUri", "metadata_uri", "tokenUri", "token_uri");
    static final List<String> TIER_KEYS = List.of("tier", "rarity");
    static final List<String> SPIN_GAME_KEYS = List.of("spinGameId", "spin_game_id", "spinId", "spin_id");

    private final NftRewardRepository nftRewardRepository;
    private final StellarRpcProperties stellarProperties;

    @Override
    public ContractEventType supports() {
        return ContractEventType.NFT_MINT;
    }

    @Override
    public EventHandlingResult handle(NormalizedContractEvent event) {
        JsonNode payload = event.getPayload();

        Optional<String> userId = nonBlank(payload, USER_KEYS);
        Optional<String> nftId = nonBlank(payload, NFT_KEYS);
        if (userId.isEmpty() || nftId.isEmpty()) {
            return EventHandlingResult.skipped("nft mint event missing userId or nftId");
        }

        String contractAddress = nonBlank(payload, CONTRACT_KEYS)
                .or(() -> Optional.ofNullable(event.getContractId()).filter(value -> !value.isBlank()))
                .orElse(stellarProperties.getContractId());
        Optional<String> metadataUri = nonBlank(payload, METADATA_URI_KEYS);
        Optional<String> spinGameId = nonBlank(payload, SPIN_GAME_KEYS);
        NftTier tier = parseTier(readString(payload, TIER_KEYS).orElse(null));

        NftReward reward = nftRewardRepository.findByNftContractAddressAndNftId(contractAddress, nftId.get())
                .orElseGet(() -> NftReward.builder()
                        .nftContractAddress(contractAddress)
                        .nftId(nftId.get())
                        .build());

        reward.setUserId(userId.get());
        reward.setTier(tier);
        reward.setIsMinted(true);
        reward.setMintTransactionHash(event.getTxHash());
        reward.setClaimedAt(LocalDateTime.now());
        metadataUri.ifPresent(reward::setMetadataUri);
        spinGameId.ifPresent(reward::setSpinGameId);
        nftRewardRepository.save(reward);

        log.debug("Marked NFT {}/{} minted for user {}", contractAddress, nftId.get(), userId.get());
        return EventHandlingResult.processed();
    }

    static NftTier parseTier(String value) {
        if (value == null || value.isBlank()) {
            return NftTier.COMMON;
        }
        try {
            return NftTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NftTier.COMMON;
        }
    }

    private static Optional<String> nonBlank(JsonNode payload, List<String> keys) {
        return readString(payload, keys).filter(value -> !value.isBlank());
    }
}
