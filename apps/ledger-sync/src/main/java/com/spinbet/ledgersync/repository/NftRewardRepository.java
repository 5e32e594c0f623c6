package com.spinbet.ledgersync.repository;

import com.spinbet.ledgersync.entity.NftReward;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface NftRewardRepository extends JpaRepository<NftReward, String> {

    /**
     * Find reward by its upsert key.
     */
    Optional<NftReward> findByNftContractAddressAndNftId(String nftContractAddress, String nftId);
}
