package com.spinbet.ledgersync.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

/**
 * A staking event increased a user's wallet balance.
 */
@Data
@AllArgsConstructor
public class StakeCreditedEvent {

    private String userId;

    private BigDecimal stakedAmount;

    private BigDecimal rewardAmount;
}
