package com.spinbet.ledgersync.event;

import com.spinbet.ledgersync.entity.SpinOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A spin reached the completed state from an on-chain reward event.
 */
@Data
@AllArgsConstructor
public class SpinSettledEvent {

    private String userId;

    private String spinId;

    private SpinOutcome outcome;

    private BigDecimal stakeAmount;

    private BigDecimal payoutAmount;

    private boolean win;

    private LocalDateTime settledAt;
}
