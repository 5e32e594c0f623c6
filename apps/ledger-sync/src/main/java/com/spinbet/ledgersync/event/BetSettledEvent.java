package com.spinbet.ledgersync.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A bet was settled as won or lost. Cancellations are not published.
 */
@Data
@AllArgsConstructor
public class BetSettledEvent {

    private String userId;

    private String betId;

    private String matchId;

    private boolean win;

    private BigDecimal stakeAmount;

    private BigDecimal payoutAmount;

    private LocalDateTime settledAt;
}
