package com.spinbet.ledgersync.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
public class StakeDebitedEvent {

    private String userId;

    /**
     * Absolute value of the debited amount.
     */
    private BigDecimal amount;

    private String action;
}
