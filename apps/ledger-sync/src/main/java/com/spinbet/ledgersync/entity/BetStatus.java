package com.spinbet.ledgersync.entity;

public enum BetStatus {
    PENDING,
    WON,
    LOST,
    CANCELLED
}
