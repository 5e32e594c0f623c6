package com.spinbet.ledgersync.entity;

public enum SpinOutcome {
    JACKPOT,
    HIGH_WIN,
    MEDIUM_WIN,
    SMALL_WIN,
    NO_WIN
}
