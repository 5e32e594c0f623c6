package com.spinbet.ledgersync.entity;

public enum TransactionType {
    BET_PLACEMENT,
    BET_WINNING,
    BET_CANCELLATION,
    WALLET_DEPOSIT,
    WALLET_WITHDRAWAL,
    STAKING_REWARD,
    STAKING_PENALTY
}
