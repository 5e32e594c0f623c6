package com.spinbet.ledgersync.entity;

public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REVERSED
}
