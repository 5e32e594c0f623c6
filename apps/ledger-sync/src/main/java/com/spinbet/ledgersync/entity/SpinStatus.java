package com.spinbet.ledgersync.entity;

public enum SpinStatus {
    PENDING,
    COMPLETED,
    FAILED
}
