package com.spinbet.ledgersync.entity;

public enum SpinSessionStatus {
    PENDING,
    COMPLETED,
    FAILED
}
