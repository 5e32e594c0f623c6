package com.spinbet.ledgersync.entity;

public enum NftTier {
    COMMON,
    RARE,
    EPIC,
    LEGENDARY
}
